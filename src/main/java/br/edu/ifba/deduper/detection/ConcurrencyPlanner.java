package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.core.DetectionLimits;
import br.edu.ifba.deduper.core.ResourcePressure;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the worker pool size for a scan.
 *
 * The degree starts at min(maxParallelism, available processors) and shrinks
 * linearly with the caller's peak resource pressure, never below 1.
 */
@ApplicationScoped
public class ConcurrencyPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyPlanner.class);

    public int degree(@NotNull DetectionLimits limits, @NotNull ResourcePressure pressure) {
        return degree(limits.maxParallelism(), Runtime.getRuntime().availableProcessors(), pressure);
    }

    int degree(int maxParallelism, int processors, ResourcePressure pressure) {
        int ceiling = Math.max(1, Math.min(maxParallelism, processors));
        int degree = Math.max(1, (int) Math.floor(ceiling * (1.0 - pressure.peak())));
        if (degree < ceiling) {
            logger.debug("Resource pressure cpu={} memory={}: parallelism reduced from {} to {}",
                pressure.cpu(), pressure.memory(), ceiling, degree);
        }
        return degree;
    }
}
