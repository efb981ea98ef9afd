package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.core.CancellationToken;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.DetectionConfig;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.ResourcePressure;
import br.edu.ifba.deduper.evidence.EvidenceFormatter;
import br.edu.ifba.deduper.evidence.EvidenceItem;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for callers running inside the container.
 *
 * <p>Validates the configured options once on startup and runs every scan
 * with them unless the caller passes its own.</p>
 */
@ApplicationScoped
@Startup
public class DuplicateDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetectionService.class);

    @Inject
    DetectionConfig config;

    @Inject
    DuplicateDetectionEngine engine;

    @Inject
    EvidenceFormatter evidenceFormatter;

    private volatile DetectOptions options;

    /**
     * Validates detection configuration on startup.
     *
     * @param event the startup event
     * @throws br.edu.ifba.deduper.exception.ConfigurationException if configuration is invalid
     */
    void onStart(@Observes StartupEvent event) {
        logger.info("Validating duplicate detection configuration...");
        config.validate();
        options = config.toOptions();
        logger.info("Duplicate detection ready: imageDistance={}, videoFrameDistance={}, band={}, maxParallelism={}",
            options.thresholds().imageDistance(), options.thresholds().videoFrameDistance(),
            options.thresholds().confirmationBand(), options.limits().maxParallelism());
    }

    /**
     * Options built from configuration.
     */
    public DetectOptions defaultOptions() {
        DetectOptions current = options;
        if (current == null) {
            current = config.toOptions();
            current.validate();
            options = current;
        }
        return current;
    }

    public DetectionRun detect(@NotNull List<FileRecord> records) {
        return engine.detect(records, defaultOptions());
    }

    public DetectionRun detect(
            @NotNull List<FileRecord> records,
            @NotNull ResourcePressure pressure,
            @NotNull CancellationToken token) {
        return engine.detect(records, defaultOptions(), pressure, token);
    }

    public DetectionRun detect(@NotNull List<FileRecord> records, @NotNull DetectOptions options) {
        return engine.detect(records, options);
    }

    public DetectionRun rerank(@NotNull DetectionRun previous, @NotNull DetectOptions options) {
        return engine.rerank(previous, options);
    }

    public List<BucketStats> previewBuckets(@NotNull List<FileRecord> records) {
        return engine.previewBuckets(records, defaultOptions());
    }

    /**
     * Group evidence for display, summarized across all members.
     */
    public List<EvidenceItem> evidence(@NotNull DuplicateGroupResult group) {
        return evidenceFormatter.summarize(group);
    }
}
