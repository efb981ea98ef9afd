package br.edu.ifba.deduper.core;

import br.edu.ifba.deduper.exception.ConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * Configured importance of each signal, each in [0.0, 1.0].
 *
 * Weights are independent and do not need to sum to 1.0: the aggregate is clamped.
 */
public record SignalWeights(
    double checksum,
    double hash,
    double name,
    double captureTime,
    double duration,
    double metadata
) {

    public static SignalWeights defaults() {
        return new SignalWeights(1.0, 0.4, 0.3, 0.2, 0.2, 0.1);
    }

    public double weightFor(@NotNull SignalKey key) {
        return switch (key) {
            case CHECKSUM -> checksum;
            case HASH -> hash;
            case NAME -> name;
            case CAPTURE_TIME -> captureTime;
            case DURATION -> duration;
            case METADATA -> metadata;
        };
    }

    public SignalWeights withHash(double weight) {
        return new SignalWeights(checksum, weight, name, captureTime, duration, metadata);
    }

    public void validate() {
        for (SignalKey key : SignalKey.values()) {
            double weight = weightFor(key);
            if (!(weight >= 0.0 && weight <= 1.0)) {
                throw new ConfigurationException(
                    String.format("weight for %s must be in [0.0, 1.0], got %.3f", key.id(), weight)
                );
            }
        }
    }
}
