package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One weighted piece of duplicate evidence.
 *
 * @param key signal kind
 * @param weight configured importance [0.0, 1.0]
 * @param rawScore normalized match strength [0.0, 1.0], 1.0 is a perfect match
 * @param contribution {@code weight * rawScore}
 * @param rationale human-readable description, e.g. "dHash distance=5"
 * @param measurement raw measured quantity in the signal's unit (distance, seconds, relative delta), if any
 * @param threshold threshold the measurement is judged against, in the same unit, if any
 */
public record ConfidenceSignal(
    @NotNull SignalKey key,
    double weight,
    double rawScore,
    double contribution,
    @NotNull String rationale,
    @Nullable Double measurement,
    @Nullable Double threshold
) {

    private static final double EPSILON = 1e-9;

    public ConfidenceSignal {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be in [0.0, 1.0]");
        }
        if (rawScore < 0.0 || rawScore > 1.0) {
            throw new IllegalArgumentException("rawScore must be in [0.0, 1.0]");
        }
        if (contribution < -EPSILON || contribution > weight + EPSILON) {
            throw new IllegalArgumentException("contribution must be in [0.0, weight]");
        }
        if (rationale == null) {
            throw new IllegalArgumentException("rationale cannot be null");
        }
    }

    /**
     * Builds a signal, clamping the raw score and deriving the contribution.
     */
    public static ConfidenceSignal of(
        @NotNull SignalKey key,
        double weight,
        double rawScore,
        @NotNull String rationale,
        @Nullable Double measurement,
        @Nullable Double threshold
    ) {
        double clamped = Math.max(0.0, Math.min(1.0, rawScore));
        return new ConfidenceSignal(key, weight, clamped, weight * clamped, rationale, measurement, threshold);
    }

    public static ConfidenceSignal of(@NotNull SignalKey key, double weight, double rawScore, @NotNull String rationale) {
        return of(key, weight, rawScore, rationale, null, null);
    }
}
