package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;

/**
 * Negative contribution recorded when a signal could not be computed.
 *
 * @param key penalty kind
 * @param value negative contribution
 * @param rationale human-readable description
 */
public record ConfidencePenalty(
    @NotNull PenaltyKey key,
    double value,
    @NotNull String rationale
) {

    public ConfidencePenalty {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value > 0.0) {
            throw new IllegalArgumentException("penalty value cannot be positive");
        }
        if (rationale == null) {
            throw new IllegalArgumentException("rationale cannot be null");
        }
    }

    public static ConfidencePenalty of(@NotNull PenaltyKey key, @NotNull String rationale) {
        return new ConfidencePenalty(key, key.value(), rationale);
    }
}
