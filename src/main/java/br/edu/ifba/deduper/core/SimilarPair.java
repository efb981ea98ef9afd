package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;

/**
 * A pair that looked alike but did not qualify as a duplicate. Kept for manual review.
 *
 * @param pair the two files
 * @param mediaType media type of both files
 * @param confidence pairwise confidence
 * @param reason why the pair was held back
 */
public record SimilarPair(
    @NotNull FilePair pair,
    @NotNull MediaType mediaType,
    double confidence,
    @NotNull String reason
) {

    public SimilarPair {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        if (mediaType == null) {
            throw new IllegalArgumentException("mediaType cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public String toLogString() {
        return String.format("Similar %s [%s] %.3f: %s", pair, mediaType, confidence, reason);
    }
}
