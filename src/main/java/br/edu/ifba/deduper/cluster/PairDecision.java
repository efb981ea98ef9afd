package br.edu.ifba.deduper.cluster;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of judging one scored pair.
 *
 * @param outcome what to do with the pair
 * @param reason short explanation
 */
public record PairDecision(@NotNull Outcome outcome, @NotNull String reason) {

    public enum Outcome {
        /** Union the pair. */
        DUPLICATE,
        /** Keep out of groups but retain for manual review. */
        SIMILAR,
        REJECTED
    }

    public static PairDecision duplicate(String reason) {
        return new PairDecision(Outcome.DUPLICATE, reason);
    }

    public static PairDecision similar(String reason) {
        return new PairDecision(Outcome.SIMILAR, reason);
    }

    public static PairDecision rejected(String reason) {
        return new PairDecision(Outcome.REJECTED, reason);
    }

    public boolean isDuplicate() {
        return outcome == Outcome.DUPLICATE;
    }
}
