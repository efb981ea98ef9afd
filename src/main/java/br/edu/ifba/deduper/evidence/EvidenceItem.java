package br.edu.ifba.deduper.evidence;

import org.jetbrains.annotations.NotNull;

/**
 * One row of human-auditable evidence.
 *
 * @param id signal key, or {@code penalty_<key>} for penalties
 * @param label human-readable label
 * @param distanceText measured value in its unit
 * @param thresholdText threshold in the same unit
 * @param verdict pass, warn or fail
 * @param contribution signal contribution, or the (negative) penalty value
 */
public record EvidenceItem(
    @NotNull String id,
    @NotNull String label,
    @NotNull String distanceText,
    @NotNull String thresholdText,
    @NotNull Verdict verdict,
    double contribution
) {

    public static final String PENALTY_PREFIX = "penalty_";

    public EvidenceItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (label == null || distanceText == null || thresholdText == null) {
            throw new IllegalArgumentException("texts cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
    }

    public boolean isPenalty() {
        return id.startsWith(PENALTY_PREFIX);
    }
}
