package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * One file inside a duplicate group, with the evidence tying it to the group.
 *
 * @param fileId file id
 * @param confidence aggregate confidence [0.0, 1.0]
 * @param signals strongest signal per key across the member's in-group pairs
 * @param penalties penalties for signals that could not be computed
 * @param rationale flattened textual trail
 * @param fileSize size in bytes
 */
public record DuplicateGroupMember(
    @NotNull String fileId,
    double confidence,
    @NotNull List<ConfidenceSignal> signals,
    @NotNull List<ConfidencePenalty> penalties,
    @NotNull List<String> rationale,
    long fileSize
) {

    public DuplicateGroupMember {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("fileId cannot be null or blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0]");
        }
        signals = signals == null ? List.of() : List.copyOf(signals);
        penalties = penalties == null ? List.of() : List.copyOf(penalties);
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    public boolean hasPenalty(@NotNull PenaltyKey key) {
        return penalties.stream().anyMatch(p -> p.key() == key);
    }
}
