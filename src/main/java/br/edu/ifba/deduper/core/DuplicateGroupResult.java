package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * A group of two or more files judged to be duplicates of each other.
 *
 * @param groupId deterministic id derived from the member ids
 * @param mediaType media type shared by all members
 * @param members members sorted by file id
 * @param confidence group confidence, see {@link GroupConfidenceMode}
 * @param rationaleLines group-level rationale, including every missing signal and partial extraction
 * @param keeperSuggestion suggested file to keep (nullable)
 * @param incomplete true if any member's data was partial or the run was cut short
 */
public record DuplicateGroupResult(
    @NotNull String groupId,
    @NotNull MediaType mediaType,
    @NotNull List<DuplicateGroupMember> members,
    double confidence,
    @NotNull List<String> rationaleLines,
    @Nullable String keeperSuggestion,
    boolean incomplete
) {

    public DuplicateGroupResult {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (mediaType == null) {
            throw new IllegalArgumentException("mediaType cannot be null");
        }
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("a duplicate group needs at least two members");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0]");
        }
        members = List.copyOf(members);
        rationaleLines = rationaleLines == null ? List.of() : List.copyOf(rationaleLines);
    }

    public Optional<DuplicateGroupMember> member(@NotNull String fileId) {
        return members.stream().filter(m -> m.fileId().equals(fileId)).findFirst();
    }

    public List<String> memberIds() {
        return members.stream().map(DuplicateGroupMember::fileId).toList();
    }

    /**
     * Bytes reclaimable when only the keeper is retained. Without a keeper the
     * largest member is assumed to stay.
     */
    public long spacePotentialSaved() {
        long total = members.stream().mapToLong(DuplicateGroupMember::fileSize).sum();
        long kept = keeperSuggestion != null
            ? member(keeperSuggestion).map(DuplicateGroupMember::fileSize).orElse(0L)
            : members.stream().mapToLong(DuplicateGroupMember::fileSize).max().orElse(0L);
        return total - kept;
    }

    public String toLogString() {
        return String.format(
            "Group %s [%s]: %d members, confidence %.3f, keeper=%s%s",
            groupId, mediaType, members.size(), confidence, keeperSuggestion,
            incomplete ? " (incomplete)" : ""
        );
    }
}
