package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.evidence.EvidenceItem;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Explanation of why a group was formed.
 *
 * @param groupId group id
 * @param mediaType media type
 * @param confidence group confidence
 * @param keeperSuggestion suggested keeper (nullable)
 * @param incomplete whether the group is incomplete
 * @param rationaleLines group-level rationale
 * @param evidence evidence summarized over all members
 * @param memberEvidence evidence per member id, in member order
 */
public record GroupRationale(
    @NotNull String groupId,
    @NotNull MediaType mediaType,
    double confidence,
    @Nullable String keeperSuggestion,
    boolean incomplete,
    @NotNull List<String> rationaleLines,
    @NotNull List<EvidenceItem> evidence,
    @NotNull Map<String, List<EvidenceItem>> memberEvidence
) {
}
