package br.edu.ifba.deduper.cluster;

import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.SimilarPair;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Groups and held-back pairs of one clustering pass.
 *
 * @param groups groups sorted by confidence descending, then first member id
 * @param similarPairs pairs retained as similar but not duplicate
 */
public record ClusteringResult(
    @NotNull List<DuplicateGroupResult> groups,
    @NotNull List<SimilarPair> similarPairs
) {

    public ClusteringResult {
        groups = List.copyOf(groups);
        similarPairs = List.copyOf(similarPairs);
    }

    public long incompleteGroups() {
        return groups.stream().filter(DuplicateGroupResult::incomplete).count();
    }
}
