package br.edu.ifba.deduper.candidate;

import br.edu.ifba.deduper.bucket.BucketKey;
import br.edu.ifba.deduper.core.MediaType;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Candidate pairs of a scan plus what is needed to judge their completeness.
 *
 * @param pairs distinct pairs sorted by file ids
 * @param searchRadius radius each media type was queried with
 * @param exhaustedBuckets buckets that hit the comparison budget
 * @param degradedBuckets buckets scanned linearly instead of through a tree
 * @param comparisons distance and similarity computations performed
 * @param cancelled true if generation stopped early
 */
public record CandidateSet(
    @NotNull List<CandidatePair> pairs,
    @NotNull Map<MediaType, Integer> searchRadius,
    @NotNull Set<BucketKey> exhaustedBuckets,
    int degradedBuckets,
    long comparisons,
    boolean cancelled
) {

    public CandidateSet {
        pairs = List.copyOf(pairs);
        searchRadius = Map.copyOf(searchRadius);
        exhaustedBuckets = Set.copyOf(exhaustedBuckets);
    }

    public int radiusFor(@NotNull MediaType mediaType) {
        return searchRadius.getOrDefault(mediaType, 0);
    }
}
