package br.edu.ifba.deduper.candidate;

import br.edu.ifba.deduper.bucket.BucketKey;
import br.edu.ifba.deduper.core.FilePair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * Two files worth scoring.
 *
 * @param pair the files, normalized
 * @param bucket bucket of the file the pair was found from
 * @param hashDistance index distance (max aligned frame distance for video), null when found without the index
 * @param alignment per-frame alignment for video pairs (nullable)
 */
public record CandidatePair(
    @NotNull FilePair pair,
    @NotNull BucketKey bucket,
    @Nullable Integer hashDistance,
    @Nullable FrameAlignment alignment
) implements Comparable<CandidatePair> {

    private static final Comparator<CandidatePair> ORDER = Comparator
        .comparing((CandidatePair c) -> c.pair().first())
        .thenComparing(c -> c.pair().second());

    public CandidatePair {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
    }

    public boolean truncated() {
        return alignment != null && alignment.truncated();
    }

    @Override
    public int compareTo(@NotNull CandidatePair other) {
        return ORDER.compare(this, other);
    }
}
