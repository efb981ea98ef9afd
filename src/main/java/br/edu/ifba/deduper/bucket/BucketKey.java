package br.edu.ifba.deduper.bucket;

import br.edu.ifba.deduper.core.MediaType;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * Coarse partition key: media type plus logarithmic size class.
 *
 * @param mediaType media type of every file in the bucket
 * @param sizeClass size class index, see {@link CandidateBucketer#sizeClass(long, double)}
 */
public record BucketKey(@NotNull MediaType mediaType, int sizeClass) implements Comparable<BucketKey> {

    private static final Comparator<BucketKey> ORDER = Comparator
        .comparing(BucketKey::mediaType)
        .thenComparingInt(BucketKey::sizeClass);

    public BucketKey {
        if (mediaType == null) {
            throw new IllegalArgumentException("mediaType cannot be null");
        }
    }

    /**
     * The next larger size class of the same media type.
     */
    public BucketKey next() {
        return new BucketKey(mediaType, sizeClass + 1);
    }

    public BucketKey previous() {
        return new BucketKey(mediaType, sizeClass - 1);
    }

    @Override
    public int compareTo(@NotNull BucketKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return mediaType + "#" + sizeClass;
    }
}
