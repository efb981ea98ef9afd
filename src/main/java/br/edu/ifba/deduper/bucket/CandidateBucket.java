package br.edu.ifba.deduper.bucket;

import br.edu.ifba.deduper.core.FileRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Files sharing a bucket key. Files without a perceptual hash are kept apart
 * so they skip the neighbor index but can still match on other signals.
 *
 * @param key bucket key
 * @param hashed records with a perceptual hash, sorted by id
 * @param unhashed records without a perceptual hash, sorted by id
 */
public record CandidateBucket(
    @NotNull BucketKey key,
    @NotNull List<FileRecord> hashed,
    @NotNull List<FileRecord> unhashed
) {

    public CandidateBucket {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        hashed = hashed == null ? List.of() : List.copyOf(hashed);
        unhashed = unhashed == null ? List.of() : List.copyOf(unhashed);
    }

    public int size() {
        return hashed.size() + unhashed.size();
    }

    public boolean hasUnhashed() {
        return !unhashed.isEmpty();
    }
}
