package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.bucket.BucketKey;
import org.jetbrains.annotations.NotNull;

/**
 * Preview of one bucket before scoring.
 *
 * @param key bucket key
 * @param hashedFiles files going through the neighbor index
 * @param unhashedFiles files compared by name
 * @param estimatedComparisons rough comparison count for the chosen strategy
 * @param strategy how the bucket will be searched
 */
public record BucketStats(
    @NotNull BucketKey key,
    int hashedFiles,
    int unhashedFiles,
    long estimatedComparisons,
    @NotNull Strategy strategy
) {

    public enum Strategy {
        BK_TREE,
        LINEAR_SCAN,
        NAME_SCAN
    }

    public int totalFiles() {
        return hashedFiles + unhashedFiles;
    }
}
