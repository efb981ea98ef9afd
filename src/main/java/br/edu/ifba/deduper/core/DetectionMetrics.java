package br.edu.ifba.deduper.core;

import java.time.Duration;
import java.util.Locale;

/**
 * Statistics for one detection run.
 *
 * @param totalFiles number of input records
 * @param bucketCount number of size-class buckets
 * @param averageBucketSize average records per bucket
 * @param degradedBuckets buckets that fell back to a linear scan
 * @param candidatePairs distinct candidate pairs produced
 * @param comparisonsPerformed distance or similarity comparisons performed
 * @param similarPairs pairs retained as similar but not duplicate
 * @param groupCount emitted groups
 * @param incompleteGroups emitted groups flagged incomplete
 * @param elapsed wall-clock duration
 */
public record DetectionMetrics(
    int totalFiles,
    int bucketCount,
    double averageBucketSize,
    int degradedBuckets,
    long candidatePairs,
    long comparisonsPerformed,
    int similarPairs,
    int groupCount,
    int incompleteGroups,
    Duration elapsed
) {

    public DetectionMetrics {
        if (totalFiles < 0 || bucketCount < 0 || degradedBuckets < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        if (candidatePairs < 0 || comparisonsPerformed < 0) {
            throw new IllegalArgumentException("pair counts cannot be negative");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
    }

    /**
     * Comparisons an all-pairs scan would need: n(n-1)/2.
     */
    public long naiveComparisons() {
        return (long) totalFiles * (totalFiles - 1) / 2;
    }

    /**
     * Percentage of the naive comparisons avoided, never below zero.
     *
     * <p>Index probes and pair scoring both count as comparisons, so tiny
     * scans can exceed the naive count.</p>
     */
    public double reductionPercent() {
        long naive = naiveComparisons();
        if (naive == 0) return 0.0;
        return Math.max(0.0, 100.0 * (1.0 - (double) comparisonsPerformed / naive));
    }

    public String toLogString() {
        return String.format(Locale.ROOT,
            "Detection: %d files | %d buckets (avg %.1f, %d degraded) | %d candidates | %d comparisons (%.1f%% fewer than %d) | %d groups (%d incomplete) | %d similar | %dms",
            totalFiles, bucketCount, averageBucketSize, degradedBuckets, candidatePairs,
            comparisonsPerformed, reductionPercent(), naiveComparisons(),
            groupCount, incompleteGroups, similarPairs, elapsed.toMillis()
        );
    }
}
