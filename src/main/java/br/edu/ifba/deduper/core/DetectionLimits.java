package br.edu.ifba.deduper.core;

import br.edu.ifba.deduper.exception.ConfigurationException;

/**
 * Resource limits for a detection run.
 *
 * @param sizeTolerancePct width of a size class, as a fraction of the file size
 * @param indexFallbackBucketSize bucket size above which the neighbor index degrades to a linear scan
 * @param maxComparisonsPerBucket comparison budget per bucket, 0 for unlimited
 * @param batchSize candidate pairs per scoring batch
 * @param maxParallelism upper bound for the worker pool
 */
public record DetectionLimits(
    double sizeTolerancePct,
    int indexFallbackBucketSize,
    long maxComparisonsPerBucket,
    int batchSize,
    int maxParallelism
) {

    public static DetectionLimits defaults() {
        return new DetectionLimits(0.05, 20_000, 0, 512, 4);
    }

    public boolean hasComparisonBudget() {
        return maxComparisonsPerBucket > 0;
    }

    public DetectionLimits withIndexFallbackBucketSize(int size) {
        return new DetectionLimits(sizeTolerancePct, size, maxComparisonsPerBucket, batchSize, maxParallelism);
    }

    public DetectionLimits withMaxComparisonsPerBucket(long budget) {
        return new DetectionLimits(sizeTolerancePct, indexFallbackBucketSize, budget, batchSize, maxParallelism);
    }

    public DetectionLimits withMaxParallelism(int parallelism) {
        return new DetectionLimits(sizeTolerancePct, indexFallbackBucketSize, maxComparisonsPerBucket, batchSize, parallelism);
    }

    public void validate() {
        if (!(sizeTolerancePct > 0.0 && sizeTolerancePct < 1.0)) {
            throw new ConfigurationException(
                String.format("sizeTolerancePct must be in (0.0, 1.0), got %.3f", sizeTolerancePct)
            );
        }
        if (indexFallbackBucketSize < 2) {
            throw new ConfigurationException("indexFallbackBucketSize must be at least 2, got " + indexFallbackBucketSize);
        }
        if (maxComparisonsPerBucket < 0) {
            throw new ConfigurationException("maxComparisonsPerBucket cannot be negative, got " + maxComparisonsPerBucket);
        }
        if (batchSize < 1) {
            throw new ConfigurationException("batchSize must be positive, got " + batchSize);
        }
        if (maxParallelism < 1) {
            throw new ConfigurationException("maxParallelism must be positive, got " + maxParallelism);
        }
    }
}
