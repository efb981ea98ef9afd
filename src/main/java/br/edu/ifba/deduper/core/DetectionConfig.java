package br.edu.ifba.deduper.core;

import br.edu.ifba.deduper.exception.ConfigurationException;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Configuration for duplicate detection.
 *
 * All properties are read from application.properties with the prefix
 * "deduper.detection". The engine never reads this directly; the service
 * converts it once with {@link #toOptions()}.
 */
@ConfigMapping(prefix = "deduper.detection")
public interface DetectionConfig {

    /**
     * Threshold configuration group.
     */
    Threshold thresholds();

    /**
     * Weight configuration group.
     */
    Weight weights();

    /**
     * Limits configuration group.
     */
    Limits limits();

    /**
     * Keeper configuration group.
     */
    Keeper keeper();

    /**
     * How member confidences fold into the group confidence.
     * Default: MINIMUM
     */
    @WithName("group-confidence")
    @WithDefault("MINIMUM")
    GroupConfidenceMode groupConfidenceMode();

    /**
     * Validates configuration at startup.
     *
     * @throws ConfigurationException if any value is invalid
     */
    default void validate() {
        toOptions().validate();
    }

    default DetectOptions toOptions() {
        Threshold t = thresholds();
        Thresholds thresholds = new Thresholds(
            t.imageDistance(),
            t.videoFrameDistance(),
            t.durationTolerancePct(),
            t.nameSimilarity(),
            new DistanceBand(t.confirmationBandLower(), t.confirmationBandUpper()),
            t.confirmationHashDistance()
        );
        Weight w = weights();
        SignalWeights weights = new SignalWeights(
            w.checksum(), w.hash(), w.name(), w.captureTime(), w.duration(), w.metadata()
        );
        Limits l = limits();
        DetectionLimits limits = new DetectionLimits(
            l.sizeTolerancePct(), l.indexFallbackBucketSize(), l.maxComparisonsPerBucket(),
            l.batchSize(), l.maxParallelism()
        );
        return DetectOptions.builder()
            .thresholds(thresholds)
            .weights(weights)
            .limits(limits)
            .groupConfidenceMode(groupConfidenceMode())
            .formatPreference(keeper().formatPreference())
            .build();
    }

    interface Threshold {
        /**
         * Max Hamming distance for photo duplicates.
         * Default: 5
         */
        @WithDefault("5")
        @Min(0)
        @Max(64)
        int imageDistance();

        /**
         * Max aligned keyframe Hamming distance for video duplicates.
         * Default: 5
         */
        @WithDefault("5")
        @Min(0)
        @Max(64)
        int videoFrameDistance();

        @WithDefault("0.02")
        double durationTolerancePct();

        /**
         * Name similarity needed to compare files without a perceptual hash [0.0, 1.0].
         * Default: 0.5
         */
        @WithDefault("0.5")
        double nameSimilarity();

        @WithName("confirmation-band.lower")
        @WithDefault("4")
        @Min(0)
        int confirmationBandLower();

        @WithName("confirmation-band.upper")
        @WithDefault("6")
        @Min(0)
        int confirmationBandUpper();

        /**
         * Max secondary hash distance that confirms a borderline pair.
         * Default: 8
         */
        @WithDefault("8")
        @Min(0)
        @Max(64)
        int confirmationHashDistance();
    }

    interface Weight {
        @WithDefault("1.0")
        double checksum();

        @WithDefault("0.4")
        double hash();

        @WithDefault("0.3")
        double name();

        @WithDefault("0.2")
        double captureTime();

        @WithDefault("0.2")
        double duration();

        @WithDefault("0.1")
        double metadata();
    }

    interface Limits {
        @WithDefault("0.05")
        double sizeTolerancePct();

        /**
         * Buckets larger than this are scanned linearly instead of indexed.
         * Default: 20000
         */
        @WithDefault("20000")
        @Min(2)
        int indexFallbackBucketSize();

        /**
         * Comparison budget per bucket, 0 for unlimited.
         */
        @WithDefault("0")
        @Min(0)
        long maxComparisonsPerBucket();

        @WithDefault("512")
        @Min(1)
        int batchSize();

        @WithDefault("4")
        @Min(1)
        int maxParallelism();
    }

    interface Keeper {
        /**
         * Format families, most preferred first.
         */
        @WithDefault("raw,tiff,png,heic,jpeg")
        List<String> formatPreference();
    }
}
