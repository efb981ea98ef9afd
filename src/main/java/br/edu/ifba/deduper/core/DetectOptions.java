package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The complete tunable contract of a detection run.
 *
 * @param thresholds distance and similarity thresholds
 * @param weights signal weights
 * @param limits resource limits
 * @param groupConfidenceMode member to group confidence aggregation
 * @param formatPreference keeper format families, most preferred first
 * @param ignoredPairs pairs the user marked as not duplicates
 */
public record DetectOptions(
    @NotNull Thresholds thresholds,
    @NotNull SignalWeights weights,
    @NotNull DetectionLimits limits,
    @NotNull GroupConfidenceMode groupConfidenceMode,
    @NotNull List<String> formatPreference,
    @NotNull Set<FilePair> ignoredPairs
) {

    public static final List<String> DEFAULT_FORMAT_PREFERENCE = List.of("raw", "tiff", "png", "heic", "jpeg");

    public DetectOptions {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        if (groupConfidenceMode == null) {
            throw new IllegalArgumentException("groupConfidenceMode cannot be null");
        }
        formatPreference = formatPreference == null ? List.of() : List.copyOf(formatPreference);
        ignoredPairs = ignoredPairs == null ? Set.of() : Set.copyOf(ignoredPairs);
    }

    public static DetectOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .thresholds(thresholds)
            .weights(weights)
            .limits(limits)
            .groupConfidenceMode(groupConfidenceMode)
            .formatPreference(formatPreference)
            .ignoredPairs(ignoredPairs);
    }

    public boolean isIgnored(@NotNull String a, @NotNull String b) {
        return !ignoredPairs.isEmpty() && ignoredPairs.contains(FilePair.of(a, b));
    }

    /**
     * Validates every part of the options.
     *
     * @throws br.edu.ifba.deduper.exception.ConfigurationException on the first invalid value
     */
    public void validate() {
        thresholds.validate();
        weights.validate();
        limits.validate();
    }

    public static final class Builder {
        private Thresholds thresholds = Thresholds.defaults();
        private SignalWeights weights = SignalWeights.defaults();
        private DetectionLimits limits = DetectionLimits.defaults();
        private GroupConfidenceMode groupConfidenceMode = GroupConfidenceMode.MINIMUM;
        private List<String> formatPreference = DEFAULT_FORMAT_PREFERENCE;
        private Set<FilePair> ignoredPairs = Set.of();

        private Builder() {
        }

        public Builder thresholds(@NotNull Thresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder weights(@NotNull SignalWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder limits(@NotNull DetectionLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder groupConfidenceMode(@NotNull GroupConfidenceMode mode) {
            this.groupConfidenceMode = mode;
            return this;
        }

        public Builder formatPreference(@NotNull List<String> formatPreference) {
            this.formatPreference = formatPreference;
            return this;
        }

        public Builder ignoredPairs(@NotNull Collection<FilePair> ignoredPairs) {
            this.ignoredPairs = Set.copyOf(ignoredPairs);
            return this;
        }

        public DetectOptions build() {
            return new DetectOptions(thresholds, weights, limits, groupConfidenceMode, formatPreference, ignoredPairs);
        }
    }
}
