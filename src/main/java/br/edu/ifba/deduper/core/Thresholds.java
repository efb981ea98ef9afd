package br.edu.ifba.deduper.core;

import br.edu.ifba.deduper.exception.ConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * Distance and similarity thresholds for one detection run.
 *
 * <p>Instances are immutable and passed explicitly into every scoring and
 * clustering call. The constructor only rejects missing parts so that invalid
 * values can be reported together by {@link #validate()}.</p>
 *
 * @param imageDistance max Hamming distance for a photo duplicate
 * @param videoFrameDistance max aligned-frame Hamming distance for a video duplicate
 * @param durationTolerancePct relative duration delta still treated as equal length
 * @param nameSimilarityThreshold name similarity needed to compare files without a perceptual hash
 * @param confirmationBand distance range where a secondary hash must confirm the pair
 * @param confirmationHashDistance max secondary hash distance that confirms a pair
 */
public record Thresholds(
    int imageDistance,
    int videoFrameDistance,
    double durationTolerancePct,
    double nameSimilarityThreshold,
    @NotNull DistanceBand confirmationBand,
    int confirmationHashDistance
) {

    public static final int CODE_BITS = 64;

    public Thresholds {
        if (confirmationBand == null) {
            throw new IllegalArgumentException("confirmationBand cannot be null");
        }
    }

    public static Thresholds defaults() {
        return new Thresholds(5, 5, 0.02, 0.5, new DistanceBand(4, 6), 8);
    }

    /**
     * Duplicate distance threshold for the given media type.
     */
    public int distanceFor(@NotNull MediaType mediaType) {
        return mediaType == MediaType.VIDEO ? videoFrameDistance : imageDistance;
    }

    /**
     * Neighbor query radius: wide enough to surface borderline pairs.
     */
    public int searchRadius(@NotNull MediaType mediaType) {
        return Math.max(distanceFor(mediaType), confirmationBand.upper());
    }

    public Thresholds withImageDistance(int distance) {
        return new Thresholds(distance, videoFrameDistance, durationTolerancePct,
            nameSimilarityThreshold, confirmationBand, confirmationHashDistance);
    }

    public Thresholds withVideoFrameDistance(int distance) {
        return new Thresholds(imageDistance, distance, durationTolerancePct,
            nameSimilarityThreshold, confirmationBand, confirmationHashDistance);
    }

    public Thresholds withConfirmationBand(@NotNull DistanceBand band) {
        return new Thresholds(imageDistance, videoFrameDistance, durationTolerancePct,
            nameSimilarityThreshold, band, confirmationHashDistance);
    }

    /**
     * Fails fast on values that would make a scan meaningless.
     *
     * @throws ConfigurationException describing the first invalid value
     */
    public void validate() {
        checkDistance("imageDistance", imageDistance);
        checkDistance("videoFrameDistance", videoFrameDistance);
        checkDistance("confirmationHashDistance", confirmationHashDistance);
        checkDistance("confirmationBand.lower", confirmationBand.lower());
        checkDistance("confirmationBand.upper", confirmationBand.upper());
        if (confirmationBand.lower() > confirmationBand.upper()) {
            throw new ConfigurationException(
                String.format("confirmationBand is inverted: %s", confirmationBand)
            );
        }
        if (!(durationTolerancePct >= 0.0 && durationTolerancePct < 1.0)) {
            throw new ConfigurationException(
                String.format("durationTolerancePct must be in [0.0, 1.0), got %.3f", durationTolerancePct)
            );
        }
        if (!(nameSimilarityThreshold >= 0.0 && nameSimilarityThreshold <= 1.0)) {
            throw new ConfigurationException(
                String.format("nameSimilarityThreshold must be in [0.0, 1.0], got %.3f", nameSimilarityThreshold)
            );
        }
    }

    private static void checkDistance(String name, int value) {
        if (value < 0 || value > CODE_BITS) {
            throw new ConfigurationException(
                String.format("%s must be in [0, %d], got %d", name, CODE_BITS, value)
            );
        }
    }
}
