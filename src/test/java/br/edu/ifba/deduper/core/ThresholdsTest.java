package br.edu.ifba.deduper.core;

import br.edu.ifba.deduper.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tunable contract: thresholds, weights, limits and options.
 */
class ThresholdsTest {

    // ========================================================================
    // Thresholds
    // ========================================================================

    @Nested
    @DisplayName("Thresholds")
    class ThresholdValues {

        @Test
        @DisplayName("defaults match the documented values")
        void defaults() {
            Thresholds thresholds = Thresholds.defaults();

            assertEquals(5, thresholds.imageDistance());
            assertEquals(5, thresholds.videoFrameDistance());
            assertEquals(0.02, thresholds.durationTolerancePct(), 0.0001);
            assertEquals(new DistanceBand(4, 6), thresholds.confirmationBand());
            assertEquals(8, thresholds.confirmationHashDistance());
            assertDoesNotThrow(thresholds::validate);
        }

        @Test
        @DisplayName("search radius covers the upper end of the confirmation band")
        void searchRadiusCoversBand() {
            Thresholds thresholds = Thresholds.defaults();

            assertEquals(6, thresholds.searchRadius(MediaType.PHOTO));
            assertEquals(9, thresholds.withImageDistance(9).searchRadius(MediaType.PHOTO));
            assertEquals(6, thresholds.withImageDistance(9).searchRadius(MediaType.VIDEO));
        }

        @Test
        @DisplayName("negative distance fails fast")
        void negativeDistance() {
            Thresholds thresholds = Thresholds.defaults().withImageDistance(-1);

            ConfigurationException error = assertThrows(ConfigurationException.class, thresholds::validate);
            assertTrue(error.getMessage().contains("imageDistance"));
        }

        @Test
        @DisplayName("inverted confirmation band fails fast")
        void invertedBand() {
            Thresholds thresholds = Thresholds.defaults().withConfirmationBand(new DistanceBand(7, 3));

            assertThrows(ConfigurationException.class, thresholds::validate);
        }

        @Test
        @DisplayName("distance above the code length fails fast")
        void distanceAboveCodeLength() {
            assertThrows(ConfigurationException.class,
                () -> Thresholds.defaults().withVideoFrameDistance(65).validate());
        }
    }

    // ========================================================================
    // Options
    // ========================================================================

    @Nested
    @DisplayName("DetectOptions")
    class Options {

        @Test
        @DisplayName("weight outside [0, 1] fails fast")
        void weightOutOfRange() {
            DetectOptions options = DetectOptions.builder()
                .weights(SignalWeights.defaults().withHash(1.5))
                .build();

            assertThrows(ConfigurationException.class, options::validate);
        }

        @Test
        @DisplayName("zero parallelism fails fast")
        void zeroParallelism() {
            DetectOptions options = DetectOptions.builder()
                .limits(DetectionLimits.defaults().withMaxParallelism(0))
                .build();

            assertThrows(ConfigurationException.class, options::validate);
        }

        @Test
        @DisplayName("ignored pairs match regardless of order")
        void ignoredPairsUnordered() {
            DetectOptions options = DetectOptions.builder()
                .ignoredPairs(List.of(FilePair.of("b", "a")))
                .build();

            assertTrue(options.isIgnored("a", "b"));
            assertTrue(options.isIgnored("b", "a"));
            assertFalse(options.isIgnored("a", "c"));
        }
    }

    // ========================================================================
    // Value types
    // ========================================================================

    @Test
    @DisplayName("FilePair normalizes order and rejects self pairs")
    void filePairNormalizes() {
        FilePair pair = FilePair.of("z", "a");

        assertEquals("a", pair.first());
        assertEquals("z", pair.second());
        assertEquals("z", pair.other("a"));
        assertThrows(IllegalArgumentException.class, () -> FilePair.of("a", "a"));
    }

    @Test
    @DisplayName("penalty labels are title-cased ids")
    void penaltyLabels() {
        assertEquals("Hash Missing", PenaltyKey.HASH_MISSING.label());
        assertEquals("Checksum Missing", PenaltyKey.CHECKSUM_MISSING.label());
        assertEquals(-0.1, PenaltyKey.HASH_MISSING.value(), 0.0001);
    }

    @Test
    @DisplayName("signal contribution is weight times raw score and stays within the weight")
    void signalContribution() {
        ConfidenceSignal signal = ConfidenceSignal.of(SignalKey.NAME, 0.3, 1.7, "clamped");

        assertEquals(1.0, signal.rawScore(), 0.0001);
        assertEquals(0.3, signal.contribution(), 0.0001);
        assertThrows(IllegalArgumentException.class,
            () -> new ConfidenceSignal(SignalKey.NAME, 0.3, 1.0, 0.5, "too much", null, null));
    }

    @Test
    @DisplayName("group confidence modes aggregate member confidences")
    void groupConfidenceModes() {
        List<Double> confidences = List.of(0.4, 0.8, 0.6);

        assertEquals(0.4, GroupConfidenceMode.MINIMUM.aggregate(confidences), 0.0001);
        assertEquals(0.8, GroupConfidenceMode.MAXIMUM.aggregate(confidences), 0.0001);
        assertEquals(0.6, GroupConfidenceMode.MEAN.aggregate(confidences), 0.0001);
    }

    @Test
    @DisplayName("records without an id are rejected")
    void recordRequiresId() {
        assertThrows(IllegalArgumentException.class, () -> FileRecord.builder(" ", MediaType.PHOTO).build());
    }

    @Test
    @DisplayName("a photo without a perceptual hash is incomplete, a document is not")
    void incompleteRecords() {
        assertTrue(FileRecord.builder("p", MediaType.PHOTO).build().isIncomplete());
        assertFalse(FileRecord.builder("d", MediaType.DOCUMENT).build().isIncomplete());
        assertTrue(FileRecord.builder("d", MediaType.DOCUMENT).partial(true).build().isIncomplete());
    }
}
