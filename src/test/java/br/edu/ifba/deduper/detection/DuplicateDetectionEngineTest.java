package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.Fixtures;
import br.edu.ifba.deduper.core.CancellationToken;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.DetectionLimits;
import br.edu.ifba.deduper.core.DistanceBand;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.FilePair;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.ResourcePressure;
import br.edu.ifba.deduper.core.SignalWeights;
import br.edu.ifba.deduper.core.Thresholds;
import br.edu.ifba.deduper.evidence.EvidenceItem;
import br.edu.ifba.deduper.evidence.Verdict;
import br.edu.ifba.deduper.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static br.edu.ifba.deduper.Fixtures.CAPTURED;
import static br.edu.ifba.deduper.Fixtures.CODE;
import static br.edu.ifba.deduper.Fixtures.flip;
import static br.edu.ifba.deduper.Fixtures.frames;
import static br.edu.ifba.deduper.Fixtures.photo;
import static br.edu.ifba.deduper.Fixtures.shifted;
import static br.edu.ifba.deduper.Fixtures.video;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for DuplicateDetectionEngine.
 */
class DuplicateDetectionEngineTest {

    private DuplicateDetectionEngine engine;
    private DetectOptions options;

    @BeforeEach
    void setUp() {
        engine = Fixtures.engine();
        options = DetectOptions.defaults();
    }

    private static EvidenceItem evidence(DetectionRun run, DuplicateGroupResult group, String id) {
        return run.explain(group.groupId()).orElseThrow().evidence().stream()
            .filter(i -> i.id().equals(id))
            .findFirst()
            .orElseThrow();
    }

    // ========================================================================
    // Photos
    // ========================================================================

    @Nested
    @DisplayName("Photo scans")
    class Photos {

        @Test
        @DisplayName("identical checksums form a confirmed group")
        void checksumGroup() {
            // Arrange
            List<FileRecord> records = List.of(
                photo("a").fileSize(1024).checksum("sha").imageHash(CODE).build(),
                photo("b").fileSize(1024).checksum("sha").imageHash(CODE).build(),
                photo("c").fileSize(1024).checksum("other").imageHash(~CODE).build()
            );

            // Act
            DetectionRun run = engine.detect(records, options);

            // Assert
            assertEquals(1, run.groups().size());
            DuplicateGroupResult group = run.groups().get(0);
            assertEquals(List.of("a", "b"), group.memberIds());
            assertEquals(1.0, group.confidence());
            assertFalse(group.incomplete());

            EvidenceItem checksum = evidence(run, group, "checksum");
            assertEquals(Verdict.PASS, checksum.verdict());
            assertEquals("0", checksum.distanceText());
            assertEquals("0", checksum.thresholdText());
        }

        @Test
        @DisplayName("a near-identical pair at the duplicate distance is grouped")
        void nearIdentical() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 5)).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertEquals(1, run.groups().size());
            EvidenceItem hash = evidence(run, run.groups().get(0), "hash");
            assertEquals(0.32, hash.contribution(), 1e-9);
            assertEquals(Verdict.PASS, hash.verdict());
            assertEquals("5", hash.distanceText());
            assertEquals("5", hash.thresholdText());
        }

        @Test
        @DisplayName("one bit past the duplicate distance is similar, not duplicate")
        void borderlineWithoutConfirmation() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 6)).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertTrue(run.groups().isEmpty());
            assertEquals(1, run.similarPairs().size());
            assertEquals(FilePair.of("a", "b"), run.similarPairs().get(0).pair());
        }

        @Test
        @DisplayName("a secondary hash confirms a borderline pair")
        void borderlineConfirmed() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).secondaryHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 6)).secondaryHash(flip(CODE, 2)).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertEquals(1, run.groups().size());
            assertTrue(run.similarPairs().isEmpty());
        }

        @Test
        @DisplayName("a copy without a hash is matched by name and capture time, flagged incomplete")
        void missingHash() {
            // Arrange
            List<FileRecord> records = List.of(
                photo("a").fileName("IMG_0001.jpg").imageHash(CODE).captureTimestamp(CAPTURED).build(),
                photo("b").fileName("IMG_0001 copy.jpg").captureTimestamp(CAPTURED).build()
            );

            // Act
            DetectionRun run = engine.detect(records, options);

            // Assert
            assertEquals(1, run.groups().size());
            DuplicateGroupResult group = run.groups().get(0);
            assertTrue(group.incomplete());
            assertEquals(0.45, group.confidence(), 1e-9);
            assertTrue(group.rationaleLines().contains("MissingSignal: perceptual hash unavailable for b"));

            EvidenceItem penalty = evidence(run, group, "penalty_hashMissing");
            assertEquals(Verdict.FAIL, penalty.verdict());
            assertEquals("missing", penalty.distanceText());
            assertEquals("required", penalty.thresholdText());
        }

        @Test
        @DisplayName("files of different sizes are never compared")
        void sizeGate() {
            List<FileRecord> records = List.of(
                photo("a").fileSize(100_000).imageHash(CODE).build(),
                photo("b").fileSize(5_000_000).imageHash(CODE).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertTrue(run.groups().isEmpty());
            assertEquals(0, run.metrics().candidatePairs());
        }
    }

    // ========================================================================
    // Videos
    // ========================================================================

    @Nested
    @DisplayName("Video scans")
    class Videos {

        @Test
        @DisplayName("re-encoded copies with close keyframes and durations are grouped")
        void reencoded() {
            List<Long> frames = frames(8, 11L);
            List<FileRecord> records = List.of(
                video("v1", frames, 60.0).build(),
                video("v2", shifted(frames, 4), 60.6).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertEquals(1, run.groups().size());
            DuplicateGroupResult group = run.groups().get(0);
            assertEquals(MediaType.VIDEO, group.mediaType());
            assertFalse(group.incomplete());
            assertEquals("4", evidence(run, group, "hash").distanceText());
        }

        @Test
        @DisplayName("matching frames with very different durations are only similar")
        void durationGate() {
            List<Long> frames = frames(8, 11L);
            List<FileRecord> records = List.of(
                video("v1", frames, 60.0).build(),
                video("v2", frames, 70.0).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertTrue(run.groups().isEmpty());
            assertEquals(1, run.similarPairs().size());
        }

        @Test
        @DisplayName("different keyframe counts still group, flagged incomplete")
        void truncated() {
            List<Long> frames = frames(8, 11L);
            List<FileRecord> records = List.of(
                video("v1", frames, 60.0).build(),
                video("v2", frames.subList(0, 6), 60.0).build()
            );

            DetectionRun run = engine.detect(records, options);

            assertEquals(1, run.groups().size());
            DuplicateGroupResult group = run.groups().get(0);
            assertTrue(group.incomplete());
            assertTrue(group.rationaleLines().stream().anyMatch(l -> l.startsWith("PartialExtraction: keyframe counts differ")));
        }
    }

    // ========================================================================
    // Determinism
    // ========================================================================

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        private List<FileRecord> mixedRecords() {
            List<Long> frames = frames(8, 23L);
            return List.of(
                photo("p1").imageHash(CODE).dimensions(4000, 3000).build(),
                photo("p2").imageHash(flip(CODE, 2)).dimensions(2000, 1500).build(),
                photo("p3").imageHash(flip(CODE, 3)).build(),
                photo("p4").fileSize(2_000_000).checksum("x").imageHash(~CODE).build(),
                photo("p5").fileSize(2_000_000).checksum("x").imageHash(~CODE).build(),
                photo("p6").fileName("IMG_0042.jpg").fileSize(3_000_000).imageHash(0x1234L).captureTimestamp(CAPTURED).build(),
                photo("p7").fileName("IMG_0042 (1).jpg").fileSize(3_000_000).captureTimestamp(CAPTURED).build(),
                video("v1", frames, 30.0).build(),
                video("v2", shifted(frames, 1), 30.0).build()
            );
        }

        @Test
        @DisplayName("the same input always yields the same groups")
        void idempotent() {
            List<FileRecord> records = mixedRecords();

            DetectionRun first = engine.detect(records, options);
            DetectionRun second = engine.detect(records, options);

            assertEquals(4, first.groups().size());
            assertEquals(first.groups(), second.groups());
            assertEquals(first.similarPairs(), second.similarPairs());
        }

        @Test
        @DisplayName("input order and parallelism do not change the groups")
        void orderIndependent() {
            List<FileRecord> shuffled = new ArrayList<>(mixedRecords());
            Collections.shuffle(shuffled, new Random(7));
            DetectOptions serial = options.toBuilder()
                .limits(DetectionLimits.defaults().withMaxParallelism(1))
                .build();

            DetectionRun ordered = engine.detect(mixedRecords(), options);
            DetectionRun reordered = engine.detect(shuffled, serial);

            assertEquals(ordered.groups(), reordered.groups());
        }

        @Test
        @DisplayName("groups come highest confidence first")
        void groupOrder() {
            DetectionRun run = engine.detect(mixedRecords(), options);

            List<DuplicateGroupResult> groups = run.groups();
            assertEquals(1.0, groups.get(0).confidence());
            for (int i = 1; i < groups.size(); i++) {
                assertTrue(groups.get(i - 1).confidence() >= groups.get(i).confidence());
            }
        }

        @Test
        @DisplayName("metrics count what was scanned")
        void metrics() {
            DetectionRun run = engine.detect(mixedRecords(), options);

            assertEquals(9, run.metrics().totalFiles());
            assertEquals(4, run.metrics().groupCount());
            assertEquals(1, run.metrics().incompleteGroups());
            assertEquals(36, run.metrics().naiveComparisons());
            assertTrue(run.metrics().comparisonsPerformed() >= run.metrics().candidatePairs());
        }
    }

    // ========================================================================
    // Re-rank
    // ========================================================================

    @Nested
    @DisplayName("Re-rank")
    class Rerank {

        @Test
        @DisplayName("a looser threshold inside the scanned radius groups a similar pair")
        void looser() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 6)).build()
            );
            DetectionRun run = engine.detect(records, options);
            assertTrue(run.groups().isEmpty());

            DetectOptions looser = options.toBuilder()
                .thresholds(Thresholds.defaults().withImageDistance(6))
                .build();
            DetectionRun reranked = engine.rerank(run, looser);

            assertEquals(1, reranked.groups().size());
            assertEquals(1, reranked.metrics().candidatePairs());
        }

        @Test
        @DisplayName("a tighter threshold drops pairs beyond the new radius")
        void tighter() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 5)).build()
            );
            DetectionRun run = engine.detect(records, options);
            assertEquals(1, run.groups().size());

            DetectOptions tighter = options.toBuilder()
                .thresholds(Thresholds.defaults().withImageDistance(3).withConfirmationBand(new DistanceBand(2, 3)))
                .build();
            DetectionRun reranked = engine.rerank(run, tighter);

            assertTrue(reranked.groups().isEmpty());
            assertTrue(reranked.similarPairs().isEmpty());
        }

        @Test
        @DisplayName("pairs marked not-duplicate are filtered out")
        void ignoredPairs() {
            List<FileRecord> records = List.of(
                photo("a").imageHash(CODE).build(),
                photo("b").imageHash(flip(CODE, 1)).build()
            );
            DetectionRun run = engine.detect(records, options);

            DetectionRun reranked = engine.rerank(run,
                options.toBuilder().ignoredPairs(List.of(FilePair.of("b", "a"))).build());

            assertTrue(reranked.groups().isEmpty());
        }

        @Test
        @DisplayName("checksum groups survive a re-rank")
        void checksumKept() {
            List<FileRecord> records = List.of(
                photo("a").checksum("sha").imageHash(CODE).build(),
                photo("b").checksum("sha").imageHash(CODE).build()
            );
            DetectionRun run = engine.detect(records, options);

            DetectionRun reranked = engine.rerank(run, options.toBuilder()
                .weights(SignalWeights.defaults().withHash(0.1))
                .build());

            assertEquals(run.groups(), reranked.groups());
        }

        @Test
        @DisplayName("re-ranking a cancelled scan keeps its groups incomplete")
        void cancelledScan() {
            // Arrange
            CancellationToken token = new CancellationToken();
            token.cancel();
            List<FileRecord> records = List.of(
                photo("a").checksum("sha").imageHash(CODE).build(),
                photo("b").checksum("sha").imageHash(CODE).build(),
                photo("c").imageHash(~CODE).build(),
                photo("d").imageHash(~CODE).build()
            );
            DetectionRun run = engine.detect(records, options, ResourcePressure.NONE, token);
            assertTrue(run.cancelled());

            // Act
            DetectionRun reranked = engine.rerank(run, DetectOptions.defaults());
            DetectionRun rerankedTwice = engine.rerank(reranked, DetectOptions.defaults());

            // Assert
            assertTrue(reranked.cancelled());
            assertFalse(reranked.groups().isEmpty());
            assertTrue(reranked.groups().stream().allMatch(DuplicateGroupResult::incomplete));
            assertTrue(rerankedTwice.cancelled());
            assertTrue(rerankedTwice.groups().stream().allMatch(DuplicateGroupResult::incomplete));
        }
    }

    // ========================================================================
    // Cancellation, explain, preview, validation
    // ========================================================================

    @Test
    @DisplayName("a cancelled scan returns only incomplete groups")
    void cancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        List<FileRecord> records = List.of(
            photo("a").checksum("sha").imageHash(CODE).build(),
            photo("b").checksum("sha").imageHash(CODE).build(),
            photo("c").imageHash(~CODE).build(),
            photo("d").imageHash(~CODE).build()
        );

        DetectionRun run = engine.detect(records, options, ResourcePressure.NONE, token);

        assertTrue(run.cancelled());
        assertFalse(run.groups().isEmpty());
        assertTrue(run.groups().stream().allMatch(DuplicateGroupResult::incomplete));
    }

    @Test
    @DisplayName("explain returns evidence per member and nothing for unknown groups")
    void explain() {
        List<FileRecord> records = List.of(
            photo("a").imageHash(CODE).build(),
            photo("b").imageHash(flip(CODE, 2)).build()
        );
        DetectionRun run = engine.detect(records, options);
        DuplicateGroupResult group = run.groups().get(0);

        GroupRationale rationale = run.explain(group.groupId()).orElseThrow();

        assertEquals(List.of("a", "b"), List.copyOf(rationale.memberEvidence().keySet()));
        assertFalse(rationale.evidence().isEmpty());
        assertEquals(group.rationaleLines(), rationale.rationaleLines());
        assertTrue(run.explain("missing").isEmpty());
    }

    @Test
    @DisplayName("preview reports each bucket's search strategy")
    void preview() {
        List<FileRecord> records = List.of(
            photo("a").imageHash(CODE).build(),
            photo("b").imageHash(CODE).build(),
            photo("e").imageHash(flip(CODE, 1)).build(),
            photo("c").fileSize(9_000_000).build(),
            photo("d").fileSize(9_000_000).build()
        );

        List<BucketStats> stats = engine.previewBuckets(records, options);

        assertEquals(2, stats.size());
        assertEquals(BucketStats.Strategy.BK_TREE, stats.get(0).strategy());
        assertEquals(3, stats.get(0).hashedFiles());
        assertEquals(BucketStats.Strategy.NAME_SCAN, stats.get(1).strategy());
        assertEquals(1, stats.get(1).estimatedComparisons());

        DetectOptions tiny = options.toBuilder()
            .limits(DetectionLimits.defaults().withIndexFallbackBucketSize(2))
            .build();
        assertEquals(BucketStats.Strategy.LINEAR_SCAN, engine.previewBuckets(records, tiny).get(0).strategy());
    }

    @Test
    @DisplayName("invalid options are rejected before any work")
    void invalidOptions() {
        DetectOptions invalid = options.toBuilder()
            .weights(SignalWeights.defaults().withHash(1.5))
            .build();

        assertThrows(ConfigurationException.class, () -> engine.detect(List.of(), invalid));
    }

    @Test
    @DisplayName("an empty scan yields nothing")
    void empty() {
        DetectionRun run = engine.detect(List.of(), options);

        assertTrue(run.groups().isEmpty());
        assertEquals(0, run.metrics().totalFiles());
    }
}
