package br.edu.ifba.deduper.evidence;

import br.edu.ifba.deduper.core.ConfidencePenalty;
import br.edu.ifba.deduper.core.ConfidenceSignal;
import br.edu.ifba.deduper.core.DuplicateGroupMember;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.PenaltyKey;
import br.edu.ifba.deduper.core.SignalKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EvidenceFormatter and Verdict.
 */
class EvidenceFormatterTest {

    private EvidenceFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new EvidenceFormatter();
    }

    private static DuplicateGroupMember member(String id, List<ConfidenceSignal> signals, List<ConfidencePenalty> penalties) {
        return new DuplicateGroupMember(id, 0.5, signals, penalties, List.of(), 1_000L);
    }

    private static EvidenceItem item(List<EvidenceItem> items, String id) {
        return items.stream().filter(i -> i.id().equals(id)).findFirst().orElseThrow();
    }

    // ========================================================================
    // Verdicts
    // ========================================================================

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "1.0, PASS",
        "0.32, PASS",
        "0.3, WARN",
        "0.2, WARN",
        "0.1, FAIL",
        "0.0, FAIL",
        "-0.1, FAIL"
    })
    @DisplayName("contributions map to verdicts")
    void verdicts(double contribution, Verdict expected) {
        assertEquals(expected, Verdict.forContribution(contribution));
    }

    // ========================================================================
    // Member evidence
    // ========================================================================

    @Nested
    @DisplayName("Member evidence")
    class MemberEvidence {

        @Test
        @DisplayName("checksum match shows zero distance against zero threshold")
        void checksum() {
            DuplicateGroupMember member = member("a",
                List.of(ConfidenceSignal.of(SignalKey.CHECKSUM, 1.0, 1.0, "checksum match", 0.0, 0.0)), List.of());

            EvidenceItem item = formatter.format(member).get(0);

            assertEquals("checksum", item.id());
            assertEquals("Checksum", item.label());
            assertEquals("0", item.distanceText());
            assertEquals("0", item.thresholdText());
            assertEquals(Verdict.PASS, item.verdict());
        }

        @Test
        @DisplayName("each signal renders in its own unit")
        void units() {
            // Arrange
            DuplicateGroupMember member = member("a", List.of(
                ConfidenceSignal.of(SignalKey.HASH, 0.4, 0.8, "dHash distance=5", 5.0, 5.0),
                ConfidenceSignal.of(SignalKey.NAME, 0.3, 0.87, "name", 0.87, 0.5),
                ConfidenceSignal.of(SignalKey.CAPTURE_TIME, 0.2, 1.0, "capture", 120.0, 300.0),
                ConfidenceSignal.of(SignalKey.DURATION, 0.2, 1.0, "duration", 0.01, 0.02),
                ConfidenceSignal.of(SignalKey.METADATA, 0.1, 0.95, "metadata", 0.95, 1.0)
            ), List.of());

            // Act
            List<EvidenceItem> items = formatter.format(member);

            // Assert
            assertEquals("5", item(items, "hash").distanceText());
            assertEquals("5", item(items, "hash").thresholdText());
            assertEquals(Verdict.PASS, item(items, "hash").verdict());
            assertEquals("87%", item(items, "name").distanceText());
            assertEquals("50%", item(items, "name").thresholdText());
            assertEquals("2m", item(items, "captureTime").distanceText());
            assertEquals("5m", item(items, "captureTime").thresholdText());
            assertEquals("1%", item(items, "duration").distanceText());
            assertEquals("2%", item(items, "duration").thresholdText());
            assertEquals("95%", item(items, "metadata").distanceText());
            assertEquals("100%", item(items, "metadata").thresholdText());
            assertEquals(Verdict.FAIL, item(items, "metadata").verdict());
        }

        @Test
        @DisplayName("penalties appear as failing items with missing/required texts")
        void penalties() {
            DuplicateGroupMember member = member("a",
                List.of(ConfidenceSignal.of(SignalKey.NAME, 0.3, 1.0, "name", 1.0, 0.5)),
                List.of(ConfidencePenalty.of(PenaltyKey.HASH_MISSING, "perceptual hash unavailable for a")));

            List<EvidenceItem> items = formatter.format(member);

            EvidenceItem penalty = item(items, "penalty_hashMissing");
            assertTrue(penalty.isPenalty());
            assertEquals("Hash Missing", penalty.label());
            assertEquals("missing", penalty.distanceText());
            assertEquals("required", penalty.thresholdText());
            assertEquals(Verdict.FAIL, penalty.verdict());
            assertEquals(-0.1, penalty.contribution(), 1e-12);
        }

        @Test
        @DisplayName("items are sorted by contribution, penalties last")
        void order() {
            DuplicateGroupMember member = member("a", List.of(
                ConfidenceSignal.of(SignalKey.METADATA, 0.1, 1.0, "metadata", 1.0, 1.0),
                ConfidenceSignal.of(SignalKey.NAME, 0.3, 1.0, "name", 1.0, 0.5),
                ConfidenceSignal.of(SignalKey.CAPTURE_TIME, 0.2, 1.0, "capture", 0.0, 300.0)
            ), List.of(ConfidencePenalty.of(PenaltyKey.CHECKSUM_MISSING, "checksum unavailable for a")));

            List<String> ids = formatter.format(member).stream().map(EvidenceItem::id).toList();

            assertEquals(List.of("name", "captureTime", "metadata", "penalty_checksumMissing"), ids);
        }
    }

    // ========================================================================
    // Group evidence
    // ========================================================================

    @Test
    @DisplayName("group evidence keeps each key's strongest signal and fails penalized keys")
    void summarize() {
        // Arrange
        DuplicateGroupMember a = member("a",
            List.of(ConfidenceSignal.of(SignalKey.HASH, 0.4, 0.8, "dHash distance=5", 5.0, 5.0),
                ConfidenceSignal.of(SignalKey.NAME, 0.3, 0.4, "name", 0.4, 0.5)),
            List.of());
        DuplicateGroupMember b = member("b",
            List.of(ConfidenceSignal.of(SignalKey.NAME, 0.3, 1.0, "name", 1.0, 0.5)),
            List.of(ConfidencePenalty.of(PenaltyKey.HASH_MISSING, "perceptual hash unavailable for b")));
        DuplicateGroupResult group = new DuplicateGroupResult("g", MediaType.PHOTO, List.of(a, b), 0.5,
            List.of(), "a", true);

        // Act
        List<EvidenceItem> items = formatter.summarize(group);

        // Assert
        assertEquals(3, items.size());
        assertEquals(0.3, item(items, "name").contribution(), 1e-12);
        assertEquals(Verdict.FAIL, item(items, "hash").verdict());
        assertEquals(Verdict.FAIL, item(items, "penalty_hashMissing").verdict());
    }

    @ParameterizedTest(name = "{0}s -> {1}")
    @CsvSource({
        "0, 0s",
        "59, 59s",
        "60, 1m",
        "3599, 59m",
        "3600, 1h",
        "86400, 1d",
        "-120, 2m"
    })
    @DisplayName("elapsed time is compact")
    void elapsed(long seconds, String expected) {
        assertEquals(expected, EvidenceFormatter.elapsed(seconds));
    }

    @Test
    @DisplayName("items serialize with lower-case verdicts")
    void json() throws Exception {
        EvidenceItem item = new EvidenceItem("hash", "Hash Distance", "5", "5", Verdict.PASS, 0.32);

        String json = new ObjectMapper().writeValueAsString(item);

        assertTrue(json.contains("\"verdict\":\"pass\""), json);
        assertTrue(json.contains("\"distanceText\":\"5\""), json);
    }
}
