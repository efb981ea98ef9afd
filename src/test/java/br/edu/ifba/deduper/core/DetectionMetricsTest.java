package br.edu.ifba.deduper.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DetectionMetrics.
 */
class DetectionMetricsTest {

    private static DetectionMetrics metrics(int files, long comparisons) {
        return new DetectionMetrics(files, 1, files, 0, 1, comparisons, 0, 1, 0, Duration.ofMillis(3));
    }

    @ParameterizedTest(name = "{0} files, {1} comparisons -> {2}%")
    @CsvSource({
        "100, 495, 90.0",
        "100, 4950, 0.0",
        "10, 0, 100.0",
        "2, 5, 0.0",
        "1, 3, 0.0",
        "0, 0, 0.0"
    })
    @DisplayName("reduction is measured against n(n-1)/2 and never negative")
    void reduction(int files, long comparisons, double expected) {
        assertEquals(expected, metrics(files, comparisons).reductionPercent(), 0.001);
    }

    @Test
    @DisplayName("small scans that probe more than the naive count log a zero reduction")
    void smallScanLogLine() {
        // Arrange
        DetectionMetrics metrics = metrics(2, 5);

        // Act
        String line = metrics.toLogString();

        // Assert
        assertEquals(1, metrics.naiveComparisons());
        assertTrue(line.contains("5 comparisons (0.0% fewer than 1)"), line);
        assertFalse(line.contains("-"), line);
    }
}
