package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.DurationMetrics;
import com.star.pglogstats.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PercentilesTest {

    private static final double[] TENS = {10, 20, 30, 40, 50, 60, 70, 80, 90, 100};

    @ParameterizedTest
    @CsvSource({
            "0.10, 20",
            "0.50, 60",
            "0.95, 100",
            "0.99, 100",
            "1.00, 100"
    })
    @DisplayName("Should pick the nearest-rank value")
    void shouldPickNearestRank(double p, double expected) {
        assertEquals(expected, Percentiles.nearestRank(TENS, p));
    }

    @Test
    @DisplayName("Should return zero for no samples")
    void shouldReturnZeroForEmpty() {
        assertEquals(0.0, Percentiles.nearestRank(new double[0], 0.95));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.5, 1.01, Double.NaN})
    @DisplayName("Should reject percentiles outside (0, 1]")
    void shouldRejectInvalidPercentile(double p) {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> Percentiles.nearestRank(TENS, p));

        assertEquals("percentile", ex.getField());
    }

    @Test
    @DisplayName("Should compute metrics regardless of sample order")
    void shouldComputeMetrics() {
        DurationMetrics metrics = Percentiles.metrics(List.of(100.0, 10.0, 50.0, 30.0, 20.0, 90.0, 40.0, 80.0, 60.0, 70.0));

        assertEquals(10, metrics.getCount());
        assertEquals(550.0, metrics.getTotalMs(), 1e-9);
        assertEquals(55.0, metrics.getAverageMs(), 1e-9);
        assertEquals(10.0, metrics.getMinMs());
        assertEquals(100.0, metrics.getMaxMs());
        assertEquals(100.0, metrics.getP95Ms());
        assertEquals(100.0, metrics.getP99Ms());
    }

    @Test
    @DisplayName("Should return empty metrics for no samples")
    void shouldReturnEmptyMetrics() {
        DurationMetrics metrics = Percentiles.metrics(List.of());

        assertEquals(0, metrics.getCount());
        assertEquals(0.0, metrics.getTotalMs());
        assertEquals(0.0, metrics.getAverageMs());
        assertEquals(0.0, metrics.getP99Ms());
    }
}
