package org.benchlab.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegressionMetricStatsTest {
    @Test
    void computesPopulationStatisticsOverValidScores() {
        RegressionMetricStats stats = RegressionMetricStats.fromEval("latency", Arrays.asList(1, 2.0d, 3L, 4, null));

        assertEquals(5, stats.nAttempts());
        assertEquals(4, stats.nValidAttempts());
        assertEquals(2.5d, stats.mean(), 1e-12);
        assertEquals(Math.sqrt(1.25d), stats.std(), 1e-12);
        assertEquals(1.0d, stats.min());
        assertEquals(4.0d, stats.max());
    }

    @Test
    void singleValueHasZeroSpread() {
        RegressionMetricStats stats = RegressionMetricStats.fromEval("latency", List.of(7.5d));

        assertEquals(7.5d, stats.mean());
        assertEquals(0.0d, stats.std());
    }

    @Test
    void pooledStatsMatchConcatenatedScores() {
        List<Object> first = Arrays.asList(0.5d, 1.5d, null, 4.0d);
        List<Object> second = Arrays.asList(10.0d, 12.0d);
        List<Object> third = List.of(-3.0d);
        List<Object> all = new ArrayList<>(first);
        all.addAll(second);
        all.addAll(third);

        RegressionMetricStats pooled = RegressionMetricStats.aggregate(List.of(
            RegressionMetricStats.fromEval("score", first),
            RegressionMetricStats.fromEval("score", second),
            RegressionMetricStats.fromEval("score", third)
        ));
        RegressionMetricStats direct = RegressionMetricStats.fromEval("score", all);

        assertEquals(direct.nAttempts(), pooled.nAttempts());
        assertEquals(direct.nValidAttempts(), pooled.nValidAttempts());
        assertEquals(direct.mean(), pooled.mean(), 1e-9);
        assertEquals(direct.std(), pooled.std(), 1e-9);
        assertEquals(-3.0d, pooled.min());
        assertEquals(12.0d, pooled.max());
    }

    @Test
    void failsWithoutValidScores() {
        assertThrows(StatsInsufficientDataException.class, () -> RegressionMetricStats.fromEval("score", Arrays.asList((Object) null)));
        assertThrows(IllegalArgumentException.class, () -> RegressionMetricStats.fromEval("score", List.of("fast")));
    }
}
