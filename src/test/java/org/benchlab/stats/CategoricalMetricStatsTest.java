package org.benchlab.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CategoricalMetricStatsTest {
    @Test
    void sortsNumbersBeforeStrings() {
        CategoricalMetricStats stats = CategoricalMetricStats.fromEval(
            "label",
            Arrays.asList("beta", 3, "alpha", 1L, null, 3.0d)
        );

        assertEquals(List.of(1L, 3L, "alpha", "beta"), List.copyOf(stats.counts().keySet()));
        assertEquals(2L, stats.counts().get(3L));
        assertEquals(6, stats.nAttempts());
        assertEquals(5, stats.nValidAttempts());
        assertEquals(3L, stats.mode());
    }

    @Test
    void modeTieGoesToFirstLabelInOrder() {
        CategoricalMetricStats stats = CategoricalMetricStats.fromEval("label", List.of("b", "a", "b", "a", 9));

        assertEquals("a", stats.mode());
        assertEquals(
            Map.of(9L, 0.2d, "a", 0.4d, "b", 0.4d),
            stats.frequencies()
        );
    }

    @Test
    void aggregateMergesCounts() {
        CategoricalMetricStats pooled = CategoricalMetricStats.aggregate(List.of(
            CategoricalMetricStats.fromEval("label", List.of("x", "y")),
            CategoricalMetricStats.fromEval("label", Arrays.asList("y", null))
        ));

        assertEquals(CategoricalMetricStats.fromEval("label", Arrays.asList("x", "y", "y", null)), pooled);
        assertEquals("y", pooled.mode());
    }

    @Test
    void rejectsFractionalLabelsAndEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> CategoricalMetricStats.fromEval("label", List.of(1.5d)));
        assertThrows(StatsInsufficientDataException.class, () -> CategoricalMetricStats.fromEval("label", List.of()));
    }
}
