package org.benchlab.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.benchlab.stats.BooleanMetricStats;
import org.benchlab.stats.CategoricalMetricStats;
import org.benchlab.stats.MetricStats;
import org.benchlab.stats.RegressionMetricStats;

/**
 * Output type of a metric and the statistics family that summarizes it.
 */
public enum MetricType {
    BOOLEAN("boolean") {
        @Override
        public MetricStats fromEval(String metricName, List<?> values) {
            return BooleanMetricStats.fromEval(metricName, values);
        }

        @Override
        public MetricStats aggregate(List<? extends MetricStats> stats) {
            return BooleanMetricStats.aggregate(narrow(stats, BooleanMetricStats.class));
        }
    },
    REGRESSION("regression") {
        @Override
        public MetricStats fromEval(String metricName, List<?> values) {
            return RegressionMetricStats.fromEval(metricName, values);
        }

        @Override
        public MetricStats aggregate(List<? extends MetricStats> stats) {
            return RegressionMetricStats.aggregate(narrow(stats, RegressionMetricStats.class));
        }
    },
    CATEGORICAL("categorical") {
        @Override
        public MetricStats fromEval(String metricName, List<?> values) {
            return CategoricalMetricStats.fromEval(metricName, values);
        }

        @Override
        public MetricStats aggregate(List<? extends MetricStats> stats) {
            return CategoricalMetricStats.aggregate(narrow(stats, CategoricalMetricStats.class));
        }
    };

    private final String text;

    MetricType(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public abstract MetricStats fromEval(String metricName, List<?> values);

    public abstract MetricStats aggregate(List<? extends MetricStats> stats);

    public static MetricType fromText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("metric type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MetricType type : values()) {
            if (type.text.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported metric type: " + value);
    }

    private static <S extends MetricStats> List<S> narrow(List<? extends MetricStats> stats, Class<S> type) {
        List<S> narrowed = new ArrayList<>(stats.size());
        for (MetricStats item : stats) {
            if (!type.isInstance(item)) {
                throw new IllegalArgumentException(
                    "expected " + type.getSimpleName() + " but got " + (item == null ? "null" : item.getClass().getSimpleName()));
            }
            narrowed.add(type.cast(item));
        }
        return narrowed;
    }
}
