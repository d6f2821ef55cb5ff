package org.benchlab.stats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * True/false counts of a boolean metric, with Wilson score intervals.
 */
public final class BooleanMetricStats extends MetricStats {
    private static final Map<Double, Double> Z_SCORES = Map.of(
        0.90d, 1.6448536269514722d,
        0.95d, 1.959963984540054d,
        0.99d, 2.5758293035489004d
    );

    private final int nTrue;
    private final int nFalse;

    private BooleanMetricStats(String metricName, int nAttempts, int nTrue, int nFalse) {
        super(metricName, nAttempts, checkedValid(nTrue, nFalse));
        this.nTrue = nTrue;
        this.nFalse = nFalse;
    }

    public static BooleanMetricStats of(String metricName, int nAttempts, int nTrue, int nFalse) {
        return new BooleanMetricStats(metricName, nAttempts, nTrue, nFalse);
    }

    public static BooleanMetricStats fromEval(String metricName, List<?> values) {
        Objects.requireNonNull(values, "values");
        int nTrue = 0;
        int nFalse = 0;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Boolean flag)) {
                throw new IllegalArgumentException(
                    "metric '" + metricName + "' expects boolean scores, got " + value.getClass().getSimpleName());
            }
            if (flag) {
                nTrue++;
            } else {
                nFalse++;
            }
        }
        if (nTrue + nFalse == 0) {
            throw new StatsInsufficientDataException(metricName, values.size());
        }
        return new BooleanMetricStats(metricName, values.size(), nTrue, nFalse);
    }

    public static BooleanMetricStats aggregate(List<BooleanMetricStats> stats) {
        String name = requireSharedName(stats);
        int nAttempts = 0;
        int nTrue = 0;
        int nFalse = 0;
        for (BooleanMetricStats item : stats) {
            nAttempts += item.nAttempts();
            nTrue += item.nTrue;
            nFalse += item.nFalse;
        }
        return new BooleanMetricStats(name, nAttempts, nTrue, nFalse);
    }

    public int nTrue() {
        return nTrue;
    }

    public int nFalse() {
        return nFalse;
    }

    /**
     * Observed proportion of true scores among valid ones; 0 when nothing is valid.
     */
    public double proportion() {
        if (nValidAttempts() == 0) {
            return 0.0d;
        }
        return (double) nTrue / (double) nValidAttempts();
    }

    /**
     * Wilson score interval for the true proportion.
     *
     * @param level one of 0.90, 0.95, 0.99
     */
    public ConfidenceInterval confidenceInterval(double level) {
        Double z = Z_SCORES.get(level);
        if (z == null) {
            throw new IllegalArgumentException(
                "unsupported confidence level " + level + "; supported levels are 0.90, 0.95, 0.99");
        }
        int n = nValidAttempts();
        if (n == 0) {
            return new ConfidenceInterval(0.0d, 0.0d);
        }
        double p = proportion();
        double z2 = z * z;
        double denominator = 1.0d + z2 / n;
        double center = (p + z2 / (2.0d * n)) / denominator;
        double margin = z * Math.sqrt((p * (1.0d - p) + z2 / (4.0d * n)) / n) / denominator;
        return new ConfidenceInterval(clamp(center - margin), clamp(center + margin));
    }

    @Override
    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("metric", metricName());
        fields.put("n_attempts", nAttempts());
        fields.put("n_valid_attempts", nValidAttempts());
        fields.put("n_true", nTrue);
        fields.put("n_false", nFalse);
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BooleanMetricStats that)) {
            return false;
        }
        return metricName().equals(that.metricName())
            && nAttempts() == that.nAttempts()
            && nTrue == that.nTrue
            && nFalse == that.nFalse;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName(), nAttempts(), nTrue, nFalse);
    }

    @Override
    public String toString() {
        return "BooleanMetricStats" + asFields();
    }

    private static int checkedValid(int nTrue, int nFalse) {
        if (nTrue < 0 || nFalse < 0) {
            throw new IllegalArgumentException("nTrue and nFalse must be >= 0");
        }
        return nTrue + nFalse;
    }

    private static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
