package org.benchlab.stats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mean, population standard deviation and range of a numeric metric.
 */
public final class RegressionMetricStats extends MetricStats {
    private final double mean;
    private final double std;
    private final double min;
    private final double max;

    private RegressionMetricStats(
        String metricName,
        int nAttempts,
        int nValidAttempts,
        double mean,
        double std,
        double min,
        double max
    ) {
        super(metricName, nAttempts, nValidAttempts);
        if (nValidAttempts == 0) {
            throw new StatsInsufficientDataException(metricName, nAttempts);
        }
        if (std < 0.0d) {
            throw new IllegalArgumentException("std must be >= 0");
        }
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max");
        }
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
    }

    public static RegressionMetricStats of(
        String metricName,
        int nAttempts,
        int nValidAttempts,
        double mean,
        double std,
        double min,
        double max
    ) {
        return new RegressionMetricStats(metricName, nAttempts, nValidAttempts, mean, std, min, max);
    }

    public static RegressionMetricStats fromEval(String metricName, List<?> values) {
        Objects.requireNonNull(values, "values");
        int nValid = 0;
        double sum = 0.0d;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            double number = toDouble(metricName, value);
            nValid++;
            sum += number;
            min = Math.min(min, number);
            max = Math.max(max, number);
        }
        if (nValid == 0) {
            throw new StatsInsufficientDataException(metricName, values.size());
        }
        double mean = sum / nValid;
        double squares = 0.0d;
        for (Object value : values) {
            if (value != null) {
                double delta = toDouble(metricName, value) - mean;
                squares += delta * delta;
            }
        }
        return new RegressionMetricStats(metricName, values.size(), nValid, mean, Math.sqrt(squares / nValid), min, max);
    }

    /**
     * Pools groups as if their underlying values had been concatenated.
     */
    public static RegressionMetricStats aggregate(List<RegressionMetricStats> stats) {
        String name = requireSharedName(stats);
        int nAttempts = 0;
        int nValid = 0;
        double weightedSum = 0.0d;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (RegressionMetricStats item : stats) {
            nAttempts += item.nAttempts();
            nValid += item.nValidAttempts();
            weightedSum += item.nValidAttempts() * item.mean;
            min = Math.min(min, item.min);
            max = Math.max(max, item.max);
        }
        double mean = weightedSum / nValid;
        double pooled = 0.0d;
        for (RegressionMetricStats item : stats) {
            double shift = item.mean - mean;
            pooled += item.nValidAttempts() * (item.std * item.std + shift * shift);
        }
        return new RegressionMetricStats(name, nAttempts, nValid, mean, Math.sqrt(pooled / nValid), min, max);
    }

    public double mean() {
        return mean;
    }

    public double std() {
        return std;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    @Override
    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("metric", metricName());
        fields.put("n_attempts", nAttempts());
        fields.put("n_valid_attempts", nValidAttempts());
        fields.put("mean", mean);
        fields.put("std", std);
        fields.put("min", min);
        fields.put("max", max);
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RegressionMetricStats that)) {
            return false;
        }
        return metricName().equals(that.metricName())
            && nAttempts() == that.nAttempts()
            && nValidAttempts() == that.nValidAttempts()
            && Double.compare(mean, that.mean) == 0
            && Double.compare(std, that.std) == 0
            && Double.compare(min, that.min) == 0
            && Double.compare(max, that.max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName(), nAttempts(), nValidAttempts(), mean, std, min, max);
    }

    @Override
    public String toString() {
        return "RegressionMetricStats" + asFields();
    }

    private static double toDouble(String metricName, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException(
            "metric '" + metricName + "' expects numeric scores, got " + value.getClass().getSimpleName());
    }
}
