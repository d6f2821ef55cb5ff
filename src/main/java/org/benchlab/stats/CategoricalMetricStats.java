package org.benchlab.stats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Label frequency table of a categorical metric.
 *
 * <p>Labels are strings or integral numbers. Numbers are normalized to {@link Long}; the
 * sorted label order lists numbers ascending, then strings lexicographically. The mode is the
 * most frequent label, ties going to the first label in that order.
 */
public final class CategoricalMetricStats extends MetricStats {
    public static final Comparator<Object> LABEL_ORDER = CategoricalMetricStats::compareLabels;

    private final Map<Object, Long> counts;
    private final Object mode;

    private CategoricalMetricStats(String metricName, int nAttempts, Map<Object, Long> counts) {
        super(metricName, nAttempts, sum(counts));
        if (counts.isEmpty()) {
            throw new StatsInsufficientDataException(metricName, nAttempts);
        }
        this.counts = Collections.unmodifiableMap(counts);
        this.mode = findMode(counts);
    }

    public static CategoricalMetricStats of(String metricName, int nAttempts, Map<?, Long> counts) {
        Objects.requireNonNull(counts, "counts");
        TreeMap<Object, Long> sorted = new TreeMap<>(LABEL_ORDER);
        for (Map.Entry<?, Long> entry : counts.entrySet()) {
            long count = Objects.requireNonNull(entry.getValue(), "count");
            if (count < 0) {
                throw new IllegalArgumentException("label counts must be >= 0");
            }
            if (count > 0) {
                sorted.merge(normalizeLabel(metricName, entry.getKey()), count, Long::sum);
            }
        }
        return new CategoricalMetricStats(metricName, nAttempts, sorted);
    }

    public static CategoricalMetricStats fromEval(String metricName, List<?> values) {
        Objects.requireNonNull(values, "values");
        TreeMap<Object, Long> counts = new TreeMap<>(LABEL_ORDER);
        for (Object value : values) {
            if (value != null) {
                counts.merge(normalizeLabel(metricName, value), 1L, Long::sum);
            }
        }
        return new CategoricalMetricStats(metricName, values.size(), counts);
    }

    public static CategoricalMetricStats aggregate(List<CategoricalMetricStats> stats) {
        String name = requireSharedName(stats);
        int nAttempts = 0;
        TreeMap<Object, Long> counts = new TreeMap<>(LABEL_ORDER);
        for (CategoricalMetricStats item : stats) {
            nAttempts += item.nAttempts();
            for (Map.Entry<Object, Long> entry : item.counts.entrySet()) {
                counts.merge(entry.getKey(), entry.getValue(), Long::sum);
            }
        }
        return new CategoricalMetricStats(name, nAttempts, counts);
    }

    /**
     * Label counts in sorted label order.
     */
    public Map<Object, Long> counts() {
        return counts;
    }

    public Map<Object, Double> frequencies() {
        Map<Object, Double> frequencies = new LinkedHashMap<>();
        double nValid = nValidAttempts();
        for (Map.Entry<Object, Long> entry : counts.entrySet()) {
            frequencies.put(entry.getKey(), entry.getValue() / nValid);
        }
        return Collections.unmodifiableMap(frequencies);
    }

    public Object mode() {
        return mode;
    }

    @Override
    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("metric", metricName());
        fields.put("n_attempts", nAttempts());
        fields.put("n_valid_attempts", nValidAttempts());
        Map<String, Object> labelCounts = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> entry : counts.entrySet()) {
            labelCounts.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        fields.put("counts", labelCounts);
        fields.put("mode", mode);
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CategoricalMetricStats that)) {
            return false;
        }
        return metricName().equals(that.metricName())
            && nAttempts() == that.nAttempts()
            && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName(), nAttempts(), counts);
    }

    @Override
    public String toString() {
        return "CategoricalMetricStats" + asFields();
    }

    private static Object normalizeLabel(String metricName, Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number) && number == Math.rint(number)) {
                return (long) number;
            }
        }
        throw new IllegalArgumentException(
            "metric '" + metricName + "' expects string or integral labels, got " + value);
    }

    private static int compareLabels(Object left, Object right) {
        boolean leftNumber = left instanceof Long;
        boolean rightNumber = right instanceof Long;
        if (leftNumber && rightNumber) {
            return Long.compare((Long) left, (Long) right);
        }
        if (leftNumber != rightNumber) {
            return leftNumber ? -1 : 1;
        }
        return ((String) left).compareTo((String) right);
    }

    private static Object findMode(Map<Object, Long> sortedCounts) {
        Object best = null;
        long bestCount = -1L;
        for (Map.Entry<Object, Long> entry : sortedCounts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static int sum(Map<Object, Long> counts) {
        long total = 0L;
        for (long count : counts.values()) {
            total += count;
        }
        return Math.toIntExact(total);
    }
}
