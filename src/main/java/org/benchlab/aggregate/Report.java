package org.benchlab.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one aggregator: a cross-instance scalar plus the per-instance values it was
 * reduced from, keyed by instance id in instance order.
 */
public final class Report {
    private final String aggregatorName;
    private final double outer;
    private final Map<String, Double> inner;

    public Report(String aggregatorName, double outer, Map<String, Double> inner) {
        this.aggregatorName = Objects.requireNonNull(aggregatorName, "aggregatorName");
        this.outer = outer;
        Objects.requireNonNull(inner, "inner");
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : inner.entrySet()) {
            copy.put(
                Objects.requireNonNull(entry.getKey(), "instance id"),
                Objects.requireNonNull(entry.getValue(), "inner value")
            );
        }
        this.inner = Collections.unmodifiableMap(copy);
    }

    public String aggregatorName() {
        return aggregatorName;
    }

    public double outer() {
        return outer;
    }

    public Map<String, Double> inner() {
        return inner;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Report that)) {
            return false;
        }
        return aggregatorName.equals(that.aggregatorName)
            && Double.compare(outer, that.outer) == 0
            && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregatorName, outer, inner);
    }

    @Override
    public String toString() {
        return "Report{aggregator=" + aggregatorName + ", outer=" + outer + ", inner=" + inner + "}";
    }
}
