package org.benchlab.stats;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.ConsistencyException;

/**
 * Summary of one metric's scores over a scope (one instance, or many pooled).
 */
public abstract class MetricStats {
    private final String metricName;
    private final int nAttempts;
    private final int nValidAttempts;

    protected MetricStats(String metricName, int nAttempts, int nValidAttempts) {
        Objects.requireNonNull(metricName, "metricName");
        if (metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must not be blank");
        }
        if (nAttempts < 0) {
            throw new IllegalArgumentException("nAttempts must be >= 0");
        }
        if (nValidAttempts < 0 || nValidAttempts > nAttempts) {
            throw new IllegalArgumentException("nValidAttempts must be within [0, nAttempts]");
        }
        this.metricName = metricName;
        this.nAttempts = nAttempts;
        this.nValidAttempts = nValidAttempts;
    }

    public final String metricName() {
        return metricName;
    }

    public final int nAttempts() {
        return nAttempts;
    }

    public final int nValidAttempts() {
        return nValidAttempts;
    }

    /**
     * Flat field map used for reporting and CSV/JSON rendering.
     */
    public abstract Map<String, Object> asFields();

    static String requireSharedName(List<? extends MetricStats> stats) {
        Objects.requireNonNull(stats, "stats");
        if (stats.isEmpty()) {
            throw new IllegalArgumentException("cannot aggregate an empty stats list");
        }
        String name = Objects.requireNonNull(stats.get(0), "stats[0]").metricName();
        for (int i = 1; i < stats.size(); i++) {
            MetricStats item = Objects.requireNonNull(stats.get(i), "stats[" + i + "]");
            if (!name.equals(item.metricName())) {
                throw new ConsistencyException(
                    "cannot aggregate stats of different metrics: '" + name + "' and '" + item.metricName() + "'");
            }
        }
        return name;
    }
}
