package org.benchlab.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;

/**
 * Median success flag per instance, attempt-count-weighted mean across instances.
 */
public final class StatusAggregator implements Aggregator {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.aggregators", "StatusAggregator");

    @Override
    public String name() {
        return "status";
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Report aggregate(List<? extends Instance> instances) {
        Objects.requireNonNull(instances, "instances");
        Map<String, Double> inner = new LinkedHashMap<>();
        double weightedSum = 0.0d;
        long totalAttempts = 0L;
        for (Instance instance : instances) {
            List<Attempt> attempts = instance.attempts();
            if (attempts.isEmpty()) {
                continue;
            }
            List<Double> flags = new ArrayList<>(attempts.size());
            for (Attempt attempt : attempts) {
                flags.add(attempt.succeeded() ? 1.0d : 0.0d);
            }
            double median = Medians.of(flags);
            inner.put(instance.id(), median);
            weightedSum += median * attempts.size();
            totalAttempts += attempts.size();
        }
        double outer = totalAttempts == 0L ? 0.0d : weightedSum / totalAttempts;
        return new Report(name(), outer, inner);
    }

    @Override
    public String toString() {
        return "StatusAggregator";
    }
}
