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
 * Median runtime of successful attempts per instance, geometric mean across instances.
 *
 * <p>Instances without a successful timed attempt are left out of the report.
 */
public final class RuntimesAggregator implements Aggregator {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.aggregators", "RuntimesAggregator");

    @Override
    public String name() {
        return "runtimes";
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Report aggregate(List<? extends Instance> instances) {
        Objects.requireNonNull(instances, "instances");
        Map<String, Double> inner = new LinkedHashMap<>();
        for (Instance instance : instances) {
            List<Double> runtimes = new ArrayList<>();
            for (Attempt attempt : instance.attempts()) {
                if (attempt.succeeded() && attempt.runtime().isPresent()) {
                    runtimes.add(attempt.runtime().get());
                }
            }
            if (!runtimes.isEmpty()) {
                inner.put(instance.id(), Medians.of(runtimes));
            }
        }
        return new Report(name(), geometricMean(inner.values()), inner);
    }

    static double geometricMean(Iterable<Double> values) {
        double logSum = 0.0d;
        int count = 0;
        for (double value : values) {
            if (value <= 0.0d) {
                return 0.0d;
            }
            logSum += Math.log(value);
            count++;
        }
        if (count == 0) {
            return 0.0d;
        }
        return Math.exp(logSum / count);
    }

    @Override
    public String toString() {
        return "RuntimesAggregator";
    }
}
