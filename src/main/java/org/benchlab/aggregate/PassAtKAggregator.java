package org.benchlab.aggregate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;

/**
 * pass@k with k equal to the attempts per instance: an instance passes when any attempt
 * scored positive for the target metric.
 */
public final class PassAtKAggregator implements Aggregator {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.aggregators", "PassAtKAggregator");

    private final String target;

    public PassAtKAggregator(String target) {
        this.target = Scores.requireTarget(target);
    }

    public String target() {
        return target;
    }

    @Override
    public String name() {
        return "pass_at_k_" + target;
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("target", target);
    }

    @Override
    public Report aggregate(List<? extends Instance> instances) {
        Objects.requireNonNull(instances, "instances");
        Map<String, Double> inner = new LinkedHashMap<>();
        double passed = 0.0d;
        for (Instance instance : instances) {
            List<Object> scores = Scores.require(instance, target, name());
            if (instance.attempts().isEmpty()) {
                continue;
            }
            double value = scores.stream().anyMatch(Scores::isPositive) ? 1.0d : 0.0d;
            inner.put(instance.id(), value);
            passed += value;
        }
        double outer = inner.isEmpty() ? 0.0d : passed / inner.size();
        return new Report(name(), outer, inner);
    }

    @Override
    public String toString() {
        return "PassAtKAggregator{target=" + target + "}";
    }
}
