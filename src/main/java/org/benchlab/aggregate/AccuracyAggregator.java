package org.benchlab.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;
import org.benchlab.stats.BooleanMetricStats;

/**
 * Accuracy of a boolean target metric: per-instance true ratio over valid scores, and the
 * pooled (micro-averaged) ratio across instances. Instances without a valid score are left out.
 */
public final class AccuracyAggregator implements Aggregator {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.aggregators", "AccuracyAggregator");

    private final String target;

    public AccuracyAggregator(String target) {
        this.target = Scores.requireTarget(target);
    }

    public String target() {
        return target;
    }

    @Override
    public String name() {
        return "accuracy_" + target;
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
        List<BooleanMetricStats> stats = new ArrayList<>();
        for (Instance instance : instances) {
            List<Object> scores = Scores.require(instance, target, name());
            if (scores.stream().allMatch(Objects::isNull)) {
                continue;
            }
            BooleanMetricStats instanceStats = BooleanMetricStats.fromEval(target, scores);
            inner.put(instance.id(), instanceStats.proportion());
            stats.add(instanceStats);
        }
        double outer = stats.isEmpty() ? 0.0d : BooleanMetricStats.aggregate(stats).proportion();
        return new Report(name(), outer, inner);
    }

    @Override
    public String toString() {
        return "AccuracyAggregator{target=" + target + "}";
    }
}
