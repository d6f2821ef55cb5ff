package org.benchlab.aggregate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;

/**
 * Majority vote over a target metric.
 *
 * <p>Inner: fraction of an instance's attempts scored positive (null scores count as not
 * positive). Outer: 1 when more than half of the reported instances have an inner value above
 * 0.5, else 0. This counts instance majorities rather than thresholding the mean inner value,
 * so inner values {@code [0.6, 0.6, 0.0]} give an outer of 1 although their mean is 0.4.
 */
public final class ConsensusAggregator implements Aggregator {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.aggregators", "ConsensusAggregator");

    private final String target;

    public ConsensusAggregator(String target) {
        this.target = Scores.requireTarget(target);
    }

    public String target() {
        return target;
    }

    @Override
    public String name() {
        return "consensus_" + target;
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
        if (instances.isEmpty()) {
            throw new IllegalArgumentException(name() + ": cannot aggregate an empty instance list");
        }
        Map<String, Double> inner = new LinkedHashMap<>();
        int majorities = 0;
        for (Instance instance : instances) {
            List<Object> scores = Scores.require(instance, target, name());
            int attempts = instance.attempts().size();
            if (attempts == 0) {
                continue;
            }
            int positive = 0;
            for (Object score : scores) {
                if (Scores.isPositive(score)) {
                    positive++;
                }
            }
            double rate = (double) positive / attempts;
            inner.put(instance.id(), rate);
            if (rate > 0.5d) {
                majorities++;
            }
        }
        double outer = !inner.isEmpty() && majorities * 2 > inner.size() ? 1.0d : 0.0d;
        return new Report(name(), outer, inner);
    }

    @Override
    public String toString() {
        return "ConsensusAggregator{target=" + target + "}";
    }
}
