package org.benchlab.aggregate;

import java.util.List;
import java.util.Objects;
import org.benchlab.model.ConsistencyException;
import org.benchlab.model.Instance;

/**
 * Helpers shared by aggregators that read one target metric.
 */
final class Scores {
    private Scores() {
    }

    static String requireTarget(String target) {
        Objects.requireNonNull(target, "target");
        String trimmed = target.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        return trimmed;
    }

    static List<Object> require(Instance instance, String target, String aggregatorName) {
        if (!instance.hasEvaluation(target)) {
            throw new ConsistencyException(
                aggregatorName + ": instance '" + instance.id() + "' was never scored for metric '" + target + "'");
        }
        return instance.evaluation(target);
    }

    static boolean isPositive(Object score) {
        if (score instanceof Boolean flag) {
            return flag;
        }
        if (score instanceof Number number) {
            return number.doubleValue() > 0.0d;
        }
        return false;
    }
}
