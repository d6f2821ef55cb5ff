package org.benchlab.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.obs.JsonLinesLogger;

/**
 * Stateless scoring strategy mapping (instance, attempt) to a typed, possibly-null score.
 *
 * @param <T> score type
 */
public interface Metric<T> {
    String name();

    MetricType type();

    TypeTag typeTag();

    /**
     * Constructor parameters persisted with the metric so it can be rebuilt from an artifact.
     */
    default Map<String, Object> parameters() {
        return Map.of();
    }

    /**
     * Score of one attempt, or null when the attempt cannot be scored (no response).
     */
    T score(Instance instance, Attempt attempt);

    /**
     * Scores every attempt of the instance in order.
     */
    default List<T> evaluate(Instance instance) {
        return evaluate(instance, instance.attempts());
    }

    default List<T> evaluate(Instance instance, List<Attempt> attempts) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(attempts, "attempts");
        List<T> scores = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            scores.add(score(instance, attempt));
        }
        return scores;
    }

    /**
     * Returns a copy of the instance with this metric's scores stored under {@link #name()}.
     * An existing entry for the same name is overwritten and a warning is logged.
     */
    default Instance apply(Instance instance, JsonLinesLogger logger, CorrelationContext context) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(context, "context");
        if (instance.hasEvaluation(name())) {
            logger.warn(
                "overwriting existing metric scores",
                CorrelationContext.builder(context.benchmark(), context.stage()).instanceId(instance.id()).build(),
                Map.of("metric", name())
            );
        }
        return instance.withEvaluation(name(), evaluate(instance));
    }
}
