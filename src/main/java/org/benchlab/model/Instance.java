package org.benchlab.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One labeled unit of benchmark work together with its attempts and per-metric scores.
 *
 * <p>Instances are immutable. Every update returns a new instance built by the subclass's
 * {@link #rebuild(List, Map)}, so a stage never observes changes made by a later stage.
 */
public abstract class Instance {
    private final String id;
    private final List<Attempt> attempts;
    private final Map<String, List<Object>> evaluations;

    protected Instance(String id, List<Attempt> attempts, Map<String, List<Object>> evaluations) {
        this.id = requireText(id, "id");
        this.attempts = copyAttempts(attempts);
        this.evaluations = copyEvaluations(evaluations);
    }

    public final String id() {
        return id;
    }

    public final List<Attempt> attempts() {
        return attempts;
    }

    /**
     * Metric name to per-attempt scores, in attempt order. Scores may be null.
     */
    public final Map<String, List<Object>> evaluations() {
        return evaluations;
    }

    public final List<Object> evaluation(String metricName) {
        List<Object> scores = evaluations.get(metricName);
        return scores == null ? List.of() : scores;
    }

    public final boolean hasEvaluation(String metricName) {
        return evaluations.containsKey(metricName);
    }

    public abstract Object groundTruth();

    public abstract TypeTag typeTag();

    /**
     * Domain fields persisted next to the bookkeeping fields of an artifact record.
     */
    public abstract Map<String, Object> fields();

    /**
     * Copy of this instance with the given attempts and evaluations and unchanged domain fields.
     */
    protected abstract Instance rebuild(List<Attempt> attempts, Map<String, List<Object>> evaluations);

    public final Instance withAttempt(Attempt attempt) {
        Objects.requireNonNull(attempt, "attempt");
        List<Attempt> updated = new ArrayList<>(attempts);
        updated.add(attempt);
        return checkedRebuild(updated, evaluations);
    }

    public final Instance withAttempts(List<Attempt> newAttempts) {
        return checkedRebuild(newAttempts, evaluations);
    }

    public final Instance withEvaluation(String metricName, List<?> scores) {
        String name = requireText(metricName, "metricName");
        Objects.requireNonNull(scores, "scores");
        Map<String, List<Object>> updated = new LinkedHashMap<>(evaluations);
        updated.put(name, new ArrayList<>(scores));
        return checkedRebuild(attempts, updated);
    }

    public final Instance withoutEvaluations() {
        return checkedRebuild(attempts, Map.of());
    }

    /**
     * Copy with neither attempts nor evaluations, as selected for a fresh run.
     */
    public final Instance cleared() {
        return checkedRebuild(List.of(), Map.of());
    }

    public final List<String> responses() {
        List<String> responses = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            responses.add(attempt.response().orElse(null));
        }
        return Collections.unmodifiableList(responses);
    }

    public final List<Double> runtimes() {
        List<Double> runtimes = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            runtimes.add(attempt.runtime().orElse(null));
        }
        return Collections.unmodifiableList(runtimes);
    }

    public final List<AttemptStatus> statuses() {
        List<AttemptStatus> statuses = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            statuses.add(attempt.status());
        }
        return List.copyOf(statuses);
    }

    /**
     * Usage counters summed over all attempts.
     */
    public final Map<String, Long> usage() {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (Attempt attempt : attempts) {
            for (Map.Entry<String, Long> entry : attempt.usage().entrySet()) {
                totals.merge(entry.getKey(), entry.getValue(), Long::sum);
            }
        }
        return Collections.unmodifiableMap(totals);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        Instance that = (Instance) other;
        return id.equals(that.id)
            && attempts.equals(that.attempts)
            && evaluations.equals(that.evaluations)
            && fields().equals(that.fields());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id, attempts, evaluations, fields());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", attempts=" + attempts.size()
            + ", metrics=" + evaluations.keySet() + "}";
    }

    private Instance checkedRebuild(List<Attempt> newAttempts, Map<String, List<Object>> newEvaluations) {
        Instance rebuilt = rebuild(newAttempts, newEvaluations);
        if (rebuilt == null || rebuilt.getClass() != getClass()) {
            throw new IllegalStateException(
                getClass().getName() + ".rebuild must return a " + getClass().getSimpleName());
        }
        return rebuilt;
    }

    private static List<Attempt> copyAttempts(List<Attempt> attempts) {
        Objects.requireNonNull(attempts, "attempts");
        List<Attempt> copy = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            copy.add(Objects.requireNonNull(attempt, "attempt"));
        }
        return List.copyOf(copy);
    }

    private static Map<String, List<Object>> copyEvaluations(Map<String, List<Object>> evaluations) {
        Objects.requireNonNull(evaluations, "evaluations");
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : evaluations.entrySet()) {
            String name = requireText(entry.getKey(), "metric name");
            List<Object> scores = Objects.requireNonNull(entry.getValue(), "scores for " + name);
            copy.put(name, Collections.unmodifiableList(new ArrayList<>(scores)));
        }
        return Collections.unmodifiableMap(copy);
    }

    protected static String requireText(String value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }
}
