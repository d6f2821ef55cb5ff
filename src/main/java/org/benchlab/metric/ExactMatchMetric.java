package org.benchlab.metric;

import java.util.Map;
import java.util.regex.Pattern;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;

/**
 * True when the ground truth occurs as a whole word in the response, ignoring case.
 */
public final class ExactMatchMetric implements Metric<Boolean> {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.metrics", "ExactMatchMetric");
    public static final String DEFAULT_NAME = "exact_match";

    private final String name;

    public ExactMatchMetric() {
        this(DEFAULT_NAME);
    }

    public ExactMatchMetric(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name.trim();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public MetricType type() {
        return MetricType.BOOLEAN;
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("name", name);
    }

    @Override
    public Boolean score(Instance instance, Attempt attempt) {
        String response = attempt.response().orElse(null);
        Object groundTruth = instance.groundTruth();
        if (response == null || groundTruth == null) {
            return null;
        }
        Pattern pattern = Pattern.compile(
            "\\b" + Pattern.quote(String.valueOf(groundTruth)) + "\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
        return pattern.matcher(response).find();
    }

    @Override
    public String toString() {
        return "ExactMatchMetric{name=" + name + "}";
    }
}
