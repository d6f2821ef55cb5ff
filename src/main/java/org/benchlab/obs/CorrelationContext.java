package org.benchlab.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event: which benchmark,
 * which lifecycle stage, and optionally which instance and attempt.
 */
public final class CorrelationContext {
    private final String benchmark;
    private final String stage;
    private final String instanceId;
    private final Integer attempt;

    private CorrelationContext(Builder builder) {
        this.benchmark = requireText(builder.benchmark, "benchmark");
        this.stage = requireText(builder.stage, "stage");
        this.instanceId = normalize(builder.instanceId);
        if (builder.attempt != null && builder.attempt <= 0) {
            throw new IllegalArgumentException("attempt must be > 0");
        }
        this.attempt = builder.attempt;
    }

    public static CorrelationContext of(String benchmark, String stage) {
        return builder(benchmark, stage).build();
    }

    public static Builder builder(String benchmark, String stage) {
        return new Builder(benchmark, stage);
    }

    public String benchmark() {
        return benchmark;
    }

    public String stage() {
        return stage;
    }

    public Optional<String> instanceId() {
        return Optional.ofNullable(instanceId);
    }

    public Optional<Integer> attempt() {
        return Optional.ofNullable(attempt);
    }

    public CorrelationContext forAttempt(String instanceId, int attempt) {
        return builder(benchmark, stage).instanceId(instanceId).attempt(attempt).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("benchmark", benchmark);
        fields.put("stage", stage);
        if (instanceId != null) {
            fields.put("instanceId", instanceId);
        }
        if (attempt != null) {
            fields.put("attempt", attempt);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String benchmark;
        private final String stage;
        private String instanceId;
        private Integer attempt;

        private Builder(String benchmark, String stage) {
            this.benchmark = Objects.requireNonNull(benchmark, "benchmark");
            this.stage = Objects.requireNonNull(stage, "stage");
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder attempt(Integer attempt) {
            this.attempt = attempt;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
