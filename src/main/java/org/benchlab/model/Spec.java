package org.benchlab.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Configuration and bookkeeping for one benchmark run.
 *
 * <p>Immutable. {@link #withExecutionTime(double)} and {@link #withEvaluationTime(double)}
 * return updated copies.
 */
public final class Spec {
    public static final String NAME = "name";
    public static final String INSTANCE_IDS = "instance_ids";
    public static final String N_ATTEMPTS = "n_attempts";
    public static final String N_INSTANCE = "n_instance";
    public static final String TIMEOUT = "timeout";
    public static final String LOGS_FILEPATH = "logs_filepath";
    public static final String EXECUTION_TIME = "execution_time";
    public static final String EVALUATION_TIME = "evaluation_time";

    public static final List<String> FIELD_NAMES = List.of(
        NAME,
        INSTANCE_IDS,
        N_ATTEMPTS,
        N_INSTANCE,
        TIMEOUT,
        LOGS_FILEPATH,
        EXECUTION_TIME,
        EVALUATION_TIME
    );

    private final String name;
    private final List<String> instanceIds;
    private final int nAttempts;
    private final Integer nInstance;
    private final Double timeout;
    private final String logsFilepath;
    private final Double executionTime;
    private final Double evaluationTime;

    private Spec(Builder builder) {
        List<String> errors = new ArrayList<>();
        String normalizedName = normalize(builder.name);
        if (normalizedName == null) {
            errors.add("name must not be blank");
        }
        if (builder.nAttempts <= 0) {
            errors.add("n_attempts must be a strictly positive integer, got " + builder.nAttempts);
        }
        if (builder.nInstance != null && builder.nInstance <= 0) {
            errors.add("n_instance must be a strictly positive integer or unset to select all instances, got "
                + builder.nInstance);
        }
        if (builder.timeout != null && (!Double.isFinite(builder.timeout) || builder.timeout <= 0.0d)) {
            errors.add("timeout must be strictly positive, got " + builder.timeout);
        }
        if (builder.executionTime != null && builder.executionTime < 0.0d) {
            errors.add("execution_time must be >= 0");
        }
        if (builder.evaluationTime != null && builder.evaluationTime < 0.0d) {
            errors.add("evaluation_time must be >= 0");
        }
        List<String> ids = new ArrayList<>(builder.instanceIds.size());
        for (String id : builder.instanceIds) {
            String normalizedId = normalize(id);
            if (normalizedId == null) {
                errors.add("instance_ids must not contain blank ids");
                continue;
            }
            ids.add(normalizedId);
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }

        this.name = normalizedName;
        this.instanceIds = List.copyOf(ids);
        this.nAttempts = builder.nAttempts;
        this.nInstance = builder.nInstance;
        this.timeout = builder.timeout;
        this.logsFilepath = normalize(builder.logsFilepath);
        this.executionTime = builder.executionTime;
        this.evaluationTime = builder.evaluationTime;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Spec with a random name and default settings.
     */
    public static Spec anonymous() {
        return builder(UUID.randomUUID().toString()).build();
    }

    public String name() {
        return name;
    }

    public List<String> instanceIds() {
        return instanceIds;
    }

    public int nAttempts() {
        return nAttempts;
    }

    public Optional<Integer> nInstance() {
        return Optional.ofNullable(nInstance);
    }

    /**
     * Per-attempt deadline in seconds; empty means unbounded.
     */
    public Optional<Double> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> logsFilepath() {
        return Optional.ofNullable(logsFilepath);
    }

    public Optional<Double> executionTime() {
        return Optional.ofNullable(executionTime);
    }

    public Optional<Double> evaluationTime() {
        return Optional.ofNullable(evaluationTime);
    }

    public Spec withExecutionTime(double seconds) {
        return toBuilder().executionTime(seconds).build();
    }

    public Spec withEvaluationTime(double seconds) {
        return toBuilder().evaluationTime(seconds).build();
    }

    public Builder toBuilder() {
        return new Builder(name)
            .instanceIds(instanceIds)
            .nAttempts(nAttempts)
            .nInstance(nInstance)
            .timeout(timeout)
            .logsFilepath(logsFilepath)
            .executionTime(executionTime)
            .evaluationTime(evaluationTime);
    }

    /**
     * Flat snake_case field map, as written in artifacts and config files.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(NAME, name);
        fields.put(INSTANCE_IDS, instanceIds);
        fields.put(N_ATTEMPTS, nAttempts);
        fields.put(N_INSTANCE, nInstance);
        fields.put(TIMEOUT, timeout);
        fields.put(LOGS_FILEPATH, logsFilepath);
        fields.put(EXECUTION_TIME, executionTime);
        fields.put(EVALUATION_TIME, evaluationTime);
        return fields;
    }

    /**
     * Inverse of {@link #toMap()}; unknown keys are rejected.
     */
    public static Spec fromMap(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        List<String> errors = new ArrayList<>();
        for (String key : fields.keySet()) {
            if (!FIELD_NAMES.contains(key)) {
                errors.add("unknown spec field: " + key);
            }
        }
        Object rawName = fields.get(NAME);
        if (!(rawName instanceof String)) {
            errors.add("name must be a string");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        Builder builder = builder((String) rawName);
        Object rawIds = fields.get(INSTANCE_IDS);
        if (rawIds != null) {
            if (!(rawIds instanceof List<?> idList)) {
                throw new ConfigurationException("instance_ids must be a list");
            }
            List<String> ids = new ArrayList<>(idList.size());
            for (Object id : idList) {
                ids.add(id == null ? null : String.valueOf(id));
            }
            builder.instanceIds(ids);
        }
        Integer nAttempts = readInteger(fields, N_ATTEMPTS);
        if (nAttempts != null) {
            builder.nAttempts(nAttempts);
        }
        return builder
            .nInstance(readInteger(fields, N_INSTANCE))
            .timeout(readDouble(fields, TIMEOUT))
            .logsFilepath(readString(fields, LOGS_FILEPATH))
            .executionTime(readDouble(fields, EXECUTION_TIME))
            .evaluationTime(readDouble(fields, EVALUATION_TIME))
            .build();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Spec that)) {
            return false;
        }
        return nAttempts == that.nAttempts
            && name.equals(that.name)
            && instanceIds.equals(that.instanceIds)
            && Objects.equals(nInstance, that.nInstance)
            && Objects.equals(timeout, that.timeout)
            && Objects.equals(logsFilepath, that.logsFilepath)
            && Objects.equals(executionTime, that.executionTime)
            && Objects.equals(evaluationTime, that.evaluationTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, instanceIds, nAttempts, nInstance, timeout, logsFilepath, executionTime, evaluationTime);
    }

    @Override
    public String toString() {
        return "Spec" + toMap();
    }

    private static Integer readInteger(Map<String, ?> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            try {
                return Math.toIntExact(number.longValue());
            } catch (ArithmeticException e) {
                throw new ConfigurationException(key + " is out of integer range, got " + value);
            }
        }
        throw new ConfigurationException(key + " must be an integer, got " + value);
    }

    private static Double readDouble(Map<String, ?> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ConfigurationException(key + " must be a number, got " + value);
    }

    private static String readString(Map<String, ?> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new ConfigurationException(key + " must be a string, got " + value);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String name;
        private List<String> instanceIds = List.of();
        private int nAttempts = 1;
        private Integer nInstance;
        private Double timeout;
        private String logsFilepath;
        private Double executionTime;
        private Double evaluationTime;

        private Builder(String name) {
            this.name = name;
        }

        public Builder instanceIds(List<String> instanceIds) {
            this.instanceIds = instanceIds == null ? List.of() : new ArrayList<>(instanceIds);
            return this;
        }

        public Builder nAttempts(int nAttempts) {
            this.nAttempts = nAttempts;
            return this;
        }

        public Builder nInstance(Integer nInstance) {
            this.nInstance = nInstance;
            return this;
        }

        public Builder timeout(Double timeoutSeconds) {
            this.timeout = timeoutSeconds;
            return this;
        }

        public Builder logsFilepath(String logsFilepath) {
            this.logsFilepath = logsFilepath;
            return this;
        }

        public Builder executionTime(Double executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder evaluationTime(Double evaluationTime) {
            this.evaluationTime = evaluationTime;
            return this;
        }

        public Spec build() {
            return new Spec(this);
        }
    }
}
