package org.benchlab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One timed trial of the callable under test against one instance.
 */
public final class Attempt {
    private final String response;
    private final Double runtime;
    private final AttemptStatus status;
    private final Map<String, Long> usage;

    public Attempt(String response, Double runtime, AttemptStatus status, Map<String, Long> usage) {
        if (runtime != null && (!Double.isFinite(runtime) || runtime < 0.0d)) {
            throw new IllegalArgumentException("runtime must be >= 0, got " + runtime);
        }
        this.response = response;
        this.runtime = runtime;
        this.status = Objects.requireNonNull(status, "status");
        this.usage = copyUsage(usage);
    }

    public Attempt(String response, Double runtime, AttemptStatus status) {
        this(response, runtime, status, Map.of());
    }

    public static Attempt success(String response, double runtime) {
        return new Attempt(response, runtime, AttemptStatus.SUCCESS);
    }

    public static Attempt failure(double runtime) {
        return new Attempt(null, runtime, AttemptStatus.FAILURE);
    }

    public static Attempt timeout(double runtime) {
        return new Attempt(null, runtime, AttemptStatus.TIMEOUT);
    }

    public Optional<String> response() {
        return Optional.ofNullable(response);
    }

    /**
     * Elapsed wall time in seconds, when measured.
     */
    public Optional<Double> runtime() {
        return Optional.ofNullable(runtime);
    }

    public AttemptStatus status() {
        return status;
    }

    public boolean succeeded() {
        return status == AttemptStatus.SUCCESS;
    }

    public Map<String, Long> usage() {
        return usage;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Attempt that)) {
            return false;
        }
        return Objects.equals(response, that.response)
            && Objects.equals(runtime, that.runtime)
            && status == that.status
            && usage.equals(that.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(response, runtime, status, usage);
    }

    @Override
    public String toString() {
        return "Attempt{status=" + status + ", runtime=" + runtime + ", response=" + response + ", usage=" + usage + "}";
    }

    private static Map<String, Long> copyUsage(Map<String, Long> usage) {
        if (usage == null || usage.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : usage.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "usage key");
            copy.put(key, Objects.requireNonNull(entry.getValue(), "usage value for " + key));
        }
        return Collections.unmodifiableMap(copy);
    }
}
