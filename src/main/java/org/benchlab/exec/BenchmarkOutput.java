package org.benchlab.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value returned by the callable under test: the answer to score plus optional
 * resource-usage counters (tokens, calls, ...).
 */
public final class BenchmarkOutput {
    private final String answer;
    private final Map<String, Long> usage;

    private BenchmarkOutput(String answer, Map<String, Long> usage) {
        this.answer = answer;
        Map<String, Long> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : Objects.requireNonNull(usage, "usage").entrySet()) {
            copy.put(
                Objects.requireNonNull(entry.getKey(), "usage key"),
                Objects.requireNonNull(entry.getValue(), "usage value")
            );
        }
        this.usage = Collections.unmodifiableMap(copy);
    }

    public static BenchmarkOutput of(String answer) {
        return new BenchmarkOutput(answer, Map.of());
    }

    public static BenchmarkOutput of(String answer, Map<String, Long> usage) {
        return new BenchmarkOutput(answer, usage);
    }

    public String answer() {
        return answer;
    }

    public Map<String, Long> usage() {
        return usage;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BenchmarkOutput that)) {
            return false;
        }
        return Objects.equals(answer, that.answer) && usage.equals(that.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(answer, usage);
    }

    @Override
    public String toString() {
        return "BenchmarkOutput{answer=" + answer + ", usage=" + usage + "}";
    }
}
