package org.benchlab.exec;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one deadline-bound call.
 */
public final class TimedExecution {
    private final double runtimeSeconds;
    private final ExecutionOutcome outcome;
    private final BenchmarkOutput result;
    private final String errorType;
    private final String errorMessage;

    private TimedExecution(
        double runtimeSeconds,
        ExecutionOutcome outcome,
        BenchmarkOutput result,
        String errorType,
        String errorMessage
    ) {
        if (!Double.isFinite(runtimeSeconds) || runtimeSeconds < 0.0d) {
            throw new IllegalArgumentException("runtimeSeconds must be >= 0");
        }
        this.runtimeSeconds = runtimeSeconds;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.result = result;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        if (outcome == ExecutionOutcome.SUCCESS && result == null) {
            throw new IllegalArgumentException("result is required for success executions");
        }
        if (outcome != ExecutionOutcome.SUCCESS && result != null) {
            throw new IllegalArgumentException("result must be null for " + outcome + " executions");
        }
    }

    public static TimedExecution success(double runtimeSeconds, BenchmarkOutput result) {
        return new TimedExecution(runtimeSeconds, ExecutionOutcome.SUCCESS, Objects.requireNonNull(result, "result"), null, null);
    }

    public static TimedExecution timeout(double runtimeSeconds) {
        return new TimedExecution(
            runtimeSeconds,
            ExecutionOutcome.TIMEOUT,
            null,
            "TimeoutException",
            String.format(Locale.ROOT, "deadline exceeded after %.3fs", runtimeSeconds)
        );
    }

    public static TimedExecution error(double runtimeSeconds, String errorType, String errorMessage) {
        return new TimedExecution(
            runtimeSeconds,
            ExecutionOutcome.ERROR,
            null,
            Objects.requireNonNull(errorType, "errorType"),
            errorMessage
        );
    }

    public static TimedExecution error(double runtimeSeconds, Throwable error) {
        Objects.requireNonNull(error, "error");
        return error(runtimeSeconds, error.getClass().getName(), error.getMessage());
    }

    public double runtimeSeconds() {
        return runtimeSeconds;
    }

    public ExecutionOutcome outcome() {
        return outcome;
    }

    public Optional<BenchmarkOutput> result() {
        return Optional.ofNullable(result);
    }

    public Optional<String> errorType() {
        return Optional.ofNullable(errorType);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "TimedExecution{outcome=" + outcome + ", runtime=" + runtimeSeconds
            + (result != null ? ", result=" + result : "")
            + (errorType != null ? ", error=" + errorType + ": " + errorMessage : "")
            + "}";
    }
}
