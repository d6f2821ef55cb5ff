package org.benchlab.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.benchlab.fixtures.Callables;
import org.benchlab.model.Instance;
import org.benchlab.model.LabeledInstance;
import org.junit.jupiter.api.Test;

class DeadlineTimedExecutorTest {
    private final Instance instance = new LabeledInstance("q-1", "What is 6 * 7?", "42");

    @Test
    void returnsCallableOutputWithinDeadline() {
        try (DeadlineTimedExecutor executor = new DeadlineTimedExecutor()) {
            TimedExecution execution = executor.execute(new Callables.Constant(), Duration.ofSeconds(5), instance, Map.of());

            assertEquals(ExecutionOutcome.SUCCESS, execution.outcome());
            assertEquals("42", execution.result().orElseThrow().answer());
            assertEquals(Map.of("tokens", 3L), execution.result().orElseThrow().usage());
            assertTrue(execution.runtimeSeconds() >= 0.0d);
        }
    }

    @Test
    void reportsThrownExceptionAsError() {
        try (DeadlineTimedExecutor executor = new DeadlineTimedExecutor()) {
            TimedExecution execution = executor.execute(new Callables.Dividing(), Duration.ofSeconds(5), instance, Map.of());

            assertEquals(ExecutionOutcome.ERROR, execution.outcome());
            assertEquals("java.lang.ArithmeticException", execution.errorType().orElseThrow());
            assertTrue(execution.result().isEmpty());
        }
    }

    @Test
    void passesArgumentsToCallable() {
        try (DeadlineTimedExecutor executor = new DeadlineTimedExecutor()) {
            TimedExecution execution = executor.execute(
                new Callables.Dividing(),
                Duration.ofSeconds(5),
                instance,
                Map.of("divisor", "1")
            );

            assertEquals("1", execution.result().orElseThrow().answer());
        }
    }

    @Test
    void timesOutAndStaysUsable() {
        try (DeadlineTimedExecutor executor = new DeadlineTimedExecutor()) {
            TimedExecution timedOut = executor.execute(new Callables.Sleeping(), Duration.ofMillis(200), instance, Map.of());

            assertEquals(ExecutionOutcome.TIMEOUT, timedOut.outcome());
            assertEquals("TimeoutException", timedOut.errorType().orElseThrow());
            assertTrue(timedOut.runtimeSeconds() >= 0.2d);
            assertTrue(timedOut.runtimeSeconds() < 5.0d);

            TimedExecution next = executor.execute(new Callables.Constant(), Duration.ofSeconds(5), instance, Map.of());
            assertEquals(ExecutionOutcome.SUCCESS, next.outcome());
        }
    }

    @Test
    void nullTimeoutWaitsForCompletion() {
        try (DeadlineTimedExecutor executor = new DeadlineTimedExecutor()) {
            TimedExecution execution = executor.execute((target, args) -> BenchmarkOutput.of(target.id()), null, instance, null);

            assertEquals("q-1", execution.result().orElseThrow().answer());
        }
    }
}
