package org.benchlab.exec;

import java.time.Duration;
import java.util.Map;
import org.benchlab.model.Instance;

/**
 * Runs one call of the callable under a deadline.
 *
 * <p>Implementations never propagate exceptions thrown by the callable: they come back as
 * {@link ExecutionOutcome#ERROR}. A {@code null} timeout waits without bound.
 */
public interface TimedExecutor extends AutoCloseable {
    TimedExecution execute(BenchmarkCallable callable, Duration timeout, Instance instance, Map<String, String> args);

    /**
     * Rejects callables or instances this executor cannot run, before any attempt starts.
     */
    default void checkSupported(BenchmarkCallable callable, Instance instance) {
    }

    @Override
    default void close() {
    }
}
