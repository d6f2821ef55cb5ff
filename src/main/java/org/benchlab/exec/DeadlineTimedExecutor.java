package org.benchlab.exec;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.benchlab.model.Instance;

/**
 * Runs each call on a daemon worker thread bounded by {@link Future#get(long, TimeUnit)}.
 *
 * <p>For trusted or cooperative callables. On deadline the task is interrupted and the worker
 * thread is abandoned and replaced, so a task that ignores interruption cannot block later calls.
 */
public final class DeadlineTimedExecutor implements TimedExecutor {
    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private ExecutorService worker;

    public DeadlineTimedExecutor() {
        this.worker = newWorker();
    }

    @Override
    public synchronized TimedExecution execute(
        BenchmarkCallable callable,
        Duration timeout,
        Instance instance,
        Map<String, String> args
    ) {
        Objects.requireNonNull(callable, "callable");
        Objects.requireNonNull(instance, "instance");
        Map<String, String> callArgs = args == null ? Map.of() : Map.copyOf(args);

        long startedAt = System.nanoTime();
        Future<BenchmarkOutput> future = worker.submit(() -> callable.call(instance, callArgs));
        try {
            BenchmarkOutput output = timeout == null
                ? future.get()
                : future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            double runtime = secondsSince(startedAt);
            if (output == null) {
                return TimedExecution.error(runtime, "IllegalStateException", "callable returned no output");
            }
            return TimedExecution.success(runtime, output);
        } catch (TimeoutException e) {
            double runtime = secondsSince(startedAt);
            future.cancel(true);
            worker.shutdownNow();
            worker = newWorker();
            return TimedExecution.timeout(runtime);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return TimedExecution.error(secondsSince(startedAt), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TimedExecution.error(secondsSince(startedAt), e);
        }
    }

    @Override
    public synchronized void close() {
        worker.shutdownNow();
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "benchlab-deadline-worker-" + WORKER_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static double secondsSince(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000_000.0d;
    }
}
