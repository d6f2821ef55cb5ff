package org.benchlab.exec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.benchlab.model.ConfigurationException;
import org.benchlab.model.Instance;
import org.benchlab.registry.InstanceRecord;
import org.benchlab.registry.TypeRegistry;

/**
 * Runs each call in a fresh child JVM that is forcibly destroyed at the deadline.
 *
 * <p>The deadline starts when the worker reports that the instance and callable are ready, so
 * JVM start-up and class loading do not count against it. Start-up has its own limit
 * ({@code startupTimeout}, one minute by default) and exceeding it is an error, not a timeout.
 * Runtimes of completed calls are measured inside the worker around the callable itself.
 */
public final class ProcessTimedExecutor implements TimedExecutor {
    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofMinutes(1);
    private static final Duration REAP_TIMEOUT = Duration.ofSeconds(5);

    private final List<String> command;
    private final TypeRegistry registry;
    private final Duration startupTimeout;
    private final ExecutorService readers;

    public ProcessTimedExecutor() {
        this(List.of());
    }

    public ProcessTimedExecutor(List<String> jvmOptions) {
        this(jvmOptions, TypeRegistry.loadDefault());
    }

    public ProcessTimedExecutor(List<String> jvmOptions, TypeRegistry registry) {
        this(jvmOptions, registry, DEFAULT_STARTUP_TIMEOUT);
    }

    public ProcessTimedExecutor(List<String> jvmOptions, TypeRegistry registry, Duration startupTimeout) {
        Objects.requireNonNull(jvmOptions, "jvmOptions");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout");
        if (startupTimeout.isNegative() || startupTimeout.isZero()) {
            throw new IllegalArgumentException("startupTimeout must be positive");
        }
        List<String> workerCommand = new ArrayList<>();
        workerCommand.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        workerCommand.addAll(jvmOptions);
        workerCommand.add("-cp");
        workerCommand.add(System.getProperty("java.class.path"));
        workerCommand.add(IsolatedWorker.class.getName());
        this.command = List.copyOf(workerCommand);
        this.readers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "benchlab-worker-reader");
            thread.setDaemon(true);
            return thread;
        });
    }

    List<String> command() {
        return command;
    }

    @Override
    public void checkSupported(BenchmarkCallable callable, Instance instance) {
        Objects.requireNonNull(callable, "callable");
        Objects.requireNonNull(instance, "instance");
        List<String> errors = new ArrayList<>();
        Class<?> type = callable.getClass();
        if (type.isHidden() || type.isAnonymousClass() || type.isLocalClass()) {
            errors.add("callable " + type.getName() + " must be a named class to run in a worker process");
        } else {
            if (!Modifier.isPublic(type.getModifiers())) {
                errors.add("callable " + type.getName() + " must be public");
            }
            if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
                errors.add("callable " + type.getName() + " must be a static nested class");
            }
            if (!hasPublicNoArgConstructor(type)) {
                errors.add("callable " + type.getName() + " needs a public no-arg constructor");
            }
        }
        if (!registry.hasInstance(instance.typeTag())) {
            errors.add("instance type " + instance.typeTag() + " is not registered for worker processes");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    @Override
    public TimedExecution execute(
        BenchmarkCallable callable,
        Duration timeout,
        Instance instance,
        Map<String, String> args
    ) {
        checkSupported(callable, instance);
        String request = WorkerMessages.encodeRequest(new WorkerMessages.Request(
            callable.getClass().getName(),
            InstanceRecord.of(instance),
            args == null ? Map.of() : args
        ));

        long launchedAt = System.nanoTime();
        Process started;
        try {
            started = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            return TimedExecution.error(secondsSince(launchedAt), e);
        }
        Process process = started;
        BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
        Future<?> pump = readers.submit(() -> {
            pumpLines(process.getInputStream(), lines);
            return null;
        });

        String writeFailure = null;
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(request.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            writeFailure = e.getMessage();
        }

        try {
            Optional<String> first = lines.poll(startupTimeout.toNanos(), TimeUnit.NANOSECONDS);
            if (first == null) {
                terminate(process, pump);
                return TimedExecution.error(
                    secondsSince(launchedAt),
                    "WorkerStartupException",
                    "worker was not ready within " + startupTimeout
                );
            }
            if (first.isEmpty()) {
                return exitedWithoutResult(process, secondsSince(launchedAt), writeFailure);
            }
            if (!WorkerMessages.isReady(first.get())) {
                reap(process, pump);
                return WorkerMessages.decodeResult(first.get(), 0.0d);
            }

            long startedAt = System.nanoTime();
            Optional<String> result = timeout == null
                ? lines.take()
                : lines.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            double runtime = secondsSince(startedAt);
            if (result == null) {
                terminate(process, pump);
                return TimedExecution.timeout(runtime);
            }
            if (result.isEmpty()) {
                return exitedWithoutResult(process, runtime, writeFailure);
            }
            reap(process, pump);
            return WorkerMessages.decodeResult(result.get(), runtime);
        } catch (InterruptedException e) {
            terminate(process, pump);
            Thread.currentThread().interrupt();
            return TimedExecution.error(secondsSince(launchedAt), e);
        }
    }

    @Override
    public void close() {
        readers.shutdownNow();
    }

    /**
     * Queues each non-blank stdout line, then an empty marker once the stream ends.
     */
    private static void pumpLines(InputStream stdout, BlockingQueue<Optional<String>> lines) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    lines.add(Optional.of(line));
                }
            }
        } finally {
            lines.add(Optional.empty());
        }
    }

    private static TimedExecution exitedWithoutResult(Process process, double runtime, String writeFailure) {
        String detail = "worker exited without a result";
        try {
            if (process.waitFor(REAP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                detail = "worker exited with code " + process.exitValue() + " without a result";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (writeFailure != null) {
            detail += " (request not delivered: " + writeFailure + ")";
        }
        return TimedExecution.error(runtime, "WorkerExitException", detail);
    }

    /**
     * Waits for a worker that already replied to exit on its own, killing it otherwise.
     */
    private static void reap(Process process, Future<?> pump) {
        try {
            if (process.waitFor(REAP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        terminate(process, pump);
    }

    private static void terminate(Process process, Future<?> pump) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        pump.cancel(true);
        try {
            process.waitFor(REAP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean hasPublicNoArgConstructor(Class<?> type) {
        try {
            return Modifier.isPublic(type.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static double secondsSince(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000_000.0d;
    }
}
