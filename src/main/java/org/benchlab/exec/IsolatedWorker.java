package org.benchlab.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.benchlab.model.Instance;
import org.benchlab.registry.TypeRegistry;

/**
 * Child-JVM entry point used by {@link ProcessTimedExecutor}.
 *
 * <p>Reads one request from stdin, builds the instance and callable, writes a ready line, runs
 * the callable once and writes a single result line to the original stdout. Anything the
 * callable prints goes to stderr.
 */
public final class IsolatedWorker {
    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILED = 2;

    private IsolatedWorker() {
    }

    public static void main(String[] args) {
        PrintStream channel = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setOut(System.err);
        int exitCode = run(System.in, channel, TypeRegistry.loadDefault());
        channel.flush();
        System.exit(exitCode);
    }

    static int run(InputStream input, PrintStream channel, TypeRegistry registry) {
        WorkerMessages.Request request;
        Instance instance;
        BenchmarkCallable callable;
        try {
            request = WorkerMessages.decodeRequest(new String(input.readAllBytes(), StandardCharsets.UTF_8));
            instance = registry.createInstance(request.instance());
            callable = instantiate(request.callableClass());
        } catch (IOException | ReflectiveOperationException | RuntimeException e) {
            channel.println(WorkerMessages.encodeError(0.0d, e));
            return EXIT_SETUP_FAILED;
        }

        channel.println(WorkerMessages.encodeReady());
        long startedAt = System.nanoTime();
        try {
            BenchmarkOutput output = callable.call(instance, request.args());
            if (output == null) {
                throw new IllegalStateException(request.callableClass() + " returned no output");
            }
            channel.println(WorkerMessages.encodeSuccess(secondsSince(startedAt), output));
        } catch (Throwable t) {
            channel.println(WorkerMessages.encodeError(secondsSince(startedAt), t));
        }
        return EXIT_OK;
    }

    private static BenchmarkCallable instantiate(String className) throws ReflectiveOperationException {
        Class<?> type = Class.forName(className, true, IsolatedWorker.class.getClassLoader());
        if (!BenchmarkCallable.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(className + " does not implement " + BenchmarkCallable.class.getName());
        }
        return type.asSubclass(BenchmarkCallable.class).getConstructor().newInstance();
    }

    private static double secondsSince(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000_000.0d;
    }
}
