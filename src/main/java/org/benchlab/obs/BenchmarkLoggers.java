package org.benchlab.obs;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.benchlab.model.Spec;

/**
 * Factory for the loggers attached to benchmark stages.
 *
 * <p>Loggers handed out by {@link #forSpec(Spec)} are shared: one per log file, plus one for
 * standard error. This class owns them. Their {@code close()} does nothing; the file handles are
 * released by {@link #release(Path)}, {@link #closeAll()} or at JVM shutdown.
 */
public final class BenchmarkLoggers {
    private static final Map<Path, StructuredJsonLinesLogger> FILE_LOGGERS = new ConcurrentHashMap<>();
    private static final JsonLinesLogger STANDARD_ERROR = new SharedLogger(new StructuredJsonLinesLogger(
        new OutputStreamWriter(System.err, StandardCharsets.UTF_8),
        Clock.systemUTC(),
        true,
        "INFO"
    ));

    static {
        Runtime.getRuntime().addShutdownHook(new Thread(BenchmarkLoggers::closeAll, "benchlab-logger-shutdown"));
    }

    private BenchmarkLoggers() {
    }

    /**
     * Shared logger appending to {@code spec.logsFilepath()} when set, otherwise writing to
     * standard error.
     */
    public static JsonLinesLogger forSpec(Spec spec) {
        Objects.requireNonNull(spec, "spec");
        return spec.logsFilepath()
            .map(path -> shared(Path.of(path)))
            .orElse(STANDARD_ERROR);
    }

    /**
     * Shared logger for {@code path}. Repeated calls with the same normalized path return loggers
     * backed by one open file.
     */
    public static JsonLinesLogger shared(Path path) {
        Path normalized = normalize(path);
        return new SharedLogger(FILE_LOGGERS.computeIfAbsent(normalized, BenchmarkLoggers::toFile));
    }

    /**
     * Closes the shared logger of {@code path}, if one is open. Stages still holding it fail on
     * their next write.
     *
     * @return whether a logger was closed
     */
    public static boolean release(Path path) {
        StructuredJsonLinesLogger logger = FILE_LOGGERS.remove(normalize(path));
        if (logger == null) {
            return false;
        }
        logger.close();
        return true;
    }

    public static void closeAll() {
        List<Path> paths = new ArrayList<>(FILE_LOGGERS.keySet());
        for (Path path : paths) {
            release(path);
        }
    }

    static int openFileCount() {
        return FILE_LOGGERS.size();
    }

    /**
     * Opens an unshared logger on {@code path}; the caller owns it and must close it.
     */
    public static StructuredJsonLinesLogger toFile(Path path) {
        Path normalized = normalize(path);
        try {
            Path parent = normalized.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OutputStream output = new FileOutputStream(normalized.toFile(), true);
            return new StructuredJsonLinesLogger(
                new OutputStreamWriter(output, StandardCharsets.UTF_8),
                Clock.systemUTC(),
                true,
                "DEBUG"
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open log file " + normalized, e);
        }
    }

    private static Path normalize(Path path) {
        return Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
    }

    private static final class SharedLogger implements JsonLinesLogger {
        private final JsonLinesLogger delegate;

        private SharedLogger(JsonLinesLogger delegate) {
            this.delegate = delegate;
        }

        @Override
        public void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields) {
            delegate.log(level, message, correlationContext, fields);
        }

        @Override
        public void close() {
        }
    }
}
