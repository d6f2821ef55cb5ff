package org.benchlab.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.benchlab.codec.BsonValues;
import org.bson.BsonDocument;

/**
 * JSON-lines logger with sorted keys, deterministic under a fixed clock.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final Set<String> LEVELS = Set.of("DEBUG", "INFO", "WARN", "ERROR");

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final String minimumLevel;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, "INFO");
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush, "DEBUG");
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, String minimumLevel) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.minimumLevel = normalizeLevel(minimumLevel);
        this.closed = false;
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        String safeLevel = normalizeLevel(level);
        if (severity(safeLevel) < severity(minimumLevel)) {
            return;
        }
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Map<String, Object> event = new TreeMap<>();
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                continue;
            }
            event.put(key, entry.getValue());
        }
        event.putAll(safeCorrelation.asFields());
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel);
        event.put("message", message == null ? "" : message);

        BsonDocument document = BsonValues.toBsonDocument(event);
        writeLine(document.toJson(BsonValues.COMPACT_JSON));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static int severity(String level) {
        switch (level) {
            case "DEBUG":
                return 0;
            case "WARN":
                return 2;
            case "ERROR":
                return 3;
            default:
                return 1;
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        String normalized = level.trim().toUpperCase(Locale.ROOT);
        return LEVELS.contains(normalized) ? normalized : "INFO";
    }
}
