package org.benchlab.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.benchlab.model.Spec;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StructuredJsonLinesLoggerTest {
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-02-23T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, true);

        CorrelationContext context = CorrelationContext.of("math-qa", "run").forAttempt("q-1", 2);
        logger.info("attempt finished", context, Map.of("status", "success", "runtime", 0.25d));
        logger.warn("both n_instance and instance_ids are set", CorrelationContext.of("math-qa", "select"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);

        BsonDocument first = BsonDocument.parse(lines[0]);
        assertEquals("2026-02-23T10:00:00Z", first.getString("timestamp").getValue());
        assertEquals("INFO", first.getString("level").getValue());
        assertEquals("attempt finished", first.getString("message").getValue());
        assertEquals("math-qa", first.getString("benchmark").getValue());
        assertEquals("run", first.getString("stage").getValue());
        assertEquals("q-1", first.getString("instanceId").getValue());
        assertEquals(2, first.getNumber("attempt").intValue());
        assertEquals("success", first.getString("status").getValue());
        assertEquals(0.25d, first.getNumber("runtime").doubleValue());
        assertEquals(
            List.of("attempt", "benchmark", "instanceId", "level", "message", "runtime", "stage", "status", "timestamp"),
            List.copyOf(first.keySet())
        );

        BsonDocument second = BsonDocument.parse(lines[1]);
        assertEquals("WARN", second.getString("level").getValue());
        assertEquals("select", second.getString("stage").getValue());
        assertFalse(second.containsKey("instanceId"));
        assertFalse(second.containsKey("attempt"));
    }

    @Test
    void dropsEventsBelowMinimumLevel() {
        StringWriter output = new StringWriter();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, true, "WARN");

        CorrelationContext context = CorrelationContext.of("math-qa", "evaluate");
        logger.debug("metric applied", context, Map.of("metric", "exact_match"));
        logger.info("evaluation started", context);
        logger.error("attempt failed", context, Map.of("errorType", "java.lang.ArithmeticException"));

        String[] lines = output.toString().trim().split("\\R");
        assertEquals(1, lines.length);
        assertEquals("ERROR", BsonDocument.parse(lines[0]).getString("level").getValue());
    }

    @Test
    void rejectsWritesAfterClose() {
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(new ByteArrayOutputStream(), FIXED_CLOCK, true);
        logger.close();

        assertThrows(IllegalStateException.class, () -> logger.info("late", CorrelationContext.of("b", "run")));
    }

    @Test
    void specLoggerAppendsToConfiguredFile(@TempDir Path tempDir) throws Exception {
        Path logFile = tempDir.resolve("logs").resolve("run.jsonl");
        Spec spec = Spec.builder("math-qa").logsFilepath(logFile.toString()).build();

        JsonLinesLogger logger = BenchmarkLoggers.forSpec(spec);
        logger.debug("metric applied", CorrelationContext.of("math-qa", "evaluate"), Map.of("metric", "exact_match"));
        logger.close();

        List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"metric\": \"exact_match\"") || lines.get(0).contains("\"metric\":\"exact_match\""));
        assertTrue(BenchmarkLoggers.release(logFile));
    }

    @Test
    void specLoggersShareOneFilePerPath(@TempDir Path tempDir) throws Exception {
        Path logFile = tempDir.resolve("shared.jsonl");
        Spec spec = Spec.builder("math-qa").logsFilepath(logFile.toString()).build();
        int openBefore = BenchmarkLoggers.openFileCount();

        for (int i = 0; i < 50; i++) {
            JsonLinesLogger logger = BenchmarkLoggers.forSpec(spec);
            logger.info("stage loaded", CorrelationContext.of("math-qa", "load"));
            logger.close();
        }
        JsonLinesLogger sameFile = BenchmarkLoggers.forSpec(
            Spec.builder("other").logsFilepath(tempDir.resolve(".").resolve("shared.jsonl").toString()).build()
        );
        sameFile.info("other stage loaded", CorrelationContext.of("other", "load"));

        assertEquals(openBefore + 1, BenchmarkLoggers.openFileCount());
        assertEquals(51, Files.readAllLines(logFile, StandardCharsets.UTF_8).size());

        assertTrue(BenchmarkLoggers.release(logFile));
        assertFalse(BenchmarkLoggers.release(logFile));
        assertEquals(openBefore, BenchmarkLoggers.openFileCount());
        assertThrows(IllegalStateException.class, () -> sameFile.info("late", CorrelationContext.of("other", "load")));
    }

    @Test
    void specWithoutLogFileUsesSharedStandardErrorLogger() {
        Spec spec = Spec.builder("math-qa").build();

        JsonLinesLogger first = BenchmarkLoggers.forSpec(spec);
        first.close();

        assertSame(first, BenchmarkLoggers.forSpec(spec));
    }

    @Test
    void correlationContextRejectsBlankFieldsAndNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of(" ", "run"));
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of("b", "run").forAttempt("q-1", 0));
    }
}
