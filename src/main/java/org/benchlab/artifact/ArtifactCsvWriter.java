package org.benchlab.artifact;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.benchlab.metric.Metric;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.obs.CorrelationContext;
import org.benchlab.state.BenchmarkStage;

/**
 * Flattened one-row-per-instance CSV view of a stage.
 *
 * <p>Columns: {@code id, ground_truth}, then for each attempt i (1-based, up to
 * {@code n_attempts}) {@code attempt_i_response, attempt_i_status, attempt_i_runtime} and one
 * {@code attempt_i_usage_<counter>} column per usage counter seen, then for each metric and attempt
 * {@code attempt_i_<metric>}.
 */
public final class ArtifactCsvWriter {
    private static final CsvMapper MAPPER = new CsvMapper();

    private ArtifactCsvWriter() {
    }

    public static String toCsv(BenchmarkStage stage) {
        Objects.requireNonNull(stage, "stage");
        List<String> columns = columns(stage);
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : columns) {
            schema.addColumn(column);
        }
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = MAPPER.writer(schema.build().withHeader()).writeValues(out)) {
            for (Instance instance : stage.instances()) {
                writer.write(row(stage, instance));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to render CSV", e);
        }
        return out.toString();
    }

    /**
     * Writes the CSV, appending {@code .csv} when the file name has no extension.
     *
     * @return the path written
     */
    public static Path writeCsv(BenchmarkStage stage, Path path) throws IOException {
        Path target = ArtifactPaths.resolveOutput(path, "csv");
        Files.writeString(target, toCsv(stage), StandardCharsets.UTF_8);
        stage.logger().info(
            "csv artifact written",
            CorrelationContext.of(stage.spec().name(), "artifact"),
            Map.of("path", target.toString())
        );
        return target;
    }

    static List<String> columns(BenchmarkStage stage) {
        int attempts = attemptCount(stage);
        Set<String> usageKeys = usageKeys(stage);
        List<String> columns = new ArrayList<>();
        columns.add("id");
        columns.add("ground_truth");
        for (int i = 1; i <= attempts; i++) {
            columns.add(prefix(i) + "response");
            columns.add(prefix(i) + "status");
            columns.add(prefix(i) + "runtime");
            for (String key : usageKeys) {
                columns.add(usageColumn(i, key));
            }
        }
        for (Metric<?> metric : stage.metrics()) {
            for (int i = 1; i <= attempts; i++) {
                columns.add(prefix(i) + metric.name());
            }
        }
        return columns;
    }

    private static Map<String, String> row(BenchmarkStage stage, Instance instance) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", instance.id());
        row.put("ground_truth", text(instance.groundTruth()));
        List<Attempt> attempts = instance.attempts();
        for (int i = 1; i <= attempts.size(); i++) {
            Attempt attempt = attempts.get(i - 1);
            row.put(prefix(i) + "response", attempt.response().orElse(""));
            row.put(prefix(i) + "status", attempt.status().text());
            row.put(prefix(i) + "runtime", attempt.runtime()
                .map(runtime -> String.format(Locale.ROOT, "%.2f", runtime))
                .orElse(""));
            for (Map.Entry<String, Long> usage : attempt.usage().entrySet()) {
                row.put(usageColumn(i, usage.getKey()), String.valueOf(usage.getValue()));
            }
        }
        for (Metric<?> metric : stage.metrics()) {
            List<Object> scores = instance.evaluation(metric.name());
            for (int i = 1; i <= scores.size(); i++) {
                row.put(prefix(i) + metric.name(), text(scores.get(i - 1)));
            }
        }
        return row;
    }

    private static int attemptCount(BenchmarkStage stage) {
        int attempts = stage.spec().nAttempts();
        for (Instance instance : stage.instances()) {
            attempts = Math.max(attempts, instance.attempts().size());
        }
        return attempts;
    }

    private static Set<String> usageKeys(BenchmarkStage stage) {
        Set<String> keys = new LinkedHashSet<>();
        for (Instance instance : stage.instances()) {
            for (Attempt attempt : instance.attempts()) {
                keys.addAll(attempt.usage().keySet());
            }
        }
        return keys;
    }

    private static String prefix(int attempt) {
        return "attempt_" + attempt + "_";
    }

    private static String usageColumn(int attempt, String counter) {
        return prefix(attempt) + "usage_" + counter;
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
