package org.benchlab.artifact;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.benchlab.aggregate.Report;
import org.benchlab.metric.Metric;
import org.benchlab.model.AttemptStatus;
import org.benchlab.model.Instance;
import org.benchlab.obs.JsonLinesLogger;
import org.benchlab.registry.TypeRegistry;
import org.benchlab.state.BenchmarkReport;
import org.benchlab.state.BenchmarkStage;
import org.benchlab.state.StageType;

/**
 * CLI utility that loads an artifact, summarizes it and optionally re-exports it.
 */
public final class ArtifactTool {
    private ArtifactTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        try {
            final ArtifactCodec codec = new ArtifactCodec(TypeRegistry.loadDefault(), spec -> JsonLinesLogger.noop());
            final BenchmarkStage stage = config.stage() == null
                    ? codec.readJson(config.artifactPath())
                    : codec.readJson(config.artifactPath(), config.stage());
            renderSummary(config.artifactPath(), stage, out);
            if (config.csvPath() != null) {
                final Path written = ArtifactCsvWriter.writeCsv(stage, config.csvPath());
                out.println("- csv: " + written.toAbsolutePath().normalize());
            }
            if (config.jsonOutput()) {
                out.println();
                out.println(codec.toJson(stage));
            }
            return 0;
        } catch (final IOException | RuntimeException e) {
            err.println("artifact tool failed: " + e.getMessage());
            return 1;
        }
    }

    private static Config parseArgs(final String[] args) {
        Path artifactPath = null;
        StageType stage = null;
        Path csvPath = null;
        boolean jsonOutput = false;
        boolean help = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if ("--json".equals(arg)) {
                jsonOutput = true;
                continue;
            }
            if (arg.startsWith("--artifact=")) {
                artifactPath = Path.of(valueAfterPrefix(arg, "--artifact="));
                continue;
            }
            if (arg.startsWith("--stage=")) {
                stage = parseStage(valueAfterPrefix(arg, "--stage="));
                continue;
            }
            if (arg.startsWith("--csv=")) {
                csvPath = Path.of(valueAfterPrefix(arg, "--csv="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && artifactPath == null) {
            throw new IllegalArgumentException("--artifact=<path> is required");
        }
        return new Config(artifactPath, stage, csvPath, jsonOutput, help);
    }

    private static StageType parseStage(final String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "benchmark" -> StageType.BENCHMARK;
            case "exec" -> StageType.EXEC;
            case "eval" -> StageType.EVAL;
            case "report" -> StageType.REPORT;
            default -> throw new IllegalArgumentException("unsupported stage: " + value);
        };
    }

    private static void renderSummary(final Path artifactPath, final BenchmarkStage stage, final PrintStream out) {
        final Map<AttemptStatus, Integer> statusCounts = new EnumMap<>(AttemptStatus.class);
        for (final AttemptStatus status : AttemptStatus.values()) {
            statusCounts.put(status, 0);
        }
        for (final Instance instance : stage.instances()) {
            for (final AttemptStatus status : instance.statuses()) {
                statusCounts.merge(status, 1, Integer::sum);
            }
        }

        out.println("Artifact loaded");
        out.println("- artifact: " + artifactPath.toAbsolutePath().normalize());
        out.println("- stage: " + stage.stageType().label());
        out.println("- name: " + stage.spec().name());
        out.println("- instances: " + stage.instances().size());
        out.println("- attempts: success=" + statusCounts.get(AttemptStatus.SUCCESS)
                + " failure=" + statusCounts.get(AttemptStatus.FAILURE)
                + " timeout=" + statusCounts.get(AttemptStatus.TIMEOUT));
        out.println("- metrics: " + stage.metrics().size());
        for (final Metric<?> metric : stage.metrics()) {
            out.println("  - " + metric.name() + " (" + metric.type().text() + ")");
        }
        if (stage instanceof BenchmarkReport report) {
            out.println("- reports: " + report.reports().size());
            for (final Report item : report.reports()) {
                out.println("  - " + item.aggregatorName() + " outer="
                        + String.format(Locale.ROOT, "%.4f", item.outer()));
            }
        }
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ArtifactTool --artifact=<path> [--stage=benchmark|exec|eval|report] [--csv=<path>] [--json]");
        stream.println("  --artifact=<path>     Artifact JSON path (required)");
        stream.println("  --stage=<name>        Stage to load as (default: recorded stage)");
        stream.println("  --csv=<path>          Also write the flattened CSV view");
        stream.println("  --json                Print the re-encoded artifact JSON");
        stream.println("  --help                Show usage");
    }

    private record Config(
            Path artifactPath,
            StageType stage,
            Path csvPath,
            boolean jsonOutput,
            boolean help) {}
}
