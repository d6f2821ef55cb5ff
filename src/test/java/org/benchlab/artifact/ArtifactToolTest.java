package org.benchlab.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.benchlab.obs.JsonLinesLogger;
import org.benchlab.registry.TypeRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactToolTest {
    @TempDir
    Path tempDir;

    private Path writeReportArtifact() throws Exception {
        ArtifactCodec codec = new ArtifactCodec(TypeRegistry.defaults(), spec -> JsonLinesLogger.noop());
        return codec.writeJson(ArtifactFixtures.evaluatedStage().report(), tempDir.resolve("report.json"));
    }

    @Test
    void summarizesArtifactAndWritesCsv() throws Exception {
        Path artifact = writeReportArtifact();
        Path csv = tempDir.resolve("flat");
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

        int exitCode = ArtifactTool.run(
            new String[] {"--artifact=" + artifact, "--csv=" + csv},
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8)
        );

        String out = outBytes.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode, errBytes.toString(StandardCharsets.UTF_8));
        assertTrue(out.contains("Artifact loaded"));
        assertTrue(out.contains("- stage: BenchmarkReport"));
        assertTrue(out.contains("- name: arith"));
        assertTrue(out.contains("- instances: 2"));
        assertTrue(out.contains("- attempts: success=2 failure=1 timeout=1"));
        assertTrue(out.contains("  - exact_match (boolean)"));
        assertTrue(out.contains("- reports: 2"));
        assertTrue(out.contains("  - accuracy_exact_match outer=0.5000"));
        assertTrue(Files.exists(tempDir.resolve("flat.csv")));
    }

    @Test
    void loadsArtifactAsRequestedStage() throws Exception {
        Path artifact = writeReportArtifact();
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        int exitCode = ArtifactTool.run(
            new String[] {"--artifact=" + artifact, "--stage=exec", "--json"},
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)
        );

        String out = outBytes.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode);
        assertTrue(out.contains("- stage: BenchmarkExec"));
        assertTrue(out.contains("\"class_name\": \"BenchmarkExec\""));
    }

    @Test
    void failsForIncompatibleStage() throws Exception {
        Path artifact = new ArtifactCodec(TypeRegistry.defaults(), spec -> JsonLinesLogger.noop())
            .writeJson(ArtifactFixtures.evaluatedStage(), tempDir.resolve("eval.json"));
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

        int exitCode = ArtifactTool.run(
            new String[] {"--artifact=" + artifact, "--stage=report"},
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8)
        );

        assertEquals(1, exitCode);
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains(
            "artifact tool failed: " + artifact + ": Incompatible Artifact Stage"));
    }

    @Test
    void rejectsMissingOrUnknownArguments() {
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

        assertEquals(2, ArtifactTool.run(new String[0], out, err));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("--artifact=<path> is required"));
        assertEquals(2, ArtifactTool.run(new String[] {"--artifact=x.json", "--stage=final"}, out, err));
        assertEquals(2, ArtifactTool.run(new String[] {"--verbose"}, out, err));
    }

    @Test
    void printsUsageOnHelp() {
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();

        int exitCode = ArtifactTool.run(
            new String[] {"--help"},
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)
        );

        assertEquals(0, exitCode);
        assertTrue(outBytes.toString(StandardCharsets.UTF_8).startsWith("Usage: ArtifactTool"));
    }
}
