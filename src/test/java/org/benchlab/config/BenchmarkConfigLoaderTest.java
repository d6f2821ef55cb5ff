package org.benchlab.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.benchlab.model.ConfigurationException;
import org.benchlab.model.Spec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BenchmarkConfigLoaderTest {
    @Test
    void loadsYamlConfig(@TempDir Path tempDir) throws Exception {
        Path config = tempDir.resolve("bench.yaml");
        Files.writeString(
            config,
            """
            name: math-qa
            n_attempts: 3
            timeout: 2.5
            instance_ids:
              - q-2
              - q-7
            logs_filepath: logs/run.jsonl
            """,
            StandardCharsets.UTF_8
        );

        Spec spec = BenchmarkConfigLoader.load(config);

        assertEquals("math-qa", spec.name());
        assertEquals(3, spec.nAttempts());
        assertEquals(Optional.of(2.5d), spec.timeout());
        assertEquals(List.of("q-2", "q-7"), spec.instanceIds());
        assertEquals(Optional.of("logs/run.jsonl"), spec.logsFilepath());
    }

    @Test
    void loadsJsonConfig() {
        Spec spec = BenchmarkConfigLoader.parse(
            "{\"name\": \"math-qa\", \"n_instance\": 5, \"timeout\": 10}",
            "bench.json"
        );

        assertEquals(Optional.of(5), spec.nInstance());
        assertEquals(Optional.of(10.0d), spec.timeout());
        assertEquals(1, spec.nAttempts());
    }

    @Test
    void reportsEveryInvalidField() {
        ConfigurationException error = assertThrows(
            ConfigurationException.class,
            () -> BenchmarkConfigLoader.parse("name: math-qa\nn_attempts: 0\nn_instance: 0\n", "bench.yml")
        );

        assertEquals(2, error.errors().size());
    }

    @Test
    void rejectsUnknownKeysAndBadSyntax() {
        ConfigurationException unknown = assertThrows(
            ConfigurationException.class,
            () -> BenchmarkConfigLoader.parse("name: math-qa\nattempts: 3\n", "bench.yaml")
        );
        assertEquals(List.of("unknown spec field: attempts"), unknown.errors());

        assertThrows(ConfigurationException.class, () -> BenchmarkConfigLoader.parse("{\"name\": ", "bench.json"));
        assertThrows(ConfigurationException.class, () -> BenchmarkConfigLoader.parse("- a\n- b\n", "bench.yaml"));
        assertThrows(ConfigurationException.class, () -> BenchmarkConfigLoader.parse("", "bench.yaml"));
    }

    @Test
    void rejectsMissingFile(@TempDir Path tempDir) {
        ConfigurationException error = assertThrows(
            ConfigurationException.class,
            () -> BenchmarkConfigLoader.load(tempDir.resolve("missing.yaml"))
        );
        assertTrue(error.getMessage().contains("does not exist"));
    }
}
