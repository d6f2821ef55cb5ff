package org.benchlab.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.benchlab.codec.BsonValues;
import org.benchlab.model.ConfigurationException;
import org.benchlab.model.Spec;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.json.JsonParseException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a benchmark {@link Spec} from a JSON or YAML file using the snake_case keys of the
 * artifact {@code spec} block.
 */
public final class BenchmarkConfigLoader {
    private BenchmarkConfigLoader() {}

    public static Spec load(final Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new ConfigurationException("config path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new ConfigurationException("config path must be a file: " + normalized);
        }
        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    public static Spec parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return parseYaml(content);
        }
        return parseJson(content);
    }

    private static Spec parseYaml(final String content) {
        final Object root;
        try {
            root = new Yaml().load(content);
        } catch (final YAMLException e) {
            throw new ConfigurationException("config is not valid YAML: " + e.getMessage());
        }
        if (root == null) {
            throw new ConfigurationException("config is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ConfigurationException("config root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Spec.fromMap(normalized);
    }

    private static Spec parseJson(final String content) {
        final BsonDocument document;
        try {
            document = BsonDocument.parse(content);
        } catch (final JsonParseException | BsonInvalidOperationException e) {
            throw new ConfigurationException("config is not valid JSON: " + e.getMessage());
        }
        return Spec.fromMap(BsonValues.toJavaMap(document));
    }
}
