package org.benchlab.model;

import java.util.Objects;

/**
 * Stable identity of a serializable type, written to artifacts as
 * {@code class_module} and {@code class_name}.
 */
public record TypeTag(String module, String name) {
    public TypeTag {
        module = requireText(module, "module");
        name = requireText(name, "name");
    }

    public static TypeTag of(String module, String name) {
        return new TypeTag(module, name);
    }

    public String qualified() {
        return module + "/" + name;
    }

    @Override
    public String toString() {
        return qualified();
    }

    private static String requireText(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }
}
