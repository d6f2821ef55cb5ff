package org.benchlab.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated benchmark configuration errors.
 */
public final class ConfigurationException extends IllegalArgumentException {
    private final List<String> errors;

    public ConfigurationException(final List<String> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public ConfigurationException(final String error) {
        this(List.of(Objects.requireNonNull(error, "error")));
    }

    public List<String> errors() {
        return errors;
    }

    private static String formatMessage(final List<String> errors) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(errors, "errors"));
        if (normalized.isEmpty()) {
            return "invalid benchmark configuration";
        }
        if (normalized.size() == 1) {
            return "invalid benchmark configuration: " + normalized.get(0);
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("invalid benchmark configuration (")
                .append(normalized.size())
                .append(" issue(s))");
        for (final String error : normalized) {
            sb.append('\n').append("- ").append(error);
        }
        return sb.toString();
    }
}
