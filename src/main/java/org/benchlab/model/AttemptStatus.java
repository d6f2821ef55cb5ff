package org.benchlab.model;

import java.util.Locale;

/**
 * Terminal status of one attempt.
 */
public enum AttemptStatus {
    SUCCESS("success"),
    FAILURE("failure"),
    TIMEOUT("timeout");

    private final String text;

    AttemptStatus(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static AttemptStatus fromText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("attempt status must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AttemptStatus status : values()) {
            if (status.text.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unsupported attempt status: " + value);
    }

    @Override
    public String toString() {
        return text;
    }
}
