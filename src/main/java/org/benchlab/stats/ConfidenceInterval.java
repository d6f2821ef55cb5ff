package org.benchlab.stats;

/**
 * Closed interval [lower, upper] within [0, 1].
 */
public record ConfidenceInterval(double lower, double upper) {
    public ConfidenceInterval {
        if (lower > upper) {
            throw new IllegalArgumentException("lower must be <= upper");
        }
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }

    public double width() {
        return upper - lower;
    }
}
