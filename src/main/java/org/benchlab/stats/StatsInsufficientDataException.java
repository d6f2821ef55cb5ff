package org.benchlab.stats;

/**
 * No valid (non-null) value to summarize.
 */
public final class StatsInsufficientDataException extends IllegalArgumentException {
    public StatsInsufficientDataException(String metricName, int nAttempts) {
        super("metric '" + metricName + "' has no valid value among " + nAttempts + " attempt(s)");
    }
}
