package org.benchlab.model;

/**
 * Raised when parts of a benchmark disagree with each other: mixed instance types,
 * a metric registered twice, an aggregator target that was never scored, or
 * statistics pooled across different metrics.
 */
public final class ConsistencyException extends IllegalArgumentException {
    public ConsistencyException(String message) {
        super(message);
    }
}
