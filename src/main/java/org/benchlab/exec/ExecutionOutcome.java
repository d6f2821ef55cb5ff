package org.benchlab.exec;

/**
 * How one timed call ended.
 */
public enum ExecutionOutcome {
    SUCCESS,
    TIMEOUT,
    ERROR
}
