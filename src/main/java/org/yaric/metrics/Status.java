package org.yaric.metrics;

/**
 * Outcome of one (input file, index) calculation.
 */
public enum Status {
    SUCCESS, // Calculated and saved
    FAILURE, // Rejected, failed to evaluate, or failed to save
    ERROR    // Unexpected exception inside the task
}
