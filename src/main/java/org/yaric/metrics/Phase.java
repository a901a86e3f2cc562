package org.yaric.metrics;

/**
 * Stage at which a task stopped without producing an output.
 */
public enum Phase {
    ADMISSION,
    CALCULATION,
    PERSISTENCE
}
