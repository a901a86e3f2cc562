package org.yaric.metrics;

import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Helper methods for creating task results, especially for failure cases,
 * and determining overall status.
 */
public final class StatusHelper {

    private static final Logger LOGGER = Logger.getLogger(StatusHelper.class.getName());

    private StatusHelper() {
    } // Prevent instantiation

    public static TaskResult createSavedResult(String inputFile, String indexName, String outputFile, long estimatedBytes,
                                               Duration calculationTime, Duration savingTime, String threadName) {
        return new TaskResult(inputFile, indexName, Status.SUCCESS, null, outputFile, null, estimatedBytes,
                calculationTime, savingTime, threadName);
    }

    public static TaskResult createFailedResult(String inputFile, String indexName, Status status, Phase phase,
                                                String message, long estimatedBytes, Duration calculationTime,
                                                Duration savingTime, String threadName) {
        if (status == Status.SUCCESS) {
            throw new IllegalArgumentException("Failed result cannot have status SUCCESS");
        }
        return new TaskResult(inputFile, indexName, status, phase, null, message, estimatedBytes,
                calculationTime, savingTime, threadName);
    }

    /**
     * Result for an item that never ran: rejected for capacity, unreadable input, or cancelled.
     */
    public static TaskResult createRejectedResult(String inputFile, String indexName, Phase phase, String message,
                                                  long estimatedBytes) {
        return createFailedResult(inputFile, indexName, Status.FAILURE, phase, message, estimatedBytes,
                Duration.ZERO, Duration.ZERO, Thread.currentThread().getName());
    }

    // --- Status Determination ---

    /**
     * Determines the overall status of a run: SUCCESS only if every expected result is present and succeeded.
     */
    public static Status determineOverallStatus(final List<TaskResult> results, final int expectedTaskCount) {
        final long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed > 0) {
            LOGGER.warning(String.format("Run marked as FAILURE: %d/%d task(s) did not succeed.", failed, expectedTaskCount));
            return Status.FAILURE;
        }
        if (results.size() < expectedTaskCount) {
            LOGGER.warning(String.format("Run marked as FAILURE: only %d/%d task(s) reported a result.",
                    results.size(), expectedTaskCount));
            return Status.FAILURE;
        }
        LOGGER.info(String.format("Run marked as SUCCESS (%d/%d tasks succeeded).", results.size(), expectedTaskCount));
        return Status.SUCCESS;
    }
}
