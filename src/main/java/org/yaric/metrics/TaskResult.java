package org.yaric.metrics;

import java.time.Duration;

/**
 * Final, immutable record for one work item.
 *
 * @param inputFile       input raster location
 * @param indexName       calculated index
 * @param status          outcome
 * @param failedPhase     where it stopped, null on success
 * @param outputFile      saved location, only set on success
 * @param message         error description, null on success
 * @param estimatedBytes  memory reserved for the item
 * @param calculationTime time spent evaluating the formula
 * @param savingTime      time spent saving or discarding the staged output
 * @param threadName      thread that ran the calculation
 */
public record TaskResult(String inputFile, String indexName, Status status, Phase failedPhase, String outputFile,
                         String message, long estimatedBytes, Duration calculationTime, Duration savingTime,
                         String threadName) {

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
