package org.yaric.processing;

import org.yaric.metrics.Status;

import java.time.Duration;

/**
 * What a {@link ComputeTask} hands back to the scheduler.
 *
 * @param status          SUCCESS when the output is staged
 * @param stagingLocation where the output was staged, null if nothing was staged
 * @param message         failure description, null on success
 */
public record ComputeOutcome(Status status, String stagingLocation, String message, Duration calculationTime,
                             String threadName) {

    public static ComputeOutcome success(String stagingLocation, Duration calculationTime) {
        return new ComputeOutcome(Status.SUCCESS, stagingLocation, null, calculationTime, Thread.currentThread().getName());
    }

    public static ComputeOutcome failure(String message, Duration calculationTime) {
        return new ComputeOutcome(Status.FAILURE, null, message, calculationTime, Thread.currentThread().getName());
    }

    public static ComputeOutcome error(String message, Duration calculationTime) {
        return new ComputeOutcome(Status.ERROR, null, message, calculationTime, Thread.currentThread().getName());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
