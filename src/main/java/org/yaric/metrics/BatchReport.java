package org.yaric.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Results of one run in work item order, with resource high-water marks.
 *
 * @param overallStatus SUCCESS only when every result succeeded, see {@link StatusHelper#determineOverallStatus}
 */
public record BatchReport(Duration totalDuration, List<TaskResult> results, long peakMemoryUsage,
                          int peakActiveTasks, Status overallStatus) {

    public BatchReport {
        results = List.copyOf(results);
    }

    public long succeeded() {
        return results.stream().filter(TaskResult::isSuccess).count();
    }

    public long failed() {
        return results.size() - succeeded();
    }
}
