package org.yaric.processing;

import org.yaric.metrics.TaskResult;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Logger;

import static org.yaric.util.Utils.escapeCsvField;

/**
 * Appends task results to a CSV status table. The header is written only when the file is new.
 */
public class StatusWriter implements Closeable {

    static final String HEADER = "run_ts, input_file, index_name, status, phase, output_file, estimated_bytes, calc_ms, save_ms, thread, message\n";

    private static final Logger LOGGER = Logger.getLogger(StatusWriter.class.getName());
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final BufferedWriter statusWriter;

    public StatusWriter(final Path statusFile) throws IOException {
        final Path parent = statusFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final boolean fresh = !Files.exists(statusFile) || Files.size(statusFile) == 0;
        this.statusWriter = Files.newBufferedWriter(statusFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        if (fresh) {
            this.statusWriter.write(HEADER);
            this.statusWriter.flush();
        }
    }

    /**
     * @return number of lines written
     */
    public synchronized int insertTaskStatus(final List<TaskResult> results) throws IOException {
        final String runTs = LocalDateTime.now().format(FORMATTER);
        for (TaskResult r : results) {
            String csv = runTs + "," + escapeCsvField(r.inputFile()) + "," + escapeCsvField(r.indexName()) + ","
                         + r.status() + "," + (r.failedPhase() == null ? "" : r.failedPhase()) + ","
                         + escapeCsvField(r.outputFile()) + "," + r.estimatedBytes() + "," + millis(r.calculationTime())
                         + "," + millis(r.savingTime()) + "," + escapeCsvField(r.threadName()) + ","
                         + escapeCsvField(r.message()) + "\n";
            this.statusWriter.write(csv);
        }
        this.statusWriter.flush();
        LOGGER.fine(() -> "Wrote " + results.size() + " status line(s)");
        return results.size();
    }

    private static long millis(final Duration duration) {
        return duration == null ? 0 : duration.toMillis();
    }

    @Override
    public synchronized void close() throws IOException {
        statusWriter.close();
    }
}
