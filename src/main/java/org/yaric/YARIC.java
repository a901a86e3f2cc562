package org.yaric;

import org.yaric.config.AppConfig;
import org.yaric.config.BatchRequest;
import org.yaric.config.ConfigManager;
import org.yaric.metrics.BatchReport;
import org.yaric.metrics.TaskResult;
import org.yaric.processing.IndexCalculator;
import org.yaric.processing.StatusWriter;
import org.yaric.raster.MemoryRasterStore;
import org.yaric.util.Utils;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * Command line entry point: calculates raster indices for the inputs named in a YAML configuration.
 * <p>
 * Usage: {@code java -jar yaric.jar [config.yaml]}; the configuration defaults to {@code conf/config.yaml}.
 * Only one instance runs per working directory.
 */
public class YARIC {

    private static final Logger LOGGER = Logger.getLogger(YARIC.class.getName());
    static final String LOCK_FILE = ".yaric.lock";

    private final AppConfig appConfig;

    /**
     * @param appConfig loaded configuration, typically from {@link ConfigManager#getConfig(Path)}
     */
    public YARIC(final AppConfig appConfig) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
    }

    // --- Main Method ---
    public static void main(final String[] args) throws IOException {
        final Path configPath = args.length > 0 ? Path.of(args[0]) : ConfigManager.DEFAULT_CONFIG_PATH;

        Path lockFilePath = Path.of(".").resolve(LOCK_FILE);
        try (RandomAccessFile raf = new RandomAccessFile(lockFilePath.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = channel.tryLock()) {
            if (lock == null) {
                System.err.printf("!!!! WARN: Could not acquire lock (%s), another instance already running ??? %n", lockFilePath);
                throw new IllegalStateException("Skipped due to existing lock file: " + lockFilePath);
            }

            final YARIC calculator = new YARIC(ConfigManager.getConfig(configPath));
            try {
                System.out.println("========================================================");
                System.out.println(" Starting Raster Index Calculation ");
                System.out.println("========================================================");

                final BatchReport report = calculator.execute();

                System.out.println("\n\n========================================================");
                System.out.println(" Calculation Finished ");
                System.out.println("========================================================");

                printSummary(report);
                calculator.writeStatus(report);
            } catch (final InterruptedException e) {
                System.err.println("\n>>> Main execution thread interrupted.");
                Thread.currentThread().interrupt();
            }
        }
    }

    public BatchReport execute() throws InterruptedException {
        final BatchRequest request = ConfigManager.toBatchRequest(appConfig);
        if (MemoryRasterStore.isMemoryLocation(request.outputDir())) {
            LOGGER.warning("Output directory " + request.outputDir() + " is in memory, outputs are discarded on exit");
        }
        return IndexCalculator.create(request, ConfigManager.toIndexCatalog(appConfig)).execute();
    }

    /**
     * Appends the results to the configured status file, if any.
     */
    void writeStatus(final BatchReport report) {
        if (appConfig.statusFile() == null) {
            return;
        }
        try (StatusWriter writer = new StatusWriter(appConfig.statusFile())) {
            writer.insertTaskStatus(report.results());
        } catch (final IOException e) {
            LOGGER.log(Level.WARNING, "Could not write status file " + appConfig.statusFile(), e);
        }
    }

    // --- Summary Printing ---
    static void printSummary(final BatchReport report) {
        System.out.println("Total Execution Time: " + report.totalDuration().toMillis() + " ms");
        System.out.println("Overall Status: " + report.overallStatus());
        System.out.printf("Peak memory: %s | Peak active tasks: %d | Succeeded: %d | Failed: %d%n",
                Utils.formatBytes(report.peakMemoryUsage()), report.peakActiveTasks(), report.succeeded(), report.failed());
        System.out.println("---------------------- RESULTS SUMMARY ----------------------");
        for (final TaskResult r : report.results()) {
            final String detail = r.isSuccess() ? r.outputFile() : "[" + r.failedPhase() + ": " + r.message() + "]";
            System.out.printf("%-30s | %-16s | Status: %-7s | Calc: %5dms | Save: %5dms | Thread: %-12s | %s%n",
                    r.inputFile(), r.indexName(), r.status(), r.calculationTime().toMillis(),
                    r.savingTime().toMillis(), r.threadName(), detail);
        }
        System.out.println("----------------------------------------------------------");
    }
}
