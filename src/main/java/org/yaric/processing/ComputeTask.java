package org.yaric.processing;

import org.yaric.raster.BandRaster;
import org.yaric.raster.RasterIO;
import org.yaric.raster.expr.EvaluationException;
import org.yaric.raster.expr.RasterEvaluator;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates one work item and stages the output in memory. Never writes the final location.
 * <p>
 * All failures are reported through the returned {@link ComputeOutcome}; {@link #call()} does not throw.
 * Formula errors and I/O errors are failures, anything else is an error. Nothing is retried.
 */
public class ComputeTask implements Callable<ComputeOutcome> {

    private static final Logger LOGGER = Logger.getLogger(ComputeTask.class.getName());

    private final WorkItem item;
    private final RasterIO rasterIO;
    private final RasterEvaluator evaluator;

    private volatile boolean abandoned;
    private Thread runner; // guarded by this

    public ComputeTask(final WorkItem item, final RasterIO rasterIO, final RasterEvaluator evaluator) {
        this.item = item;
        this.rasterIO = rasterIO;
        this.evaluator = evaluator;
    }

    @Override
    public ComputeOutcome call() {
        synchronized (this) {
            runner = Thread.currentThread();
        }
        final Instant start = Instant.now();
        try {
            if (abandoned) {
                return ComputeOutcome.failure("Cancelled before calculation", Duration.ZERO);
            }
            LOGGER.fine(() -> "Starting calculation for index: " + item.indexName() + " (" + item.inputFile() + ")");
            final BandRaster input = rasterIO.read(item.raster());
            final BandRaster output = evaluator.evaluate(item.formula(), item.bandMapping(), input);
            if (abandoned) {
                return ComputeOutcome.failure("Cancelled during calculation", Duration.between(start, Instant.now()));
            }
            rasterIO.write(output, item.stagingLocation());

            final Duration spent = Duration.between(start, Instant.now());
            LOGGER.info(String.format("Successfully calculated index: %s for %s in %.2f seconds",
                    item.indexName(), item.inputFile(), spent.toMillis() / 1000.0));
            return ComputeOutcome.success(item.stagingLocation(), spent);
        } catch (final EvaluationException e) {
            LOGGER.warning("Failed to calculate index: " + item.indexName() + " for " + item.inputFile() + ": " + e.getMessage());
            return ComputeOutcome.failure(e.getMessage(), Duration.between(start, Instant.now()));
        } catch (final InterruptedIOException e) {
            return ComputeOutcome.failure("Cancelled during calculation", Duration.between(start, Instant.now()));
        } catch (final IOException e) {
            LOGGER.warning("I/O error calculating index " + item.indexName() + " for " + item.inputFile() + ": " + e.getMessage());
            return ComputeOutcome.failure(e.getMessage(), Duration.between(start, Instant.now()));
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Error calculating index " + item.indexName() + " for " + item.inputFile(), e);
            return ComputeOutcome.error(e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.between(start, Instant.now()));
        } finally {
            synchronized (this) {
                runner = null;
            }
            Thread.interrupted(); // an abandon() interrupt must not leak into the pool thread's next task
        }
    }

    /**
     * Asks the task to stop. A task that has not started returns a failure immediately; a running one is
     * interrupted and its output is not staged.
     */
    public void abandon() {
        abandoned = true;
        synchronized (this) {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    public boolean isAbandoned() {
        return abandoned;
    }
}
