package org.yaric.processing;

import org.yaric.raster.BandRaster;
import org.yaric.raster.MemoryRasterStore;
import org.yaric.raster.RasterIO;
import org.yaric.util.ConcurrencyUtils;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves staged rasters to their final locations on a single thread, so two saves never interleave.
 * <p>
 * A staged raster is released only after its final copy has been written. Whatever happens, the staging
 * location is empty once the item's {@link CompletionEvent.PersistenceCompleted} is posted.
 */
public class PersistenceWorker implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(PersistenceWorker.class.getName());

    private final RasterIO rasterIO;
    private final MemoryRasterStore stagingStore;
    private final Consumer<CompletionEvent> completions;
    private final ExecutorService executor;

    public PersistenceWorker(final RasterIO rasterIO, final MemoryRasterStore stagingStore,
                             final Consumer<CompletionEvent> completions) {
        this.rasterIO = rasterIO;
        this.stagingStore = stagingStore;
        this.completions = completions;
        this.executor = Executors.newSingleThreadExecutor(ConcurrencyUtils.createPlatformThreadFactory("Persistence-"));
    }

    /**
     * Queues the item: a successful calculation is persisted, a failed one only has its staging discarded.
     */
    public void submit(final WorkItem item, final ComputeOutcome outcome) {
        executor.execute(() -> {
            PersistenceOutcome persisted;
            try {
                persisted = outcome.isSuccess()
                        ? persist(outcome.stagingLocation(), item.outputLocation())
                        : discard(item.stagingLocation());
            } catch (final RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Unexpected error saving " + item.outputLocation(), e);
                discard(item.stagingLocation());
                persisted = PersistenceOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), Duration.ZERO);
            }
            completions.accept(new CompletionEvent.PersistenceCompleted(item, outcome, persisted));
        });
    }

    /**
     * Reads the staged raster, writes it to {@code finalLocation}, then releases the staging artifact.
     * On failure the staging artifact is discarded and the failure is reported, not thrown.
     */
    public PersistenceOutcome persist(final String stagingLocation, final String finalLocation) {
        final Instant start = Instant.now();
        try {
            final BandRaster staged = rasterIO.read(rasterIO.open(stagingLocation));
            rasterIO.write(staged, finalLocation);
            stagingStore.unlink(stagingLocation);
            final Duration spent = Duration.between(start, Instant.now());
            LOGGER.fine(() -> "Saved " + stagingLocation + " to " + finalLocation + " in " + spent.toMillis() + "ms");
            return PersistenceOutcome.saved(finalLocation, spent);
        } catch (final IOException e) {
            LOGGER.warning("Failed to save " + finalLocation + ": " + e.getMessage());
            stagingStore.unlink(stagingLocation);
            return PersistenceOutcome.failed("Failed to save " + finalLocation + ": " + e.getMessage(),
                    Duration.between(start, Instant.now()));
        }
    }

    public PersistenceOutcome discard(final String stagingLocation) {
        if (stagingStore.unlink(stagingLocation)) {
            LOGGER.fine(() -> "Discarded staged raster " + stagingLocation);
        }
        return PersistenceOutcome.discarded(Duration.ZERO);
    }

    @Override
    public void close() {
        ConcurrencyUtils.shutdownExecutorService(executor, "Persistence");
    }
}
