package org.yaric.processing;

import org.yaric.catalog.IndexCatalog;
import org.yaric.catalog.IndexDefinition;
import org.yaric.catalog.UnknownIndexException;
import org.yaric.config.BatchRequest;
import org.yaric.config.ConfigurationException;
import org.yaric.metrics.BatchReport;
import org.yaric.metrics.Phase;
import org.yaric.metrics.Status;
import org.yaric.metrics.StatusHelper;
import org.yaric.metrics.TaskResult;
import org.yaric.raster.DefaultRasterIO;
import org.yaric.raster.MemoryRasterStore;
import org.yaric.raster.RasterIO;
import org.yaric.raster.expr.BandMathEvaluator;
import org.yaric.raster.expr.RasterEvaluator;
import org.yaric.util.ConcurrencyUtils;
import org.yaric.util.Utils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calculates every selected index for every input file within a memory budget and a concurrency cap.
 * <p>
 * A single loop on the calling thread owns the work queue, the running set and the {@link MemoryLedger}.
 * Items are admitted strictly in order: the head of the queue waits until both a compute slot and enough
 * budget are free, and nothing behind it overtakes it. Memory reserved for an item stays committed until
 * its output has been saved (or discarded) by the {@link PersistenceWorker}, so rasters waiting to be
 * written still count against the budget.
 * <p>
 * Worker threads only talk to the loop through a completion queue. Results come back in work item order
 * regardless of completion order.
 */
public class IndexCalculator {

    private static final Logger LOGGER = Logger.getLogger(IndexCalculator.class.getName());

    static final String CANCELLED_MESSAGE = "cancelled";

    private final BatchRequest request;
    private final IndexCatalog catalog;
    private final RasterIO rasterIO;
    private final RasterEvaluator evaluator;
    private final MemoryRasterStore stagingStore;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile BlockingQueue<CompletionEvent> events;

    public IndexCalculator(final BatchRequest request, final IndexCatalog catalog, final RasterIO rasterIO,
                           final RasterEvaluator evaluator, final MemoryRasterStore stagingStore) {
        this.request = request;
        this.catalog = catalog;
        this.rasterIO = rasterIO;
        this.evaluator = evaluator;
        this.stagingStore = stagingStore;
    }

    /**
     * Calculator reading inputs through ImageIO and evaluating formulas with {@link BandMathEvaluator}.
     * In-memory inputs and outputs live in a new store, reachable through {@link #memoryStore()}.
     */
    public static IndexCalculator create(final BatchRequest request, final IndexCatalog catalog) {
        return create(request, catalog, new MemoryRasterStore());
    }

    /**
     * @param memoryStore serves every {@code /vsimem/} location: in-memory inputs, staging and in-memory outputs
     */
    public static IndexCalculator create(final BatchRequest request, final IndexCatalog catalog,
                                         final MemoryRasterStore memoryStore) {
        return new IndexCalculator(request, catalog, new DefaultRasterIO(memoryStore), new BandMathEvaluator(),
                memoryStore);
    }

    /** Store holding staged rasters and any output written under {@value MemoryRasterStore#PREFIX}. */
    public MemoryRasterStore memoryStore() {
        return stagingStore;
    }

    /**
     * Runs the batch to completion.
     *
     * @return one result per (input file, index) pair, input-major and index-minor
     * @throws ConfigurationException if an index is unknown or the band mapping lacks a band a formula reads;
     *                                nothing has been calculated in that case
     * @throws InterruptedException   if the calling thread is interrupted while waiting for workers
     */
    public BatchReport execute() throws InterruptedException {
        final Instant start = Instant.now();
        final Map<String, IndexDefinition> definitions = resolveIndices();
        final List<WorkItem> items = new WorkItemFactory(rasterIO).createWorkItems(request, definitions);

        LOGGER.info(String.format("Starting %d task(s): %d input(s) x %d index(es), budget %s, max %d active task(s)",
                items.size(), request.inputFiles().size(), request.selectedIndices().size(),
                Utils.formatBytes(request.maxMemoryUsage()), request.maxActiveTasks()));

        final Run run = new Run(items);
        final ExecutorService computePool = Executors.newFixedThreadPool(request.maxActiveTasks(),
                ConcurrencyUtils.createPlatformThreadFactory("Compute-"));
        try (PersistenceWorker persistenceWorker = new PersistenceWorker(rasterIO, stagingStore, run.events::add)) {
            this.events = run.events;
            if (cancelled.get()) {
                run.events.add(new CompletionEvent.CancelRequested());
            }
            try {
                run.loop(computePool, persistenceWorker);
            } catch (final InterruptedException e) {
                LOGGER.warning("Interrupted while waiting for tasks; abandoning " + run.running.size() + " running task(s)");
                run.running.values().forEach(ComputeTask::abandon);
                throw e;
            } finally {
                ConcurrencyUtils.shutdownExecutorService(computePool, "Compute");
            }
        } finally {
            this.events = null;
            cancelled.set(false);
        }

        final Duration total = Duration.between(start, Instant.now());
        final List<TaskResult> results = Arrays.asList(run.results);
        final BatchReport report = new BatchReport(total, results, run.ledger.peak(), run.peakActiveTasks,
                StatusHelper.determineOverallStatus(results, items.size()));
        LOGGER.info(String.format("Finished %d task(s) in %.2f seconds: %s, %d succeeded, %d failed, peak memory %s, peak active tasks %d",
                items.size(), total.toMillis() / 1000.0, report.overallStatus(), report.succeeded(), report.failed(),
                Utils.formatBytes(report.peakMemoryUsage()), report.peakActiveTasks()));
        return report;
    }

    /**
     * Stops admitting work. Queued items are reported as failed without running; running calculations are
     * interrupted. Saving of already calculated outputs still completes. Safe to call from any thread.
     * <p>
     * Applies to the run in progress, or to the next {@link #execute()} if none is running; the request is
     * cleared when that run ends, so the calculator can be run again.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOGGER.info("Cancellation requested");
            final BlockingQueue<CompletionEvent> current = events;
            if (current != null) {
                current.add(new CompletionEvent.CancelRequested());
            }
        }
    }

    /** Whether a cancellation is pending for the current or next run. */
    public boolean isCancelled() {
        return cancelled.get();
    }

    Map<String, IndexDefinition> resolveIndices() {
        final Map<String, IndexDefinition> definitions = new LinkedHashMap<>();
        for (final String indexName : request.selectedIndices()) {
            final IndexDefinition definition;
            try {
                definition = catalog.resolve(indexName);
            } catch (final UnknownIndexException e) {
                throw new ConfigurationException("Cannot calculate index " + indexName + ": " + e.getMessage(), e);
            }
            final Set<String> missing = new TreeSet<>(definition.requiredBands());
            missing.removeAll(request.bandMapping().keySet());
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Band mapping " + request.bandMapping().keySet()
                        + " lacks band(s) " + missing + " required by index " + indexName);
            }
            definitions.put(indexName, definition);
        }
        return definitions;
    }

    /**
     * Mutable state of one {@link #execute()} call. Touched only by the loop thread, except {@link #events}.
     */
    private final class Run {
        private final Deque<WorkItem> queue;
        private final TaskResult[] results;
        private final MemoryLedger ledger = new MemoryLedger(request.maxMemoryUsage());
        private final BlockingQueue<CompletionEvent> events = new LinkedBlockingQueue<>();
        private final Map<Integer, ComputeTask> running = new LinkedHashMap<>();
        private int awaitingPersistence;
        private int recorded;
        private int peakActiveTasks;
        private boolean drained;

        Run(final List<WorkItem> items) {
            this.queue = new ArrayDeque<>(items);
            this.results = new TaskResult[items.size()];
        }

        void loop(final ExecutorService computePool, final PersistenceWorker persistenceWorker) throws InterruptedException {
            while (true) {
                if (cancelled.get() && !drained) {
                    drainCancelled();
                }
                admit(computePool);
                if (queue.isEmpty() && running.isEmpty() && awaitingPersistence == 0) {
                    return;
                }

                final CompletionEvent event = events.take();
                if (event instanceof CompletionEvent.ComputeCompleted computed) {
                    running.remove(computed.item().sequence());
                    awaitingPersistence++;
                    persistenceWorker.submit(computed.item(), computed.outcome());
                } else if (event instanceof CompletionEvent.PersistenceCompleted persisted) {
                    awaitingPersistence--;
                    ledger.release(persisted.item().estimatedBytes());
                    record(persisted.item(), toResult(persisted));
                }
            }
        }

        private void admit(final ExecutorService computePool) {
            while (!queue.isEmpty()) {
                final WorkItem head = queue.peekFirst();
                if (!head.isReadable()) {
                    queue.pollFirst();
                    LOGGER.warning("Skipping " + head.description() + ": " + head.inputError());
                    record(head, StatusHelper.createRejectedResult(head.inputFile(), head.indexName(),
                            Phase.CALCULATION, head.inputError(), head.estimatedBytes()));
                    continue;
                }
                if (!ledger.fitsBudget(head.estimatedBytes())) {
                    queue.pollFirst();
                    final String message = "Insufficient memory: task requires %s but the budget is %s".formatted(
                            Utils.formatBytes(head.estimatedBytes()), Utils.formatBytes(ledger.budget()));
                    LOGGER.warning("Rejected " + head.description() + ": " + message);
                    record(head, StatusHelper.createRejectedResult(head.inputFile(), head.indexName(),
                            Phase.ADMISSION, message, head.estimatedBytes()));
                    continue;
                }
                if (running.size() >= request.maxActiveTasks() || !ledger.canReserve(head.estimatedBytes())) {
                    return;
                }

                queue.pollFirst();
                ledger.reserve(head.estimatedBytes());
                final ComputeTask task = new ComputeTask(head, rasterIO, evaluator);
                running.put(head.sequence(), task);
                peakActiveTasks = Math.max(peakActiveTasks, running.size());
                LOGGER.log(Level.FINE, "Admitted #{0} {1} ({2}, {3})", new Object[]{head.sequence(),
                        head.description(), Utils.formatBytes(head.estimatedBytes()), ledger});

                CompletableFuture.supplyAsync(task::call, computePool).whenComplete((outcome, ex) -> {
                    final ComputeOutcome result = ex == null ? outcome
                            : ComputeOutcome.error(String.valueOf(ex.getCause() != null ? ex.getCause() : ex), Duration.ZERO);
                    events.add(new CompletionEvent.ComputeCompleted(head, result));
                });
            }
        }

        private void drainCancelled() {
            drained = true;
            LOGGER.warning(String.format("Cancelling: %d queued task(s) dropped, %d running task(s) interrupted",
                    queue.size(), running.size()));
            while (!queue.isEmpty()) {
                final WorkItem item = queue.pollFirst();
                record(item, StatusHelper.createRejectedResult(item.inputFile(), item.indexName(), Phase.ADMISSION,
                        CANCELLED_MESSAGE, item.estimatedBytes()));
            }
            running.values().forEach(ComputeTask::abandon);
        }

        private TaskResult toResult(final CompletionEvent.PersistenceCompleted event) {
            final WorkItem item = event.item();
            final ComputeOutcome computed = event.computeOutcome();
            final PersistenceOutcome persisted = event.persistenceOutcome();
            if (!computed.isSuccess()) {
                return StatusHelper.createFailedResult(item.inputFile(), item.indexName(), computed.status(),
                        Phase.CALCULATION, computed.message(), item.estimatedBytes(), computed.calculationTime(),
                        persisted.savingTime(), computed.threadName());
            }
            if (!persisted.saved()) {
                return StatusHelper.createFailedResult(item.inputFile(), item.indexName(), Status.FAILURE,
                        Phase.PERSISTENCE, persisted.message(), item.estimatedBytes(), computed.calculationTime(),
                        persisted.savingTime(), computed.threadName());
            }
            return StatusHelper.createSavedResult(item.inputFile(), item.indexName(), persisted.outputLocation(),
                    item.estimatedBytes(), computed.calculationTime(), persisted.savingTime(), computed.threadName());
        }

        private void record(final WorkItem item, final TaskResult result) {
            results[item.sequence()] = result;
            recorded++;
            LOGGER.info(String.format("Progress: %.1f%%", recorded * 100.0 / results.length));
        }
    }
}
