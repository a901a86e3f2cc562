package org.yaric.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency and executors.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named platform threads: {@code prefix0, prefix1, ...}.
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        shutdownExecutorService(executor, name, SHUTDOWN_WAIT_TIMEOUT);
    }

    public static void shutdownExecutorService(final ExecutorService executor, final String name, final Duration timeout) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(String.format("Executor %s did not terminate in %dms, attempting forceful shutdown...", name, timeout.toMillis()));
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
                LOGGER.warning(String.format("Executor %s forcing shutdown. Dropped %d waiting tasks.", name, droppedTasks.size()));

                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS))
                    LOGGER.severe(String.format("Executor %s did not terminate even after forcing.", name));
                else
                    LOGGER.info(String.format("Executor %s terminated after forcing.", name));

            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.warning(String.format("Shutdown wait for executor %s interrupted. Forcing shutdown now.", name));
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }
}
