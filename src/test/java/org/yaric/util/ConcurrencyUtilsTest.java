package org.yaric.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyUtilsTest {

    @Test
    void testCreatePlatformThreadFactory_numbersThreads() {
        ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory("Compute-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("Compute-0", first.getName());
        assertEquals("Compute-1", second.getName());
        assertFalse(first.isDaemon());
    }

    @Test
    void testShutdownExecutorService_nullExecutor() {
        assertDoesNotThrow(() -> ConcurrencyUtils.shutdownExecutorService(null, "NullTestExecutor"));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_normalShutdown() {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        localExecutor.submit(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ConcurrencyUtils.shutdownExecutorService(localExecutor, "NormalShutdownTest");
        assertTrue(localExecutor.isTerminated(), "Executor should be terminated after shutdown.");
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_forcesStuckTask() throws InterruptedException {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        CountDownLatch started = new CountDownLatch(1);
        localExecutor.submit(() -> {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        started.await();

        ConcurrencyUtils.shutdownExecutorService(localExecutor, "StuckTest", Duration.ofMillis(100));

        assertTrue(localExecutor.isTerminated(), "Interrupted task should let the executor terminate.");
    }
}
