package org.yaric.processing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.yaric.metrics.Status;
import org.yaric.raster.BandRaster;
import org.yaric.raster.RasterHandle;
import org.yaric.raster.RasterIO;
import org.yaric.raster.expr.EvaluationException;
import org.yaric.raster.expr.RasterEvaluator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ComputeTaskTest {

    private static final Map<String, Integer> RG = Map.of("R", 1, "G", 2);

    @Mock
    private RasterIO rasterIO;
    @Mock
    private RasterEvaluator evaluator;

    private RasterHandle handle;
    private WorkItem item;
    private BandRaster input;
    private BandRaster output;

    @BeforeEach
    void setUp() {
        handle = new RasterHandle("/data/a.tif", 2, 1, 2, 1);
        item = new WorkItem(0, "/data/a.tif", handle, null, "NGRDI", "(G - R) / (G + R)", RG,
                "/vsimem/staging/0/a_NGRDI.tiff", "/out/a_NGRDI.tiff", 6);
        input = new BandRaster(2, 1, new float[][]{{1f, 2f}, {3f, 4f}});
        output = BandRaster.singleBand(2, 1, new float[]{0.5f, 0.33f});
    }

    @Test
    void testCall_stagesOutput() throws Exception {
        when(rasterIO.read(handle)).thenReturn(input);
        when(evaluator.evaluate("(G - R) / (G + R)", RG, input)).thenReturn(output);

        ComputeOutcome outcome = new ComputeTask(item, rasterIO, evaluator).call();

        assertTrue(outcome.isSuccess());
        assertEquals("/vsimem/staging/0/a_NGRDI.tiff", outcome.stagingLocation());
        assertNull(outcome.message());
        assertEquals(Thread.currentThread().getName(), outcome.threadName());
        verify(rasterIO).write(output, "/vsimem/staging/0/a_NGRDI.tiff");
        verify(rasterIO, never()).write(any(), eq("/out/a_NGRDI.tiff"));
    }

    @Test
    void testCall_evaluationFailure() throws Exception {
        when(rasterIO.read(handle)).thenReturn(input);
        when(evaluator.evaluate(anyString(), anyMap(), any())).thenThrow(new EvaluationException("Unknown function 'foo'"));

        ComputeOutcome outcome = new ComputeTask(item, rasterIO, evaluator).call();

        assertEquals(Status.FAILURE, outcome.status());
        assertEquals("Unknown function 'foo'", outcome.message());
        assertNull(outcome.stagingLocation());
        verify(rasterIO, never()).write(any(), anyString());
    }

    @Test
    void testCall_readFailure() throws Exception {
        when(rasterIO.read(handle)).thenThrow(new IOException("truncated file"));

        ComputeOutcome outcome = new ComputeTask(item, rasterIO, evaluator).call();

        assertEquals(Status.FAILURE, outcome.status());
        assertEquals("truncated file", outcome.message());
        verifyNoInteractions(evaluator);
    }

    @Test
    void testCall_unexpectedExceptionIsError() throws Exception {
        when(rasterIO.read(handle)).thenReturn(input);
        when(evaluator.evaluate(anyString(), anyMap(), any())).thenThrow(new IllegalStateException("boom"));

        ComputeOutcome outcome = new ComputeTask(item, rasterIO, evaluator).call();

        assertEquals(Status.ERROR, outcome.status());
        assertTrue(outcome.message().contains("boom"), outcome.message());
    }

    @Test
    void testCall_abandonedBeforeStart() {
        ComputeTask task = new ComputeTask(item, rasterIO, evaluator);
        task.abandon();

        ComputeOutcome outcome = task.call();

        assertEquals(Status.FAILURE, outcome.status());
        assertTrue(task.isAbandoned());
        verifyNoInteractions(rasterIO, evaluator);
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testAbandon_interruptsRunningCalculation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(rasterIO.read(handle)).thenReturn(input);
        when(evaluator.evaluate(anyString(), anyMap(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                throw new EvaluationException("interrupted");
            }
            return output;
        });
        ComputeTask task = new ComputeTask(item, rasterIO, evaluator);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ComputeOutcome> future = executor.submit(task);
            started.await();

            task.abandon();

            ComputeOutcome outcome = future.get();
            assertEquals(Status.FAILURE, outcome.status());
            verify(rasterIO, never()).write(any(), anyString());
            // the pool thread must not stay interrupted
            assertFalse(executor.submit(() -> Thread.currentThread().isInterrupted()).get());
        } finally {
            executor.shutdownNow();
        }
    }
}
