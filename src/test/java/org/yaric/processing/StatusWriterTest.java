package org.yaric.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaric.metrics.Phase;
import org.yaric.metrics.StatusHelper;
import org.yaric.metrics.TaskResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusWriterTest {

    @TempDir
    Path tempDir;

    private static List<TaskResult> results() {
        return List.of(
                StatusHelper.createSavedResult("a.tif", "ExG", "out/a_ExG.tiff", 1600,
                        Duration.ofMillis(12), Duration.ofMillis(3), "Compute-0"),
                StatusHelper.createRejectedResult("a.tif", "ExR", Phase.ADMISSION,
                        "Insufficient memory: task requires 2.0 GB, budget 1.0 GB", 2L << 30));
    }

    @Test
    void testInsertTaskStatus_writesHeaderOnce() throws IOException {
        Path statusFile = tempDir.resolve("reports").resolve("status.csv");

        try (StatusWriter writer = new StatusWriter(statusFile)) {
            assertEquals(2, writer.insertTaskStatus(results()));
        }
        try (StatusWriter writer = new StatusWriter(statusFile)) {
            writer.insertTaskStatus(results().subList(0, 1));
        }

        List<String> lines = Files.readAllLines(statusFile);
        assertEquals(4, lines.size());
        assertEquals(StatusWriter.HEADER.trim(), lines.get(0));
        assertEquals(1, lines.stream().filter(l -> l.startsWith("run_ts")).count());
    }

    @Test
    void testInsertTaskStatus_escapesFields() throws IOException {
        Path statusFile = tempDir.resolve("status.csv");

        try (StatusWriter writer = new StatusWriter(statusFile)) {
            writer.insertTaskStatus(results());
        }

        List<String> lines = Files.readAllLines(statusFile);
        assertTrue(lines.get(1).contains(",a.tif,ExG,SUCCESS,,out/a_ExG.tiff,1600,12,3,Compute-0,"), lines.get(1));
        assertTrue(lines.get(2).contains(",FAILURE,ADMISSION,,"), lines.get(2));
        assertTrue(lines.get(2).endsWith("\"Insufficient memory: task requires 2.0 GB, budget 1.0 GB\""), lines.get(2));
    }
}
