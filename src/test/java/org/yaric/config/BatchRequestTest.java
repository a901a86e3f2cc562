package org.yaric.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchRequestTest {

    private static final Map<String, Integer> RGB = Map.of("R", 1, "G", 2, "B", 3);

    @Test
    void testOf_appliesDefaults() {
        BatchRequest request = BatchRequest.of(List.of("a.tif"), "ExG", RGB, null, null, null);

        assertEquals(BatchRequest.DEFAULT_OUTPUT_DIR, request.outputDir());
        assertEquals(1024L * 1024L * 1024L, request.maxMemoryUsage());
        assertEquals(5, request.maxActiveTasks());
    }

    @Test
    void testOf_convertsMegabytes() {
        BatchRequest request = BatchRequest.of(List.of("a.tif"), "ExG", RGB, "out", 3L, 2);

        assertEquals(3L * BatchRequest.BYTES_PER_MB, request.maxMemoryUsage());
        assertEquals(2, request.maxActiveTasks());
        assertEquals("out", request.outputDir());
    }

    @Test
    void testParseIndices_trimsAndDropsBlanksAndRepeats() {
        assertEquals(List.of("ExG", "ExR", "NGRDI"), BatchRequest.parseIndices(" ExG, ExR ,,ExG,NGRDI, "));
        assertTrue(BatchRequest.parseIndices(null).isEmpty());
    }

    @Test
    void testNumberOfTasks() {
        BatchRequest request = BatchRequest.of(List.of("a.tif", "b.tif", "c.tif"), "ExG,ExR", RGB, null, null, null);
        assertEquals(6, request.numberOfTasks());
    }

    @Test
    void testValidation() {
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of(), "ExG", RGB, null, null, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of(" "), "ExG", RGB, null, null, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), " , ", RGB, null, null, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), "ExG", Map.of(), null, null, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), "ExG", Map.of("R", 0), null, null, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), "ExG", RGB, null, 0L, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), "ExG", RGB, null, -5L, null));
        assertThrows(ConfigurationException.class, () -> BatchRequest.of(List.of("a.tif"), "ExG", RGB, null, null, 0));
        assertThrows(ConfigurationException.class,
                () -> new BatchRequest(List.of("a.tif"), List.of("ExG"), RGB, null, 0L, 1));
    }

    @Test
    void testIsImmutable() {
        Map<String, Integer> mapping = new HashMap<>(RGB);
        BatchRequest request = BatchRequest.of(List.of("a.tif"), "ExG", mapping, null, null, null);
        mapping.put("N", 4);

        assertFalse(request.bandMapping().containsKey("N"));
        assertThrows(UnsupportedOperationException.class, () -> request.bandMapping().put("N", 4));
        assertThrows(UnsupportedOperationException.class, () -> request.inputFiles().add("b.tif"));
    }
}
