package org.yaric.processing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaric.catalog.BuiltInIndexCatalog;
import org.yaric.catalog.IndexDefinition;
import org.yaric.config.BatchRequest;
import org.yaric.raster.BandRaster;
import org.yaric.raster.DefaultRasterIO;
import org.yaric.raster.MemoryRasterStore;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemFactoryTest {

    private static final Map<String, Integer> RGB = Map.of("R", 1, "G", 2, "B", 3);

    private MemoryRasterStore store;
    private WorkItemFactory factory;

    @BeforeEach
    void setUp() {
        store = new MemoryRasterStore();
        factory = new WorkItemFactory(new DefaultRasterIO(store));
        store.put("/vsimem/a.tif", new BandRaster(10, 10, new float[3][100]));
        store.put("/vsimem/b.tif", new BandRaster(10, 10, new float[3][100]));
    }

    private static Map<String, IndexDefinition> resolve(BatchRequest request) throws Exception {
        BuiltInIndexCatalog catalog = new BuiltInIndexCatalog();
        Map<String, IndexDefinition> definitions = new LinkedHashMap<>();
        for (String name : request.selectedIndices()) {
            definitions.put(name, catalog.resolve(name));
        }
        return definitions;
    }

    @Test
    void testCreateWorkItems_inputMajorOrder() throws Exception {
        BatchRequest request = BatchRequest.of(List.of("/vsimem/a.tif", "/vsimem/b.tif"), "ExG,NGRDI", RGB, null, null, null);

        List<WorkItem> items = factory.createWorkItems(request, resolve(request));

        assertEquals(4, items.size());
        assertEquals(List.of("a.tif:ExG", "a.tif:NGRDI", "b.tif:ExG", "b.tif:NGRDI"),
                items.stream().map(i -> i.inputFile().substring(8) + ":" + i.indexName()).toList());
        for (int i = 0; i < items.size(); i++) {
            assertEquals(i, items.get(i).sequence());
        }
    }

    @Test
    void testCreateWorkItems_locationsAndCost() throws Exception {
        BatchRequest request = BatchRequest.of(List.of("/vsimem/a.tif"), "NGRDI", RGB, "out", null, null);

        WorkItem item = factory.createWorkItems(request, resolve(request)).get(0);

        assertEquals("/vsimem/staging/0/a_NGRDI.tiff", item.stagingLocation());
        assertEquals(Path.of("out", "a_NGRDI.tiff").toString(), item.outputLocation());
        // 10x10 pixels x 3 float bands, plus one output band
        assertEquals(1200 + 400, item.estimatedBytes());
        assertEquals(Map.of("R", 1, "G", 2), item.bandMapping());
        assertTrue(item.isReadable());
    }

    @Test
    void testCreateWorkItems_unreadableInputStillYieldsItems() throws Exception {
        BatchRequest request = BatchRequest.of(List.of("/vsimem/missing.tif", "/vsimem/a.tif"), "ExG,ExR", RGB, null, null, null);

        List<WorkItem> items = factory.createWorkItems(request, resolve(request));

        assertEquals(4, items.size());
        assertFalse(items.get(0).isReadable());
        assertFalse(items.get(1).isReadable());
        assertNull(items.get(0).raster());
        assertTrue(items.get(0).inputError().contains("/vsimem/missing.tif"));
        assertTrue(items.get(2).isReadable());
    }

    @Test
    void testCreateWorkItems_collidingOutputsGetDistinctStaging() throws Exception {
        store.put("/vsimem/other/a.tif", new BandRaster(10, 10, new float[3][100]));
        BatchRequest request = BatchRequest.of(List.of("/vsimem/a.tif", "/vsimem/other/a.tif"), "ExG", RGB, null, null, null);

        List<WorkItem> items = factory.createWorkItems(request, resolve(request));

        assertEquals(items.get(0).outputLocation(), items.get(1).outputLocation());
        assertNotEquals(items.get(0).stagingLocation(), items.get(1).stagingLocation());
    }
}
