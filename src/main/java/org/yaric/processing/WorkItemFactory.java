package org.yaric.processing;

import org.yaric.catalog.IndexDefinition;
import org.yaric.config.BatchRequest;
import org.yaric.raster.MemoryRasterStore;
import org.yaric.raster.RasterHandle;
import org.yaric.raster.RasterIO;
import org.yaric.util.FileUtils;
import org.yaric.util.Utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands a {@link BatchRequest} into work items: input files in the outer loop, indices in the inner loop.
 * <p>
 * Each input header is opened once to size its items. The estimate is the decoded input plus one output
 * band of the same sample size. Inputs that cannot be opened still produce their items, marked unreadable,
 * so that every pairing reports a result.
 */
public class WorkItemFactory {

    private static final Logger LOGGER = Logger.getLogger(WorkItemFactory.class.getName());

    static final String STAGING_DIR = MemoryRasterStore.PREFIX + "staging/";

    private final RasterIO rasterIO;

    public WorkItemFactory(final RasterIO rasterIO) {
        this.rasterIO = rasterIO;
    }

    /**
     * @param definitions resolved definition for every selected index
     */
    public List<WorkItem> createWorkItems(final BatchRequest request, final Map<String, IndexDefinition> definitions) {
        final List<WorkItem> items = new ArrayList<>(request.numberOfTasks());
        final Set<String> outputs = new HashSet<>();

        for (final String inputFile : request.inputFiles()) {
            RasterHandle handle = null;
            String inputError = null;
            long estimatedBytes = 0;
            try {
                handle = rasterIO.open(inputFile);
                estimatedBytes = estimateCost(handle);
                LOGGER.log(Level.FINE, "Input {0}: {1}x{2}x{3}, estimated {4} per index",
                        new Object[]{inputFile, handle.width(), handle.height(), handle.bandCount(),
                                Utils.formatBytes(estimatedBytes)});
            } catch (final IOException | RuntimeException e) {
                inputError = "Invalid raster file: " + inputFile + " (" + e.getMessage() + ")";
                LOGGER.warning(inputError);
            }

            final String stem = FileUtils.stem(inputFile);
            for (final String indexName : request.selectedIndices()) {
                final IndexDefinition definition = definitions.get(indexName);
                final int sequence = items.size();
                final String fileName = stem + "_" + indexName + ".tiff";
                final String outputLocation = FileUtils.resolve(request.outputDir(), fileName);
                if (!outputs.add(outputLocation)) {
                    LOGGER.warning("Output " + outputLocation + " is produced more than once; the last save wins");
                }
                items.add(new WorkItem(sequence, inputFile, handle, inputError, indexName, definition.formula(),
                        bandsFor(definition, request.bandMapping()), STAGING_DIR + sequence + "/" + fileName,
                        outputLocation, estimatedBytes));
                LOGGER.log(Level.FINE, "Created work item #{0}: {1} -> {2}",
                        new Object[]{sequence, indexName, outputLocation});
            }
        }
        return items;
    }

    long estimateCost(final RasterHandle handle) {
        final long input = rasterIO.estimateSize(handle);
        return input + input / Math.max(1, handle.bandCount());
    }

    private static Map<String, Integer> bandsFor(final IndexDefinition definition, final Map<String, Integer> bandMapping) {
        final Map<String, Integer> subset = new LinkedHashMap<>();
        for (final String symbol : definition.requiredBands()) {
            final Integer band = bandMapping.get(symbol);
            if (band != null) subset.put(symbol, band);
        }
        return subset;
    }
}
