package org.yaric.processing;

import org.yaric.raster.RasterHandle;

import java.util.Map;

/**
 * One (input file, index) pairing. Immutable; owned by the scheduler for the duration of a run.
 *
 * @param sequence         position in creation order, used to order results
 * @param inputFile        input raster location
 * @param raster           opened header, null when the input could not be opened
 * @param inputError       why the input could not be opened, null otherwise
 * @param indexName        index to calculate
 * @param formula          fully expanded formula
 * @param bandMapping      the part of the band mapping the formula reads
 * @param stagingLocation  in-memory location of the calculated raster
 * @param outputLocation   final location
 * @param estimatedBytes   memory reserved while the item computes and waits to be saved
 */
public record WorkItem(int sequence, String inputFile, RasterHandle raster, String inputError, String indexName,
                       String formula, Map<String, Integer> bandMapping, String stagingLocation,
                       String outputLocation, long estimatedBytes) {

    public WorkItem {
        bandMapping = Map.copyOf(bandMapping);
    }

    public boolean isReadable() {
        return inputError == null;
    }

    public String description() {
        return "Calculate %s for %s".formatted(indexName, inputFile);
    }
}
