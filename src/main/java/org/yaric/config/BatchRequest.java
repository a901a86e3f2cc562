package org.yaric.config;

import org.yaric.raster.MemoryRasterStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one index calculation run.
 *
 * @param inputFiles      raster locations, processed in this order
 * @param selectedIndices index names, processed in this order for every input
 * @param bandMapping     band symbol to 1-based band number
 * @param outputDir       directory (or in-memory prefix) receiving {@code <file>_<index>.tiff}
 * @param maxMemoryUsage  budget in bytes for rasters that are computing or waiting to be saved
 * @param maxActiveTasks  maximum number of concurrent calculations
 */
public record BatchRequest(List<String> inputFiles, List<String> selectedIndices, Map<String, Integer> bandMapping,
                           String outputDir, long maxMemoryUsage, int maxActiveTasks) {

    public static final String DEFAULT_OUTPUT_DIR = MemoryRasterStore.PREFIX;
    public static final long DEFAULT_MAX_MEMORY_USAGE_MB = 1024;
    public static final int DEFAULT_MAX_ACTIVE_TASKS = 5;
    public static final long BYTES_PER_MB = 1024L * 1024L;

    public BatchRequest {
        if (inputFiles == null || inputFiles.isEmpty()) {
            throw new ConfigurationException("At least one input file is required");
        }
        if (inputFiles.stream().anyMatch(f -> f == null || f.isBlank())) {
            throw new ConfigurationException("Input file names must not be blank");
        }
        if (selectedIndices == null || selectedIndices.isEmpty()) {
            throw new ConfigurationException("At least one index must be selected");
        }
        if (bandMapping == null || bandMapping.isEmpty()) {
            throw new ConfigurationException("Band mapping must not be empty");
        }
        bandMapping.forEach((symbol, band) -> {
            if (symbol == null || symbol.isBlank()) {
                throw new ConfigurationException("Band symbols must not be blank");
            }
            if (band == null || band < 1) {
                throw new ConfigurationException("Band '" + symbol + "' must map to a band number >= 1, got " + band);
            }
        });
        if (maxMemoryUsage <= 0) {
            throw new ConfigurationException("Max memory usage must be positive, got " + maxMemoryUsage);
        }
        if (maxActiveTasks < 1) {
            throw new ConfigurationException("Max active tasks must be at least 1, got " + maxActiveTasks);
        }
        inputFiles = List.copyOf(inputFiles);
        selectedIndices = List.copyOf(selectedIndices);
        bandMapping = Collections.unmodifiableMap(new LinkedHashMap<>(bandMapping));
        outputDir = outputDir == null || outputDir.isBlank() ? DEFAULT_OUTPUT_DIR : outputDir;
    }

    /**
     * Builds a request from the textual form used by configuration files, applying defaults for nulls.
     *
     * @param selectedIndices comma-delimited index names, e.g. {@code "ExG,ExR"}
     * @param maxMemoryUsageMb budget in megabytes
     */
    public static BatchRequest of(final List<String> inputFiles, final String selectedIndices,
                                  final Map<String, Integer> bandMapping, final String outputDir,
                                  final Long maxMemoryUsageMb, final Integer maxActiveTasks) {
        final long megabytes = maxMemoryUsageMb != null ? maxMemoryUsageMb : DEFAULT_MAX_MEMORY_USAGE_MB;
        if (megabytes <= 0) {
            throw new ConfigurationException("Max memory usage must be positive, got " + megabytes + " MB");
        }
        return new BatchRequest(inputFiles, parseIndices(selectedIndices), bandMapping, outputDir,
                Math.multiplyExact(megabytes, BYTES_PER_MB),
                maxActiveTasks != null ? maxActiveTasks : DEFAULT_MAX_ACTIVE_TASKS);
    }

    /**
     * Splits a comma-delimited list, trimming names and dropping blanks and repeats.
     */
    public static List<String> parseIndices(final String selectedIndices) {
        if (selectedIndices == null) return Collections.emptyList();
        final LinkedHashSet<String> names = new LinkedHashSet<>();
        Arrays.stream(selectedIndices.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(names::add);
        return new ArrayList<>(names);
    }

    public int numberOfTasks() {
        return inputFiles.size() * selectedIndices.size();
    }
}
