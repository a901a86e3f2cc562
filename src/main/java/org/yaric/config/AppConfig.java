package org.yaric.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Root of {@code conf/config.yaml}. Optional values may be null and fall back to defaults.
 */
public record AppConfig(List<String> inputFiles, String selectedIndices, Map<String, Integer> bandMapping,
                        String outputDir, Long maxMemoryUsageMb, Integer maxActiveTasks,
                        Map<String, String> customIndices, Path statusFile) {
}
