package org.yaric.util;

import org.yaric.raster.MemoryRasterStore;

import java.nio.file.Path;

/**
 * Location helpers shared by the in-memory namespace and the file system.
 */
public final class FileUtils {

    private FileUtils() {
    }

    /** File name without directory and last extension: {@code /data/a.tif -> a}. */
    public static String stem(final String location) {
        final String normalized = location.replace('\\', '/');
        final String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Joins a file name onto a directory, keeping in-memory directories in the in-memory namespace.
     */
    public static String resolve(final String directory, final String fileName) {
        if (MemoryRasterStore.isMemoryLocation(directory)) {
            return directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
        }
        return Path.of(directory).resolve(fileName).toString();
    }
}
