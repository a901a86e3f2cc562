package org.yaric.raster;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Namespace of transient rasters kept in memory, addressed by locations under {@value #PREFIX}.
 * Thread safe; each location is written by exactly one task at a time.
 */
public class MemoryRasterStore {

    public static final String PREFIX = "/vsimem/";

    private static final Logger LOGGER = Logger.getLogger(MemoryRasterStore.class.getName());

    private final Map<String, BandRaster> rasters = new ConcurrentHashMap<>();

    public static boolean isMemoryLocation(final String location) {
        return location != null && location.startsWith(PREFIX);
    }

    public void put(final String location, final BandRaster raster) {
        requireMemoryLocation(location);
        if (rasters.put(location, raster) != null) {
            LOGGER.warning("Replaced in-memory raster at " + location);
        }
    }

    public Optional<BandRaster> get(final String location) {
        return Optional.ofNullable(rasters.get(location));
    }

    public boolean contains(final String location) {
        return rasters.containsKey(location);
    }

    /** Removes the raster, returning whether something was stored there. */
    public boolean unlink(final String location) {
        return rasters.remove(location) != null;
    }

    public Set<String> locations() {
        return new TreeSet<>(rasters.keySet());
    }

    public long sizeInBytes() {
        return rasters.values().stream().mapToLong(BandRaster::sizeInBytes).sum();
    }

    private static void requireMemoryLocation(final String location) {
        if (!isMemoryLocation(location)) {
            throw new IllegalArgumentException("Not an in-memory location: " + location);
        }
    }
}
