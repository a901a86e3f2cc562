package org.yaric.raster;

import java.io.IOException;

/**
 * Raster read/write boundary used by the calculation and persistence stages.
 * Locations starting with {@link MemoryRasterStore#PREFIX} never touch the disk.
 */
public interface RasterIO {

    /** Reads only the header of the raster at {@code location}. */
    RasterHandle open(String location) throws IOException;

    /** Decodes all bands of an opened raster. */
    BandRaster read(RasterHandle handle) throws IOException;

    /** Writes {@code raster} to {@code location}, creating parent directories as needed. */
    void write(BandRaster raster, String location) throws IOException;

    /**
     * Estimated bytes held in memory while the raster is decoded.
     */
    default long estimateSize(final RasterHandle handle) {
        return handle.sizeInBytes();
    }
}
