package org.yaric.raster;

/**
 * Header of a raster that has been located but not decoded.
 *
 * @param location       in-memory or file system location the handle was opened from
 * @param width          columns
 * @param height         rows
 * @param bandCount      number of bands
 * @param bytesPerSample storage size of one sample of one band
 */
public record RasterHandle(String location, int width, int height, int bandCount, int bytesPerSample) {

    public long sizeInBytes() {
        return (long) width * height * bandCount * bytesPerSample;
    }
}
