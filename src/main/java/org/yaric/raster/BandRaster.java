package org.yaric.raster;

import java.util.Objects;

/**
 * In-memory raster with band-sequential float samples.
 * Bands are addressed with 1-based band numbers, as in band mappings.
 */
public final class BandRaster {

    private final int width;
    private final int height;
    private final float[][] bands;

    public BandRaster(final int width, final int height, final float[][] bands) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        Objects.requireNonNull(bands, "bands");
        if (bands.length == 0) {
            throw new IllegalArgumentException("Raster must have at least one band");
        }
        for (int i = 0; i < bands.length; i++) {
            if (bands[i] == null || bands[i].length != width * height) {
                throw new IllegalArgumentException("Band " + (i + 1) + " does not hold " + width * height + " samples");
            }
        }
        this.width = width;
        this.height = height;
        this.bands = bands;
    }

    public static BandRaster singleBand(final int width, final int height, final float[] samples) {
        return new BandRaster(width, height, new float[][]{samples});
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int bandCount() {
        return bands.length;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * @param bandNumber 1-based band number
     * @return the live sample array of the band, row-major
     */
    public float[] band(final int bandNumber) {
        if (bandNumber < 1 || bandNumber > bands.length) {
            throw new IndexOutOfBoundsException("Band " + bandNumber + " out of range 1.." + bands.length);
        }
        return bands[bandNumber - 1];
    }

    public float sample(final int bandNumber, final int x, final int y) {
        return band(bandNumber)[y * width + x];
    }

    /** Bytes held by the sample arrays. */
    public long sizeInBytes() {
        return (long) pixelCount() * bands.length * Float.BYTES;
    }

    @Override
    public String toString() {
        return "BandRaster[%dx%dx%d]".formatted(width, height, bands.length);
    }
}
