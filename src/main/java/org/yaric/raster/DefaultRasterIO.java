package org.yaric.raster;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Raster I/O over the in-memory staging namespace and the JDK ImageIO codecs.
 * <p>
 * Disk output is written to a {@code .tmp} sibling first and renamed once the encoder has closed the file,
 * so a reader never sees a partially written raster. TIFF output keeps 32-bit float samples; other
 * formats are written as 8-bit gray with samples clamped to 0..255.
 */
public class DefaultRasterIO implements RasterIO {

    private static final Logger LOGGER = Logger.getLogger(DefaultRasterIO.class.getName());

    private final MemoryRasterStore memoryStore;

    public DefaultRasterIO(final MemoryRasterStore memoryStore) {
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
    }

    @Override
    public RasterHandle open(final String location) throws IOException {
        if (MemoryRasterStore.isMemoryLocation(location)) {
            final BandRaster raster = memoryStore.get(location)
                    .orElseThrow(() -> new NoSuchFileException(location, null, "no in-memory raster"));
            return new RasterHandle(location, raster.width(), raster.height(), raster.bandCount(), Float.BYTES);
        }

        final Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(location);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                throw new IOException("Cannot open image stream for " + location);
            }
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("Unsupported raster format: " + location);
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                final int width = reader.getWidth(0);
                final int height = reader.getHeight(0);
                ImageTypeSpecifier type = reader.getRawImageType(0);
                if (type == null) {
                    type = reader.getImageTypes(0).next();
                }
                final SampleModel sampleModel = type.getSampleModel();
                final int bytesPerSample = Math.max(1, DataBuffer.getDataTypeSize(sampleModel.getDataType()) / 8);
                LOGGER.log(Level.FINE, "Opened {0}: {1}x{2}x{3}, {4} bytes/sample",
                        new Object[]{location, width, height, sampleModel.getNumBands(), bytesPerSample});
                return new RasterHandle(location, width, height, sampleModel.getNumBands(), bytesPerSample);
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public BandRaster read(final RasterHandle handle) throws IOException {
        final String location = handle.location();
        if (MemoryRasterStore.isMemoryLocation(location)) {
            return memoryStore.get(location)
                    .orElseThrow(() -> new NoSuchFileException(location, null, "no in-memory raster"));
        }

        final BufferedImage image = ImageIO.read(Path.of(location).toFile());
        if (image == null) {
            throw new IOException("Unsupported raster format: " + location);
        }
        final Raster source = image.getRaster();
        final int width = source.getWidth();
        final int height = source.getHeight();
        final float[][] bands = new float[source.getNumBands()][];
        for (int b = 0; b < bands.length; b++) {
            bands[b] = source.getSamples(0, 0, width, height, b, (float[]) null);
        }
        return new BandRaster(width, height, bands);
    }

    @Override
    public void write(final BandRaster raster, final String location) throws IOException {
        if (MemoryRasterStore.isMemoryLocation(location)) {
            memoryStore.put(location, raster);
            return;
        }

        final Path target = Path.of(location).toAbsolutePath();
        final Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final String format = formatOf(target);
        final BufferedImage image = "tiff".equals(format) ? toFloatImage(raster) : toByteImage(raster);

        final Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            if (!ImageIO.write(image, format, tmp.toFile())) {
                throw new IOException("No ImageIO writer for format '" + format + "' (" + location + ")");
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        LOGGER.log(Level.FINE, "Wrote {0} to {1}", new Object[]{raster, target});
    }

    static String formatOf(final Path path) {
        final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        final int dot = name.lastIndexOf('.');
        final String ext = dot < 0 ? "" : name.substring(dot + 1);
        return switch (ext) {
            case "", "tif", "tiff" -> "tiff";
            case "jpg", "jpeg" -> "jpeg";
            default -> ext;
        };
    }

    private static BufferedImage toFloatImage(final BandRaster raster) throws IOException {
        final ColorSpace colorSpace = colorSpaceFor(raster.bandCount());
        final ComponentColorModel colorModel = new ComponentColorModel(colorSpace, false, false,
                Transparency.OPAQUE, DataBuffer.TYPE_FLOAT);
        final WritableRaster target = colorModel.createCompatibleWritableRaster(raster.width(), raster.height());
        for (int b = 1; b <= raster.bandCount(); b++) {
            target.setSamples(0, 0, raster.width(), raster.height(), b - 1, raster.band(b));
        }
        return new BufferedImage(colorModel, target, false, null);
    }

    private static BufferedImage toByteImage(final BandRaster raster) throws IOException {
        if (raster.bandCount() != 1) {
            throw new IOException("Only single-band rasters can be written as 8-bit images, got " + raster.bandCount());
        }
        final BufferedImage image = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_BYTE_GRAY);
        final WritableRaster target = image.getRaster();
        final float[] samples = raster.band(1);
        final int[] clamped = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            final float v = samples[i];
            clamped[i] = Float.isNaN(v) ? 0 : Math.max(0, Math.min(255, Math.round(v)));
        }
        target.setSamples(0, 0, raster.width(), raster.height(), 0, clamped);
        return image;
    }

    private static ColorSpace colorSpaceFor(final int bandCount) throws IOException {
        return switch (bandCount) {
            case 1 -> ColorSpace.getInstance(ColorSpace.CS_GRAY);
            case 3 -> ColorSpace.getInstance(ColorSpace.CS_sRGB);
            default -> throw new IOException("Cannot encode a " + bandCount + "-band raster as TIFF");
        };
    }
}
