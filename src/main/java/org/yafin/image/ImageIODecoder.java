package org.yafin.image;

import org.yafin.plugin.ImageDecoder;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes TIFF, PNG and JPEG files through {@code javax.imageio}, keeping the stored bit depth and
 * channel layout. Palette images are expanded to RGB(A) 8-bit.
 */
public class ImageIODecoder implements ImageDecoder {

    private static final Logger LOGGER = Logger.getLogger(ImageIODecoder.class.getName());

    @Override
    public PixelBuffer decode(Path file) throws ImageDecodeException {
        if (!Files.isRegularFile(file)) {
            throw new ImageDecodeException("File not found: " + file);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Failed to load image " + file.getFileName() + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Failed to load image " + file.getFileName() + ": no suitable reader");
        }
        return toPixelBuffer(image);
    }

    /**
     * Converts a decoded image. Band order follows the raster, so RGB(A) images come out as R, G, B(, A).
     */
    public static PixelBuffer toPixelBuffer(BufferedImage image) throws ImageDecodeException {
        if (image.getColorModel() instanceof IndexColorModel) {
            image = expandPalette(image);
        }
        final Raster raster = image.getRaster();
        final SampleModel sampleModel = raster.getSampleModel();
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int bands = raster.getNumBands();
        final int dataType = raster.getDataBuffer().getDataType();

        final PixelType type = pixelTypeOf(dataType, sampleModel);
        final double[] data = new double[width * height * bands];

        if (type == PixelType.UINT32 && dataType == DataBuffer.TYPE_INT) {
            // int rasters hold 32-bit samples signed
            int[] raw = raster.getPixels(0, 0, width, height, (int[]) null);
            for (int i = 0; i < raw.length; i++) {
                data[i] = raw[i] & 0xFFFFFFFFL;
            }
        } else {
            raster.getPixels(0, 0, width, height, data);
        }

        LOGGER.log(Level.FINE, "Decoded {0}x{1} image with {2} band(s) as {3}",
                new Object[]{width, height, bands, type});
        return bands == 1
                ? PixelBuffer.wrap(type, height, width, 1, false, data)
                : PixelBuffer.wrap(type, height, width, bands, true, data);
    }

    private static PixelType pixelTypeOf(int dataType, SampleModel sampleModel) throws ImageDecodeException {
        switch (dataType) {
            case DataBuffer.TYPE_FLOAT:
                return PixelType.FLOAT32;
            case DataBuffer.TYPE_DOUBLE:
                return PixelType.FLOAT64;
            case DataBuffer.TYPE_SHORT:
                throw new ImageDecodeException("Signed 16-bit samples are not supported");
            case DataBuffer.TYPE_BYTE:
            case DataBuffer.TYPE_USHORT:
            case DataBuffer.TYPE_INT:
                int bits = 0;
                for (int size : sampleModel.getSampleSize()) {
                    bits = Math.max(bits, size);
                }
                return PixelType.forIntegerBits(bits);
            default:
                throw new ImageDecodeException("Unsupported raster data type: " + dataType);
        }
    }

    private static BufferedImage expandPalette(BufferedImage indexed) {
        int type = indexed.getColorModel().hasAlpha() ? BufferedImage.TYPE_4BYTE_ABGR : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage expanded = new BufferedImage(indexed.getWidth(), indexed.getHeight(), type);
        Graphics2D g = expanded.createGraphics();
        try {
            g.drawImage(indexed, 0, 0, null);
        } finally {
            g.dispose();
        }
        return expanded;
    }
}
