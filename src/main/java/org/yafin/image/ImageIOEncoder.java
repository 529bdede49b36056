package org.yafin.image;

import org.yafin.config.OutputFormat;
import org.yafin.plugin.ImageEncoder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes canonical RGB 8-bit buffers through {@code javax.imageio}.
 */
public class ImageIOEncoder implements ImageEncoder {

    private static final Logger LOGGER = Logger.getLogger(ImageIOEncoder.class.getName());

    @Override
    public void encode(PixelBuffer rgb, Path target, OutputFormat format) throws ImageWriteException {
        final BufferedImage image = toBufferedImage(rgb);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(image, format.imageIoName(), target.toFile())) {
                deletePartial(target);
                throw new ImageWriteException("No ImageIO writer available for format " + format.imageIoName());
            }
        } catch (ImageWriteException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            deletePartial(target);
            throw new ImageWriteException("Error saving image '" + target + "': " + e.getMessage(), e);
        }
        LOGGER.log(Level.FINE, "Wrote {0} as {1}", new Object[]{target, format});
    }

    /**
     * Builds a {@code TYPE_3BYTE_BGR} image from an R, G, B interleaved 8-bit buffer.
     */
    public static BufferedImage toBufferedImage(PixelBuffer rgb) {
        if (rgb.type() != PixelType.UINT8 || rgb.channels() != 3) {
            throw new IllegalArgumentException("Expected a 3-channel uint8 buffer but got " + rgb);
        }
        BufferedImage image = new BufferedImage(rgb.width(), rgb.height(), BufferedImage.TYPE_3BYTE_BGR);
        WritableRaster raster = image.getRaster();
        raster.setPixels(0, 0, rgb.width(), rgb.height(), rgb.samples());
        return image;
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not remove partial output " + target, e);
        }
    }
}
