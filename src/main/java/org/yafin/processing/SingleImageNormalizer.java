package org.yafin.processing;

import org.yafin.config.DegeneratePolicy;
import org.yafin.config.OutputFormat;
import org.yafin.image.ImageIODecoder;
import org.yafin.image.ImageIOEncoder;
import org.yafin.image.PixelBuffer;
import org.yafin.normalize.ChannelNormalizer;
import org.yafin.normalize.ChannelResult;
import org.yafin.normalize.PercentileNormalizer;
import org.yafin.plugin.ImageDecoder;
import org.yafin.plugin.ImageEncoder;
import org.yafin.util.FileUtils;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Normalizes one file to one output path, for callers that need a single image rather than a batch
 * (e.g. a viewer preparing a display copy). Unlike the batch pipeline, 8-bit inputs are written too,
 * and any image ImageIO can read is at least converted to plain RGB when normalization is not possible.
 */
public class SingleImageNormalizer {

    private static final Logger LOGGER = Logger.getLogger(SingleImageNormalizer.class.getName());

    private final ImageDecoder decoder;
    private final ImageEncoder encoder;

    public SingleImageNormalizer() {
        this(new ImageIODecoder(), new ImageIOEncoder());
    }

    public SingleImageNormalizer(ImageDecoder decoder, ImageEncoder encoder) {
        this.decoder = decoder;
        this.encoder = encoder;
    }

    /**
     * Writes the normalized image; the output format follows {@code output}'s extension.
     *
     * @return false only when neither normalization nor the plain RGB fallback produced a file
     */
    public boolean normalize(Path input, Path output, double lowPercentile, double highPercentile) {
        final OutputFormat format;
        try {
            format = OutputFormat.fromName(FileUtils.extensionOf(output).replace(".", ""));
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Cannot write {0}: {1}", new Object[]{output, e.getMessage()});
            return false;
        }
        try {
            PixelBuffer raw = decoder.decode(input);
            ChannelNormalizer normalizer = new ChannelNormalizer(
                    new PercentileNormalizer(lowPercentile, highPercentile, DegeneratePolicy.ZERO));
            ChannelResult result = normalizer.normalize(raw);
            if (!result.isSupported()) {
                throw new IOException(result.reason());
            }
            encoder.encode(result.buffer(), output, format);
            return true;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Error normalizing image " + input + ", falling back to RGB conversion", e);
            return fallback(input, output, format);
        }
    }

    private boolean fallback(Path input, Path output, OutputFormat format) {
        try {
            BufferedImage image = ImageIO.read(input.toFile());
            if (image == null) {
                LOGGER.log(Level.WARNING, "Fallback failed, no reader for {0}", input);
                return false;
            }
            BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = rgb.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
            encoder.encode(ImageIODecoder.toPixelBuffer(rgb), output, format);
            return true;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Fallback conversion failed for " + input, e);
            return false;
        }
    }
}
