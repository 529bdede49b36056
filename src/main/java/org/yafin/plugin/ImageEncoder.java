package org.yafin.plugin;

import org.yafin.config.OutputFormat;
import org.yafin.image.ImageWriteException;
import org.yafin.image.PixelBuffer;

import java.nio.file.Path;

/**
 * Writes a canonical 3-channel 8-bit buffer to disk.
 */
public interface ImageEncoder {
    /**
     * @throws ImageWriteException if the file could not be written. No partial file is left behind.
     */
    void encode(PixelBuffer rgb, Path target, OutputFormat format) throws ImageWriteException;
}
