package org.yafin.plugin;

import org.yafin.image.ImageDecodeException;
import org.yafin.image.PixelBuffer;

import java.nio.file.Path;

/**
 * Decodes a single image file.
 */
public interface ImageDecoder {
    /**
     * Reads the file into a pixel buffer, keeping its original bit depth and channel layout.
     *
     * @throws ImageDecodeException if the file cannot be read or its sample layout is not representable.
     */
    PixelBuffer decode(Path file) throws ImageDecodeException;
}
