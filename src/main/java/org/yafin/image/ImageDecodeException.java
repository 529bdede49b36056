package org.yafin.image;

import java.io.IOException;

/**
 * Raised when an input file cannot be decoded into a {@link PixelBuffer}.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
