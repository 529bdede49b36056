package org.yafin.image;

import java.io.IOException;

/**
 * Raised when a normalized image cannot be written to its output path.
 */
public class ImageWriteException extends IOException {

    public ImageWriteException(String message) {
        super(message);
    }

    public ImageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
