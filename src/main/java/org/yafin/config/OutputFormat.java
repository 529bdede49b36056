package org.yafin.config;

import java.util.Locale;

/**
 * Container formats a normalized image may be written in.
 */
public enum OutputFormat {
    TIF("tif", "tiff"),
    PNG("png", "png"),
    JPG("jpg", "jpeg"),
    JPEG("jpeg", "jpeg");

    private final String extension;
    private final String imageIoName;

    OutputFormat(String extension, String imageIoName) {
        this.extension = extension;
        this.imageIoName = imageIoName;
    }

    /**
     * File extension without the dot.
     */
    public String extension() {
        return extension;
    }

    /**
     * Informal format name understood by {@code javax.imageio.ImageIO}.
     */
    public String imageIoName() {
        return imageIoName;
    }

    /**
     * Parses a configured format name. Case-insensitive; {@code tiff} is an alias of {@code tif}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Output format is missing");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace("tiff", "tif");
        for (OutputFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output image format: " + name);
    }
}
