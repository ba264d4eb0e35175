package com.ttennebkram.imageeditor.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output encodings, chosen from the file extension. Anything unrecognized is written as PNG.
 */
public enum ImageFormat {
    PNG(true),
    JPEG(false),
    BMP(false);

    private final boolean keepsAlpha;

    ImageFormat(boolean keepsAlpha) {
        this.keepsAlpha = keepsAlpha;
    }

    public boolean keepsAlpha() {
        return keepsAlpha;
    }

    public static ImageFormat forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return JPEG;
        }
        if (name.endsWith(".bmp")) {
            return BMP;
        }
        return PNG;
    }
}
