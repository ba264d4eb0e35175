package com.ttennebkram.imageeditor.io;

import java.io.IOException;

/**
 * Thrown when an image file cannot be decoded or written.
 */
public class ImageFileException extends IOException {

    public ImageFileException(String message) {
        super(message);
    }

    public ImageFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
