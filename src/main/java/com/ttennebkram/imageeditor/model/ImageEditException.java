package com.ttennebkram.imageeditor.model;

/**
 * Base class for all editing failures reported by the editor core.
 * Unchecked so callers can choose which conditions they check up front
 * (canUndo / canRedo) and which they let propagate.
 */
public class ImageEditException extends RuntimeException {

    public ImageEditException(String message) {
        super(message);
    }

    public ImageEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
