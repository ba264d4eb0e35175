package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.model.ImageEditException;

/**
 * Thrown when an edit is attempted before any image was loaded.
 */
public class NoCurrentImageException extends ImageEditException {

    public NoCurrentImageException(String operation) {
        super("Cannot " + operation + ": no image loaded");
    }
}
