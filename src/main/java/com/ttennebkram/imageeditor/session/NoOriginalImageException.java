package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.model.ImageEditException;

/**
 * Thrown when reset is requested before any image was loaded.
 */
public class NoOriginalImageException extends ImageEditException {

    public NoOriginalImageException() {
        super("Cannot reset: no original image loaded");
    }
}
