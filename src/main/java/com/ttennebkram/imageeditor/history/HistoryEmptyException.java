package com.ttennebkram.imageeditor.history;

import com.ttennebkram.imageeditor.model.ImageEditException;

/**
 * Thrown when undo or redo is requested with nothing on the corresponding stack.
 */
public class HistoryEmptyException extends ImageEditException {

    public HistoryEmptyException(String stackName) {
        super("Nothing to " + stackName);
    }
}
