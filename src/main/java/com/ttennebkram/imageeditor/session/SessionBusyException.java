package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.model.ImageEditException;

/**
 * Thrown (via a failed future) when a mutating request arrives while another is still running.
 * Requests are rejected, never queued.
 */
public class SessionBusyException extends ImageEditException {

    public SessionBusyException(String operation) {
        super("Rejected " + operation + ": another operation is in progress");
    }
}
