package com.ttennebkram.imageeditor.model;

import java.util.Optional;

/**
 * Result of a mutating session call: the new current buffer, its histogram if one
 * could be computed, and the history/dirty state right after the call.
 */
public final class RasterSnapshot {

    private final RasterBuffer buffer;
    private final ImageHistogram histogram;
    private final boolean canUndo;
    private final boolean canRedo;
    private final boolean dirty;

    public RasterSnapshot(RasterBuffer buffer, ImageHistogram histogram,
                          boolean canUndo, boolean canRedo, boolean dirty) {
        this.buffer = buffer;
        this.histogram = histogram;
        this.canUndo = canUndo;
        this.canRedo = canRedo;
        this.dirty = dirty;
    }

    public RasterBuffer getBuffer() {
        return buffer;
    }

    /**
     * Empty when the histogram computation failed; the edit itself still succeeded.
     */
    public Optional<ImageHistogram> getHistogram() {
        return Optional.ofNullable(histogram);
    }

    public boolean canUndo() {
        return canUndo;
    }

    public boolean canRedo() {
        return canRedo;
    }

    public boolean isDirty() {
        return dirty;
    }
}
