package com.ttennebkram.imageeditor.history;

import com.ttennebkram.imageeditor.model.RasterBuffer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Undo and redo stacks of full raster snapshots.
 *
 * The undo stack keeps at most {@link #MAX_HISTORY_SIZE} entries; pushing beyond that drops
 * the oldest ones. The redo stack is unbounded but is cleared by every new edit, so it never
 * holds more than the undo stack once did.
 *
 * Every pushed buffer is copied, so entries never alias the caller's current buffer.
 * Not thread-safe; {@code EditSession} serializes access.
 */
public class HistoryManager {

    public static final int MAX_HISTORY_SIZE = 20;

    // Head of each deque is the top of the stack
    private final Deque<RasterBuffer> undoStack = new ArrayDeque<>();
    private final Deque<RasterBuffer> redoStack = new ArrayDeque<>();

    public void pushUndo(RasterBuffer buffer) {
        undoStack.push(buffer.copy());
        while (undoStack.size() > MAX_HISTORY_SIZE) {
            undoStack.removeLast();
        }
    }

    public void pushRedo(RasterBuffer buffer) {
        redoStack.push(buffer.copy());
    }

    public RasterBuffer popUndo() {
        if (undoStack.isEmpty()) {
            throw new HistoryEmptyException("undo");
        }
        return undoStack.pop();
    }

    public RasterBuffer popRedo() {
        if (redoStack.isEmpty()) {
            throw new HistoryEmptyException("redo");
        }
        return redoStack.pop();
    }

    public Optional<RasterBuffer> peekUndo() {
        return Optional.ofNullable(undoStack.peek());
    }

    public Optional<RasterBuffer> peekRedo() {
        return Optional.ofNullable(redoStack.peek());
    }

    public void clearRedo() {
        redoStack.clear();
    }

    /**
     * Drop both stacks, e.g. when a new image is loaded.
     */
    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }
}
