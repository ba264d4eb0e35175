package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.analysis.HistogramCalculator;
import com.ttennebkram.imageeditor.history.HistoryEmptyException;
import com.ttennebkram.imageeditor.history.HistoryManager;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.ImageHistogram;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import com.ttennebkram.imageeditor.model.RasterSnapshot;
import com.ttennebkram.imageeditor.processors.FilterEngine;
import com.ttennebkram.imageeditor.serialization.EditRecipe;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Owns the editing state for one image: the original, the current buffer, the undo/redo
 * history and the dirty flag.
 *
 * Mutating methods are synchronized and each swaps in a complete replacement buffer, so a
 * reader on another thread sees either the old or the new image, never a partial one.
 * A call that fails leaves the session exactly as it was.
 */
public class EditSession {

    private static final Logger logger = Logger.getLogger(EditSession.class.getName());

    private final HistoryManager history;

    private volatile RasterBuffer original;
    private volatile RasterBuffer current;
    private volatile ImageHistogram currentHistogram;
    private volatile boolean dirty;
    private volatile boolean undoAvailable;
    private volatile boolean redoAvailable;
    private volatile EditSessionState state = EditSessionState.EMPTY;

    // Most recent apply, for re-running a parametric filter with new parameters
    private FilterType lastFilter;
    private FilterParameters lastParameters;

    public EditSession() {
        this(new HistoryManager());
    }

    public EditSession(HistoryManager history) {
        this.history = history;
    }

    /**
     * Start over with a new image. Both history stacks are dropped.
     */
    public synchronized RasterSnapshot load(RasterBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("Cannot load a null buffer");
        }
        original = buffer;
        history.clear();
        dirty = false;
        lastFilter = null;
        lastParameters = null;
        state = EditSessionState.LOADED;
        logger.info("Loaded " + buffer.getWidth() + "x" + buffer.getHeight() + " image");
        return commit(buffer.copy());
    }

    /**
     * Apply a filter to the current image as a new undoable edit. Clears the redo stack.
     */
    public synchronized RasterSnapshot apply(FilterType type, FilterParameters params) {
        RasterBuffer before = requireCurrent("apply a filter");
        FilterType effectiveType = type != null ? type : FilterType.NONE;
        FilterParameters effectiveParams = params != null ? params : FilterParameters.defaults();

        RasterBuffer result = FilterEngine.transform(before, effectiveType, effectiveParams);

        history.pushUndo(before);
        history.clearRedo();
        dirty = true;
        lastFilter = effectiveType;
        lastParameters = effectiveParams;
        state = EditSessionState.EDITED;
        logger.info("Applied " + effectiveType.getDisplayName() + " filter (undo depth " + history.undoDepth() + ")");
        return commit(result);
    }

    /**
     * Re-run the most recent parametric filter with new parameters, replacing its result
     * instead of stacking another edit. Used for live preview while a slider moves.
     *
     * @throws IllegalStateException if the last operation was not an apply of a parametric filter
     */
    public synchronized RasterSnapshot reapplyLast(FilterParameters params) {
        requireCurrent("preview a filter");
        if (state != EditSessionState.EDITED || lastFilter == null || !lastFilter.isParametric()) {
            throw new IllegalStateException("No adjustable filter to preview");
        }
        RasterBuffer base = history.peekUndo()
                .orElseThrow(() -> new IllegalStateException("No adjustable filter to preview"));
        FilterParameters effectiveParams = params != null ? params : FilterParameters.defaults();

        RasterBuffer result = FilterEngine.transform(base, lastFilter, effectiveParams);

        lastParameters = effectiveParams;
        dirty = true;
        logger.fine("Re-applied " + lastFilter.getDisplayName() + " with " + effectiveParams);
        return commit(result);
    }

    /**
     * Apply every step of a recipe, each as its own undoable edit.
     * If a step fails, the steps before it stay applied.
     */
    public synchronized RasterSnapshot applyRecipe(EditRecipe recipe) {
        requireCurrent("apply a recipe");
        RasterSnapshot snapshot = snapshot();
        for (EditRecipe.Step step : recipe.getSteps()) {
            snapshot = apply(step.getFilterType(), step.getParameters());
        }
        return snapshot;
    }

    /**
     * Step back one edit. Before any load the history is empty, so this fails with
     * {@link HistoryEmptyException} like any other empty-stack undo.
     */
    public synchronized RasterSnapshot undo() {
        if (!history.canUndo()) {
            throw new HistoryEmptyException("undo");
        }
        RasterBuffer before = current;
        history.pushRedo(before);
        RasterBuffer restored = history.popUndo();
        dirty = history.canUndo();
        lastFilter = null;
        state = EditSessionState.UNDONE;
        logger.info("Undo (undo depth " + history.undoDepth() + ", redo depth " + history.redoDepth() + ")");
        return commit(restored);
    }

    /**
     * Step forward again. The redo stack is not cleared, so a chain of undos can be replayed.
     */
    public synchronized RasterSnapshot redo() {
        if (!history.canRedo()) {
            throw new HistoryEmptyException("redo");
        }
        RasterBuffer before = current;
        history.pushUndo(before);
        RasterBuffer restored = history.popRedo();
        dirty = true;
        lastFilter = null;
        state = EditSessionState.REDONE;
        logger.info("Redo (undo depth " + history.undoDepth() + ", redo depth " + history.redoDepth() + ")");
        return commit(restored);
    }

    /**
     * Go back to the image as loaded. The pre-reset image stays reachable through undo.
     */
    public synchronized RasterSnapshot reset() {
        RasterBuffer originalBuffer = original;
        if (originalBuffer == null) {
            throw new NoOriginalImageException();
        }
        history.pushUndo(current);
        dirty = false;
        lastFilter = null;
        state = EditSessionState.LOADED;
        logger.info("Image reset to original");
        return commit(originalBuffer.copy());
    }

    /**
     * Record that the current image was written out. History is untouched.
     */
    public synchronized void markSaved() {
        requireCurrent("mark saved");
        dirty = false;
        state = EditSessionState.SAVED;
        logger.info("Current image marked as saved");
    }

    private RasterSnapshot commit(RasterBuffer next) {
        current = next;
        currentHistogram = HistogramCalculator.tryCompute(next).orElse(null);
        undoAvailable = history.canUndo();
        redoAvailable = history.canRedo();
        return snapshot();
    }

    private RasterBuffer requireCurrent(String operation) {
        RasterBuffer buffer = current;
        if (buffer == null) {
            throw new NoCurrentImageException(operation);
        }
        return buffer;
    }

    /**
     * Current state as a snapshot, without changing anything.
     */
    public RasterSnapshot snapshot() {
        return new RasterSnapshot(current, currentHistogram, undoAvailable, redoAvailable, dirty);
    }

    /**
     * The current image, or null before the first load.
     */
    public RasterBuffer getCurrent() {
        return current;
    }

    public RasterBuffer getOriginal() {
        return original;
    }

    public Optional<ImageHistogram> getCurrentHistogram() {
        return Optional.ofNullable(currentHistogram);
    }

    public boolean isLoaded() {
        return current != null;
    }

    public boolean isDirty() {
        return dirty;
    }

    public EditSessionState getState() {
        return state;
    }

    /**
     * Readable while another thread is applying a filter; reflects the last committed edit.
     */
    public boolean canUndo() {
        return undoAvailable;
    }

    public boolean canRedo() {
        return redoAvailable;
    }

    public synchronized int getUndoDepth() {
        return history.undoDepth();
    }

    public synchronized int getRedoDepth() {
        return history.redoDepth();
    }

    public synchronized Optional<FilterType> getLastFilter() {
        return Optional.ofNullable(lastFilter);
    }

    public synchronized Optional<FilterParameters> getLastParameters() {
        return Optional.ofNullable(lastParameters);
    }
}
