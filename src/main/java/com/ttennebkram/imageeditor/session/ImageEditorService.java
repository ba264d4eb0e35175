package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.config.EditorSettings;
import com.ttennebkram.imageeditor.io.ImageFileException;
import com.ttennebkram.imageeditor.io.RasterImageIO;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import com.ttennebkram.imageeditor.model.RasterSnapshot;
import com.ttennebkram.imageeditor.serialization.EditRecipe;

import java.nio.file.Path;

/**
 * Entry point for embedding the editor: create sessions from raw pixels or files,
 * edit them, and write them back out.
 */
public class ImageEditorService {

    private final RasterImageIO imageIO;
    private final EditorSettings settings;

    public ImageEditorService() {
        this(new RasterImageIO(), EditorSettings.defaults());
    }

    public ImageEditorService(RasterImageIO imageIO, EditorSettings settings) {
        this.imageIO = imageIO;
        this.settings = settings;
    }

    public EditorSettings getSettings() {
        return settings;
    }

    /**
     * Start a session on a BGRA byte array. The array is copied.
     *
     * @throws com.ttennebkram.imageeditor.model.InvalidDimensionsException if the length does not match
     */
    public EditSession loadRaster(byte[] bytes, int width, int height) {
        EditSession session = new EditSession();
        session.load(new RasterBuffer(width, height, bytes));
        return session;
    }

    public EditSession openImage(Path path) throws ImageFileException {
        EditSession session = new EditSession();
        session.load(imageIO.read(path));
        settings.addRecentFile(path.toAbsolutePath().toString());
        return session;
    }

    /**
     * Filter with the configured default parameters.
     */
    public RasterSnapshot applyFilter(EditSession session, FilterType type) {
        return session.apply(type, settings.getDefaultParameters());
    }

    public RasterSnapshot applyFilter(EditSession session, FilterType type, FilterParameters params) {
        return session.apply(type, params);
    }

    public RasterSnapshot applyRecipe(EditSession session, EditRecipe recipe) {
        return session.applyRecipe(recipe);
    }

    public RasterSnapshot undo(EditSession session) {
        return session.undo();
    }

    public RasterSnapshot redo(EditSession session) {
        return session.redo();
    }

    public RasterSnapshot reset(EditSession session) {
        return session.reset();
    }

    /**
     * @throws NoCurrentImageException if nothing has been loaded
     */
    public RasterBuffer currentBuffer(EditSession session) {
        RasterBuffer current = session.getCurrent();
        if (current == null) {
            throw new NoCurrentImageException("read the current image");
        }
        return current;
    }

    /**
     * Write the current image and mark the session clean. The session is untouched if writing fails.
     */
    public void saveImage(EditSession session, Path path) throws ImageFileException {
        imageIO.write(currentBuffer(session), path, settings.getJpegQuality());
        session.markSaved();
        settings.addRecentFile(path.toAbsolutePath().toString());
    }
}
