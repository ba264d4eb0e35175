package com.ttennebkram.imageeditor.config;

import com.ttennebkram.imageeditor.model.FilterParameters;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;
import java.util.logging.Logger;

/**
 * User settings for the editor: JPEG quality, starting filter parameters and the recent files list.
 * Persisted in the user preferences node of this package.
 *
 * Settings read from a preferences node remember it: recent-file changes are written back
 * immediately and {@link #save()} writes everything. {@link #defaults()} has no backing node.
 */
public class EditorSettings {

    private static final Logger logger = Logger.getLogger(EditorSettings.class.getName());

    public static final int DEFAULT_JPEG_QUALITY = 95;
    public static final int MAX_RECENT_FILES = 10;

    static final String JPEG_QUALITY_KEY = "jpegQuality";
    static final String BRIGHTNESS_KEY = "brightness";
    static final String CONTRAST_KEY = "contrast";
    static final String BLUR_RADIUS_KEY = "blurRadius";
    static final String RECENT_FILES_KEY = "recentFiles";
    static final String LAST_FILE_KEY = "lastFile";

    private int jpegQuality = DEFAULT_JPEG_QUALITY;
    private FilterParameters defaultParameters = FilterParameters.defaults();
    private final List<String> recentFiles = new ArrayList<>();
    private String lastFile;
    private final Preferences store;

    private EditorSettings(Preferences store) {
        this.store = store;
    }

    /**
     * Built-in settings; touches no preferences store.
     */
    public static EditorSettings defaults() {
        return new EditorSettings(null);
    }

    public static EditorSettings load() {
        return fromPreferences(Preferences.userNodeForPackage(EditorSettings.class));
    }

    public static EditorSettings fromPreferences(Preferences prefs) {
        EditorSettings settings = new EditorSettings(prefs);
        settings.setJpegQuality(prefs.getInt(JPEG_QUALITY_KEY, DEFAULT_JPEG_QUALITY));

        FilterParameters defaults = FilterParameters.defaults();
        settings.defaultParameters = new FilterParameters(
                prefs.getDouble(BRIGHTNESS_KEY, defaults.getBrightness()),
                prefs.getDouble(CONTRAST_KEY, defaults.getContrast()),
                prefs.getInt(BLUR_RADIUS_KEY, defaults.getBlurRadius()));

        settings.lastFile = prefs.get(LAST_FILE_KEY, null);

        // Drop entries whose files have since disappeared
        String files = prefs.get(RECENT_FILES_KEY, "");
        if (files != null && !files.isEmpty()) {
            for (String file : files.split("\n")) {
                if (!file.isEmpty() && new File(file).exists()
                        && settings.recentFiles.size() < MAX_RECENT_FILES) {
                    settings.recentFiles.add(file);
                }
            }
        }
        return settings;
    }

    /**
     * Write every setting back to the node these settings were loaded from.
     * No-op for {@link #defaults()}.
     */
    public void save() {
        if (store != null) {
            saveTo(store);
        }
    }

    public void saveTo(Preferences prefs) {
        prefs.putInt(JPEG_QUALITY_KEY, jpegQuality);
        prefs.putDouble(BRIGHTNESS_KEY, defaultParameters.getBrightness());
        prefs.putDouble(CONTRAST_KEY, defaultParameters.getContrast());
        prefs.putInt(BLUR_RADIUS_KEY, defaultParameters.getBlurRadius());
        putRecentFiles(prefs);
        flush(prefs);
    }

    private void putRecentFiles(Preferences prefs) {
        if (lastFile != null) {
            prefs.put(LAST_FILE_KEY, lastFile);
        }
        prefs.put(RECENT_FILES_KEY, String.join("\n", recentFiles));
    }

    private static void flush(Preferences prefs) {
        try {
            prefs.flush();
        } catch (BackingStoreException e) {
            logger.warning("Could not flush preferences: " + e.getMessage());
        }
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    /**
     * Values outside 1..100 are clamped.
     */
    public void setJpegQuality(int quality) {
        this.jpegQuality = Math.max(1, Math.min(100, quality));
    }

    public FilterParameters getDefaultParameters() {
        return defaultParameters;
    }

    public void setDefaultParameters(FilterParameters parameters) {
        this.defaultParameters = parameters != null ? parameters : FilterParameters.defaults();
    }

    public String getLastFile() {
        return lastFile;
    }

    /**
     * Most recently used first.
     */
    public List<String> getRecentFiles() {
        return Collections.unmodifiableList(recentFiles);
    }

    /**
     * Move (or add) a path to the front of the recent list and remember it as the last file.
     */
    public void addRecentFile(String path) {
        recentFiles.remove(path);
        recentFiles.add(0, path);
        while (recentFiles.size() > MAX_RECENT_FILES) {
            recentFiles.remove(recentFiles.size() - 1);
        }
        lastFile = path;
        saveRecentFiles();
    }

    public void clearRecentFiles() {
        recentFiles.clear();
        saveRecentFiles();
    }

    private void saveRecentFiles() {
        if (store != null) {
            putRecentFiles(store);
            flush(store);
        }
    }
}
