package com.ttennebkram.imageeditor.io;

import java.util.logging.Logger;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCvLoader {

    private static final Logger logger = Logger.getLogger(OpenCvLoader.class.getName());

    private static boolean loaded = false;

    private OpenCvLoader() {
    }

    public static synchronized void ensureLoaded() {
        if (loaded) return;
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        logger.fine("OpenCV " + org.opencv.core.Core.VERSION + " loaded");
    }

    /**
     * Load if possible and report whether it worked, instead of throwing.
     */
    public static boolean tryLoad() {
        try {
            ensureLoaded();
            return true;
        } catch (LinkageError | RuntimeException e) {
            logger.warning("OpenCV native library unavailable: " + e.getMessage());
            return false;
        }
    }
}
