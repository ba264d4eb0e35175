package com.ttennebkram.imageeditor.analysis;

import com.ttennebkram.imageeditor.model.ImageHistogram;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.ttennebkram.imageeditor.model.RasterBuffer.BLUE;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;
import static com.ttennebkram.imageeditor.model.RasterBuffer.GREEN;
import static com.ttennebkram.imageeditor.model.RasterBuffer.RED;

/**
 * Counts how often each intensity occurs in the red, green and blue channels.
 * Alpha is ignored.
 */
public final class HistogramCalculator {

    private static final Logger logger = Logger.getLogger(HistogramCalculator.class.getName());

    private HistogramCalculator() {
    }

    public static ImageHistogram compute(RasterBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("No buffer to compute a histogram for");
        }
        int[] red = new int[ImageHistogram.BINS];
        int[] green = new int[ImageHistogram.BINS];
        int[] blue = new int[ImageHistogram.BINS];

        byte[] pixels = buffer.rawBytes();
        for (int i = 0; i < pixels.length; i += BYTES_PER_PIXEL) {
            blue[pixels[i + BLUE] & 0xFF]++;
            green[pixels[i + GREEN] & 0xFF]++;
            red[pixels[i + RED] & 0xFF]++;
        }
        return new ImageHistogram(red, green, blue);
    }

    /**
     * Like {@link #compute} but a failure yields empty instead of propagating.
     * The histogram is informational; an edit never fails because of it.
     */
    public static Optional<ImageHistogram> tryCompute(RasterBuffer buffer) {
        try {
            return Optional.of(compute(buffer));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Histogram unavailable: " + e.getMessage(), e);
            return Optional.empty();
        }
    }
}
