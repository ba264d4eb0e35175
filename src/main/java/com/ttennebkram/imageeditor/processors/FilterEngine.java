package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.InvalidDimensionsException;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stateless entry point for all pixel transforms.
 * Always returns a new buffer; the source is never modified.
 */
public final class FilterEngine {

    private static final Logger logger = Logger.getLogger(FilterEngine.class.getName());

    private FilterEngine() {
    }

    /**
     * Apply {@code type} to {@code source}.
     *
     * @param source The buffer to transform
     * @param type   Filter to apply; null behaves like {@link FilterType#NONE}
     * @param params Filter parameters; null means {@link FilterParameters#defaults()}
     * @return A new buffer with the same dimensions as {@code source}
     * @throws InvalidDimensionsException if {@code source} is null
     */
    public static RasterBuffer transform(RasterBuffer source, FilterType type, FilterParameters params) {
        if (source == null) {
            throw new InvalidDimensionsException(0, 0, 0);
        }
        FilterParameters effective = params != null ? params : FilterParameters.defaults();
        FilterProcessor processor = FilterProcessorRegistry.get(type);

        long start = System.nanoTime();
        RasterBuffer result = processor.process(source, effective);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("%s on %dx%d took %.2f ms",
                    processor.getFilterType().getDisplayName(), source.getWidth(), source.getHeight(),
                    (System.nanoTime() - start) / 1_000_000.0));
        }
        return result;
    }
}
