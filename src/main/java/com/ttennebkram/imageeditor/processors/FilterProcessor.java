package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

/**
 * A single pixel filter.
 * Each processor encapsulates:
 * - Processing logic (pure function of source buffer and parameters)
 * - Serialization of the parameters it reads (JSON)
 *
 * Processors are stateless and shared; {@link FilterProcessorRegistry} holds one per {@link FilterType}.
 */
public interface FilterProcessor {

    /**
     * The filter this processor implements.
     */
    FilterType getFilterType();

    /**
     * Category for grouping (e.g., "Tone", "Blur", "Edges").
     */
    String getCategory();

    /**
     * Short description with the formula, for tooltips and --help output.
     */
    String getDescription();

    /**
     * Apply the filter.
     *
     * @param input  The source buffer (never modified)
     * @param params Filter parameters; processors read only the fields they need
     * @return A new buffer of the same dimensions
     */
    RasterBuffer process(RasterBuffer input, FilterParameters params);

    /**
     * Write the parameter fields this filter reads into a recipe step.
     */
    void serializeProperties(FilterParameters params, JsonObject json);

    /**
     * Read this filter's parameter fields from a recipe step; missing fields keep the values in {@code base}.
     */
    FilterParameters deserializeProperties(JsonObject json, FilterParameters base);
}
