package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

/**
 * Abstract base class for filter processors.
 * Provides metadata from {@link FilterProcessorInfo} and JSON helper methods.
 */
public abstract class FilterProcessorBase implements FilterProcessor {

    private final FilterProcessorInfo info;

    protected FilterProcessorBase() {
        info = getClass().getAnnotation(FilterProcessorInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @FilterProcessorInfo");
        }
    }

    @Override
    public FilterType getFilterType() {
        return info.filterType();
    }

    @Override
    public String getCategory() {
        return info.category();
    }

    @Override
    public String getDescription() {
        return info.description();
    }

    /**
     * Filters without parameters write nothing.
     */
    @Override
    public void serializeProperties(FilterParameters params, JsonObject json) {
    }

    @Override
    public FilterParameters deserializeProperties(JsonObject json, FilterParameters base) {
        return base;
    }

    /**
     * Fresh output array the same size as the input.
     */
    protected byte[] allocateLike(RasterBuffer input) {
        return new byte[input.getByteLength()];
    }

    /**
     * Helper to safely get an int from JSON.
     */
    protected int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a double from JSON.
     */
    protected double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsDouble();
        }
        return defaultValue;
    }
}
