package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

/**
 * Pass-through filter. Returns an independent copy of the input.
 */
@FilterProcessorInfo(
    filterType = FilterType.NONE,
    category = "Basic",
    description = "No filter\nReturns an unchanged copy"
)
public class IdentityProcessor extends FilterProcessorBase {

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        return input.copy();
    }
}
