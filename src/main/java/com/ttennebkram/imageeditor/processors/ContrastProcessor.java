package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;

/**
 * Contrast processor.
 * Scales each channel's distance from mid-gray (128). Factor below 1 flattens, above 1 stretches.
 */
@FilterProcessorInfo(
    filterType = FilterType.CONTRAST,
    category = "Tone",
    description = "Contrast\nc' = clamp(trunc(f * (c - 128) + 128)), f = max(0, (100 + k) / 100)"
)
public class ContrastProcessor extends FilterProcessorBase {

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        byte[] src = input.rawBytes();
        byte[] out = allocateLike(input);
        double factor = PixelOps.contrastFactor(params.getContrast());

        for (int i = 0; i < src.length; i += BYTES_PER_PIXEL) {
            for (int c = 0; c < 3; c++) {
                int value = PixelOps.unsigned(src[i + c]);
                out[i + c] = (byte) PixelOps.clampByte((int) (factor * (value - 128) + 128));
            }
            out[i + ALPHA] = src[i + ALPHA];
        }
        return RasterBuffer.wrap(input.getWidth(), input.getHeight(), out);
    }

    @Override
    public void serializeProperties(FilterParameters params, JsonObject json) {
        json.addProperty("contrast", params.getContrast());
    }

    @Override
    public FilterParameters deserializeProperties(JsonObject json, FilterParameters base) {
        return base.withContrast(getJsonDouble(json, "contrast", base.getContrast()));
    }
}
