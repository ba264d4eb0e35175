package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;

/**
 * Brightness processor.
 * Adds a constant offset to every color channel; -100..100 maps to roughly -255..255.
 */
@FilterProcessorInfo(
    filterType = FilterType.BRIGHTNESS,
    category = "Tone",
    description = "Brightness\nc' = clamp(c + trunc(b * 2.55))"
)
public class BrightnessProcessor extends FilterProcessorBase {

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        byte[] src = input.rawBytes();
        byte[] out = allocateLike(input);
        int adjustment = PixelOps.brightnessOffset(params.getBrightness());

        for (int i = 0; i < src.length; i += BYTES_PER_PIXEL) {
            // B, G, R
            for (int c = 0; c < 3; c++) {
                out[i + c] = (byte) PixelOps.clampByte(PixelOps.unsigned(src[i + c]) + adjustment);
            }
            out[i + ALPHA] = src[i + ALPHA];
        }
        return RasterBuffer.wrap(input.getWidth(), input.getHeight(), out);
    }

    @Override
    public void serializeProperties(FilterParameters params, JsonObject json) {
        json.addProperty("brightness", params.getBrightness());
    }

    @Override
    public FilterParameters deserializeProperties(JsonObject json, FilterParameters base) {
        return base.withBrightness(getJsonDouble(json, "brightness", base.getBrightness()));
    }
}
