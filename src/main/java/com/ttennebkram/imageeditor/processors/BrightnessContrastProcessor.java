package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;

/**
 * Brightness and contrast in one pass.
 * Contrast and the brightness offset go into the same expression before a single truncation,
 * so results can differ by one level from running Contrast then Brightness.
 */
@FilterProcessorInfo(
    filterType = FilterType.BRIGHTNESS_CONTRAST,
    category = "Tone",
    description = "Brightness/Contrast\nc' = clamp(trunc(f * (c - 128) + 128 + trunc(b * 2.55)))"
)
public class BrightnessContrastProcessor extends FilterProcessorBase {

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        byte[] src = input.rawBytes();
        byte[] out = allocateLike(input);
        int adjustment = PixelOps.brightnessOffset(params.getBrightness());
        double factor = PixelOps.contrastFactor(params.getContrast());

        for (int i = 0; i < src.length; i += BYTES_PER_PIXEL) {
            for (int c = 0; c < 3; c++) {
                int value = PixelOps.unsigned(src[i + c]);
                out[i + c] = (byte) PixelOps.clampByte((int) (factor * (value - 128) + 128 + adjustment));
            }
            out[i + ALPHA] = src[i + ALPHA];
        }
        return RasterBuffer.wrap(input.getWidth(), input.getHeight(), out);
    }

    @Override
    public void serializeProperties(FilterParameters params, JsonObject json) {
        json.addProperty("brightness", params.getBrightness());
        json.addProperty("contrast", params.getContrast());
    }

    @Override
    public FilterParameters deserializeProperties(JsonObject json, FilterParameters base) {
        return base
                .withBrightness(getJsonDouble(json, "brightness", base.getBrightness()))
                .withContrast(getJsonDouble(json, "contrast", base.getContrast()));
    }
}
