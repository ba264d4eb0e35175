package com.ttennebkram.imageeditor.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BLUE;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;
import static com.ttennebkram.imageeditor.model.RasterBuffer.GREEN;
import static com.ttennebkram.imageeditor.model.RasterBuffer.RED;

/**
 * Gaussian Blur processor.
 * Approximates a Gaussian with repeated separable box blurs; three passes are close enough
 * to the bell shape for a preview-grade blur.
 */
@FilterProcessorInfo(
    filterType = FilterType.GAUSSIAN_BLUR,
    category = "Blur",
    description = "Gaussian blur (approximate)\n3 x separable box blur, window 2r+1, edge-clamped"
)
public class GaussianBlurProcessor extends FilterProcessorBase {

    static final int PASSES = 3;

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        int radius = params.getBlurRadius();
        if (radius <= 0) {
            return input.copy();
        }

        int width = input.getWidth();
        int height = input.getHeight();
        byte[] pixels = input.rawBytes();
        for (int pass = 0; pass < PASSES; pass++) {
            pixels = boxBlur(pixels, width, height, radius);
        }
        return RasterBuffer.wrap(width, height, pixels);
    }

    /**
     * One horizontal pass followed by one vertical pass. Only in-bounds samples are averaged,
     * so edge pixels divide by fewer than 2r+1.
     */
    static byte[] boxBlur(byte[] pixels, int width, int height, int radius) {
        byte[] horizontal = blurLine(pixels, width, height, radius, true);
        return blurLine(horizontal, width, height, radius, false);
    }

    private static byte[] blurLine(byte[] pixels, int width, int height, int radius, boolean horizontal) {
        byte[] result = new byte[pixels.length];
        int stride = width * BYTES_PER_PIXEL;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sumB = 0, sumG = 0, sumR = 0, count = 0;

                for (int d = -radius; d <= radius; d++) {
                    int nx = horizontal ? x + d : x;
                    int ny = horizontal ? y : y + d;
                    if (nx < 0 || nx >= width || ny < 0 || ny >= height) {
                        continue;
                    }
                    int idx = ny * stride + nx * BYTES_PER_PIXEL;
                    sumB += pixels[idx + BLUE] & 0xFF;
                    sumG += pixels[idx + GREEN] & 0xFF;
                    sumR += pixels[idx + RED] & 0xFF;
                    count++;
                }

                int resultIdx = y * stride + x * BYTES_PER_PIXEL;
                result[resultIdx + BLUE] = (byte) (sumB / count);
                result[resultIdx + GREEN] = (byte) (sumG / count);
                result[resultIdx + RED] = (byte) (sumR / count);
                result[resultIdx + ALPHA] = pixels[resultIdx + ALPHA];
            }
        }
        return result;
    }

    @Override
    public void serializeProperties(FilterParameters params, JsonObject json) {
        json.addProperty("blurRadius", params.getBlurRadius());
    }

    @Override
    public FilterParameters deserializeProperties(JsonObject json, FilterParameters base) {
        // Accept the short "radius" key used on the command line
        int radius = getJsonInt(json, "radius", base.getBlurRadius());
        return base.withBlurRadius(getJsonInt(json, "blurRadius", radius));
    }
}
