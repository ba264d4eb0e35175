package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;

import static com.ttennebkram.imageeditor.model.RasterBuffer.ALPHA;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BLUE;
import static com.ttennebkram.imageeditor.model.RasterBuffer.BYTES_PER_PIXEL;
import static com.ttennebkram.imageeditor.model.RasterBuffer.GREEN;
import static com.ttennebkram.imageeditor.model.RasterBuffer.RED;

/**
 * Grayscale processor.
 * Luminosity method: weights follow the eye's sensitivity (green highest, blue lowest).
 */
@FilterProcessorInfo(
    filterType = FilterType.GRAYSCALE,
    category = "Color",
    description = "Grayscale (luminosity)\ngray = 0.299R + 0.587G + 0.114B"
)
public class GrayscaleProcessor extends FilterProcessorBase {

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        return RasterBuffer.wrap(input.getWidth(), input.getHeight(), toGray(input.rawBytes()));
    }

    /**
     * Grayscale copy of a BGRA array; alpha is kept.
     * Shared with {@link EdgeDetectionProcessor}.
     */
    static byte[] toGray(byte[] src) {
        byte[] out = new byte[src.length];
        for (int i = 0; i < src.length; i += BYTES_PER_PIXEL) {
            int gray = PixelOps.luminance(
                    PixelOps.unsigned(src[i + RED]),
                    PixelOps.unsigned(src[i + GREEN]),
                    PixelOps.unsigned(src[i + BLUE]));
            out[i + BLUE] = (byte) gray;
            out[i + GREEN] = (byte) gray;
            out[i + RED] = (byte) gray;
            out[i + ALPHA] = src[i + ALPHA];
        }
        return out;
    }
}
