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
 * Sepia tone processor (standard warm-brown color matrix).
 */
@FilterProcessorInfo(
    filterType = FilterType.SEPIA,
    category = "Color",
    description = "Sepia\nR' = 0.393R + 0.769G + 0.189B\nG' = 0.349R + 0.686G + 0.168B\nB' = 0.272R + 0.534G + 0.131B"
)
public class SepiaProcessor extends FilterProcessorBase {

    // Matrix rows in thousandths: red, green, blue outputs; columns R, G, B inputs
    private static final int[][] MATRIX = {
        {393, 769, 189},
        {349, 686, 168},
        {272, 534, 131}
    };

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        byte[] src = input.rawBytes();
        byte[] out = allocateLike(input);

        for (int i = 0; i < src.length; i += BYTES_PER_PIXEL) {
            int red = PixelOps.unsigned(src[i + RED]);
            int green = PixelOps.unsigned(src[i + GREEN]);
            int blue = PixelOps.unsigned(src[i + BLUE]);

            out[i + RED] = (byte) PixelOps.clampByte(apply(MATRIX[0], red, green, blue));
            out[i + GREEN] = (byte) PixelOps.clampByte(apply(MATRIX[1], red, green, blue));
            out[i + BLUE] = (byte) PixelOps.clampByte(apply(MATRIX[2], red, green, blue));
            out[i + ALPHA] = src[i + ALPHA];
        }
        return RasterBuffer.wrap(input.getWidth(), input.getHeight(), out);
    }

    private static int apply(int[] row, int red, int green, int blue) {
        return (row[0] * red + row[1] * green + row[2] * blue) / 1000;
    }
}
