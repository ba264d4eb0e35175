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
 * Sobel edge detection on the grayscale image.
 * Only interior pixels are written; the one-pixel frame stays transparent black.
 */
@FilterProcessorInfo(
    filterType = FilterType.EDGE_DETECTION,
    category = "Edges",
    description = "Sobel edge detection\nmagnitude = clamp(trunc(sqrt(gx^2 + gy^2))) on grayscale"
)
public class EdgeDetectionProcessor extends FilterProcessorBase {

    private static final int[][] SOBEL_X = {
        {-1, 0, 1},
        {-2, 0, 2},
        {-1, 0, 1}
    };

    private static final int[][] SOBEL_Y = {
        {-1, -2, -1},
        { 0,  0,  0},
        { 1,  2,  1}
    };

    @Override
    public RasterBuffer process(RasterBuffer input, FilterParameters params) {
        int width = input.getWidth();
        int height = input.getHeight();
        int stride = width * BYTES_PER_PIXEL;

        byte[] gray = GrayscaleProcessor.toGray(input.rawBytes());
        byte[] output = allocateLike(input);

        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int gx = 0, gy = 0;

                for (int ky = -1; ky <= 1; ky++) {
                    for (int kx = -1; kx <= 1; kx++) {
                        // All color channels are equal after grayscale; read blue
                        int value = gray[(y + ky) * stride + (x + kx) * BYTES_PER_PIXEL + BLUE] & 0xFF;
                        gx += value * SOBEL_X[ky + 1][kx + 1];
                        gy += value * SOBEL_Y[ky + 1][kx + 1];
                    }
                }

                byte edge = (byte) PixelOps.clampByte((int) Math.sqrt(gx * gx + gy * gy));
                int idx = y * stride + x * BYTES_PER_PIXEL;
                output[idx + BLUE] = edge;
                output[idx + GREEN] = edge;
                output[idx + RED] = edge;
                output[idx + ALPHA] = (byte) 255;
            }
        }
        return RasterBuffer.wrap(width, height, output);
    }
}
