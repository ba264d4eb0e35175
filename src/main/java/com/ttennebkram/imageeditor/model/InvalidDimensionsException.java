package com.ttennebkram.imageeditor.model;

/**
 * Thrown when a pixel array does not hold exactly width * height * 4 bytes.
 */
public class InvalidDimensionsException extends ImageEditException {

    private final int width;
    private final int height;
    private final long actualLength;

    public InvalidDimensionsException(int width, int height, long actualLength) {
        super("Invalid raster dimensions " + width + "x" + height + ": expected "
                + RasterBuffer.expectedLength(width, height) + " bytes, got " + actualLength);
        this.width = width;
        this.height = height;
        this.actualLength = actualLength;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getActualLength() {
        return actualLength;
    }
}
