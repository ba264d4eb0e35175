package com.ttennebkram.imageeditor.model;

import java.util.Arrays;

/**
 * Fixed-format pixel storage: 4 bytes per pixel in (blue, green, red, alpha) order,
 * rows packed with no padding (stride = width * 4).
 *
 * Buffers are treated as values. The constructor takes a private copy of the caller's
 * array and {@link #getBytes()} hands out copies, so a buffer that has been pushed onto
 * the history can never be changed behind its back.
 */
public final class RasterBuffer {

    public static final int BYTES_PER_PIXEL = 4;

    public static final int BLUE = 0;
    public static final int GREEN = 1;
    public static final int RED = 2;
    public static final int ALPHA = 3;

    private final int width;
    private final int height;
    private final byte[] bytes;

    /**
     * Create a buffer from a BGRA byte array.
     *
     * @throws InvalidDimensionsException if the array length is not width * height * 4
     */
    public RasterBuffer(int width, int height, byte[] bytes) {
        this(width, height, bytes, true);
    }

    private RasterBuffer(int width, int height, byte[] bytes, boolean copy) {
        if (bytes == null) {
            throw new InvalidDimensionsException(width, height, 0);
        }
        if (width < 0 || height < 0 || bytes.length != expectedLength(width, height)) {
            throw new InvalidDimensionsException(width, height, bytes.length);
        }
        this.width = width;
        this.height = height;
        this.bytes = copy ? bytes.clone() : bytes;
    }

    /**
     * Wrap an array the caller promises never to touch again.
     * Only the transform engine uses this, for arrays it has just allocated.
     */
    public static RasterBuffer wrap(int width, int height, byte[] bytes) {
        return new RasterBuffer(width, height, bytes, false);
    }

    /**
     * All-zero (transparent black) buffer.
     */
    public static RasterBuffer blank(int width, int height) {
        long length = expectedLength(width, height);
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException(width, height, 0);
        }
        return new RasterBuffer(width, height, new byte[(int) length], false);
    }

    /**
     * Buffer with every pixel set to the same BGRA value.
     */
    public static RasterBuffer filled(int width, int height, int blue, int green, int red, int alpha) {
        RasterBuffer buffer = blank(width, height);
        byte[] data = buffer.bytes;
        for (int i = 0; i < data.length; i += BYTES_PER_PIXEL) {
            data[i + BLUE] = (byte) blue;
            data[i + GREEN] = (byte) green;
            data[i + RED] = (byte) red;
            data[i + ALPHA] = (byte) alpha;
        }
        return buffer;
    }

    /**
     * Expected byte length for the given dimensions, or -1 if either is negative.
     */
    public static long expectedLength(int width, int height) {
        if (width < 0 || height < 0) {
            return -1;
        }
        return (long) width * height * BYTES_PER_PIXEL;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getStride() {
        return width * BYTES_PER_PIXEL;
    }

    public int getPixelCount() {
        return width * height;
    }

    public int getByteLength() {
        return bytes.length;
    }

    /**
     * Copy of the pixel data.
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Direct view of the pixel data for read-only loops in the engine.
     * Callers must not write to the returned array.
     */
    public byte[] rawBytes() {
        return bytes;
    }

    /**
     * Unsigned value (0-255) of one channel of one pixel.
     */
    public int channel(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + width + "x" + height);
        }
        return bytes[y * getStride() + x * BYTES_PER_PIXEL + channel] & 0xFF;
    }

    public int alpha(int x, int y) {
        return channel(x, y, ALPHA);
    }

    /**
     * Full byte-for-byte clone; never shares storage with this buffer.
     */
    public RasterBuffer copy() {
        return new RasterBuffer(width, height, bytes, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterBuffer)) return false;
        RasterBuffer other = (RasterBuffer) o;
        return width == other.width && height == other.height && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        return 31 * result + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RasterBuffer[" + width + "x" + height + "]";
    }
}
