package com.ttennebkram.imageeditor.processors;

/**
 * Integer pixel arithmetic shared by the filters.
 */
public final class PixelOps {

    private PixelOps() {
    }

    /**
     * Clamp to the 8-bit range.
     */
    public static int clampByte(int value) {
        if (value < 0) return 0;
        if (value > 255) return 255;
        return value;
    }

    /**
     * Unsigned value of a stored byte.
     */
    public static int unsigned(byte value) {
        return value & 0xFF;
    }

    /**
     * Luminosity gray level, trunc(0.299 R + 0.587 G + 0.114 B).
     * Computed in thousandths so the truncation is exact and gray input maps to itself.
     */
    public static int luminance(int red, int green, int blue) {
        return (299 * red + 587 * green + 114 * blue) / 1000;
    }

    /**
     * Brightness offset for a [-100, 100] slider value, trunc(b * 2.55).
     */
    public static int brightnessOffset(double brightness) {
        return (int) (brightness * 2.55);
    }

    /**
     * Contrast multiplier for a [-100, 100] slider value, never negative.
     */
    public static double contrastFactor(double contrast) {
        return Math.max(0.0, (100.0 + contrast) / 100.0);
    }
}
