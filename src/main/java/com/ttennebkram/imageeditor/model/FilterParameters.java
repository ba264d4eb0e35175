package com.ttennebkram.imageeditor.model;

import java.util.Objects;

/**
 * Parameters shared by the adjustable filters.
 * Brightness and contrast nominally range over [-100, 100], blur radius over [1, 10].
 * Values outside those ranges are accepted; the filter formulas clamp their own output.
 */
public final class FilterParameters {

    public static final double DEFAULT_BRIGHTNESS = 0.0;
    public static final double DEFAULT_CONTRAST = 0.0;
    public static final int DEFAULT_BLUR_RADIUS = 3;

    private static final FilterParameters DEFAULTS =
            new FilterParameters(DEFAULT_BRIGHTNESS, DEFAULT_CONTRAST, DEFAULT_BLUR_RADIUS);

    private final double brightness;
    private final double contrast;
    private final int blurRadius;

    public FilterParameters(double brightness, double contrast, int blurRadius) {
        this.brightness = brightness;
        this.contrast = contrast;
        this.blurRadius = blurRadius;
    }

    public static FilterParameters defaults() {
        return DEFAULTS;
    }

    public double getBrightness() {
        return brightness;
    }

    public double getContrast() {
        return contrast;
    }

    public int getBlurRadius() {
        return blurRadius;
    }

    public FilterParameters withBrightness(double brightness) {
        return new FilterParameters(brightness, contrast, blurRadius);
    }

    public FilterParameters withContrast(double contrast) {
        return new FilterParameters(brightness, contrast, blurRadius);
    }

    public FilterParameters withBlurRadius(int blurRadius) {
        return new FilterParameters(brightness, contrast, blurRadius);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterParameters)) return false;
        FilterParameters that = (FilterParameters) o;
        return Double.compare(that.brightness, brightness) == 0
                && Double.compare(that.contrast, contrast) == 0
                && blurRadius == that.blurRadius;
    }

    @Override
    public int hashCode() {
        return Objects.hash(brightness, contrast, blurRadius);
    }

    @Override
    public String toString() {
        return "FilterParameters[brightness=" + brightness + ", contrast=" + contrast
                + ", blurRadius=" + blurRadius + "]";
    }
}
