package com.ttennebkram.imageeditor.model;

import java.util.List;
import java.util.Locale;

/**
 * The closed set of filters the engine knows how to apply.
 */
public enum FilterType {
    NONE("None", false),
    GRAYSCALE("Grayscale", false),
    BRIGHTNESS("Brightness", true),
    CONTRAST("Contrast", true),
    BRIGHTNESS_CONTRAST("BrightnessContrast", true),
    GAUSSIAN_BLUR("GaussianBlur", true),
    EDGE_DETECTION("EdgeDetection", false),
    SEPIA("Sepia", false);

    // Order of the filter picker in the editor
    private static final List<FilterType> SELECTABLE =
            List.of(NONE, GRAYSCALE, SEPIA, BRIGHTNESS_CONTRAST, GAUSSIAN_BLUR, EDGE_DETECTION);

    private final String displayName;
    private final boolean parametric;

    FilterType(String displayName, boolean parametric) {
        this.displayName = displayName;
        this.parametric = parametric;
    }

    /**
     * Name used in recipes and log lines, e.g. "GaussianBlur".
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether the filter reads anything from {@link FilterParameters}.
     * Only these are worth re-applying when a parameter changes.
     */
    public boolean isParametric() {
        return parametric;
    }

    public static List<FilterType> selectable() {
        return SELECTABLE;
    }

    /**
     * Parse either the enum constant name ("GAUSSIAN_BLUR") or the display name
     * ("GaussianBlur"), ignoring case.
     */
    public static FilterType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Filter name is null");
        }
        String trimmed = name.trim();
        for (FilterType type : values()) {
            if (type.name().equalsIgnoreCase(trimmed) || type.displayName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        String compact = trimmed.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (FilterType type : values()) {
            if (type.displayName.toLowerCase(Locale.ROOT).equals(compact)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter: " + name);
    }
}
