package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from {@link FilterType} to its processor.
 * Processors are stateless, so one shared instance per type is enough.
 *
 * Usage:
 *   FilterProcessor processor = FilterProcessorRegistry.get(FilterType.GAUSSIAN_BLUR);
 *   RasterBuffer output = processor.process(input, params);
 */
public final class FilterProcessorRegistry {

    private static final Map<FilterType, FilterProcessor> processors = new EnumMap<>(FilterType.class);

    static {
        List<FilterProcessor> all = List.of(
                new IdentityProcessor(),
                new GrayscaleProcessor(),
                new BrightnessProcessor(),
                new ContrastProcessor(),
                new BrightnessContrastProcessor(),
                new GaussianBlurProcessor(),
                new EdgeDetectionProcessor(),
                new SepiaProcessor());

        for (FilterProcessor processor : all) {
            FilterProcessor previous = processors.put(processor.getFilterType(), processor);
            if (previous != null) {
                throw new IllegalStateException("Two processors registered for " + processor.getFilterType()
                        + ": " + previous.getClass().getSimpleName() + " and " + processor.getClass().getSimpleName());
            }
        }
    }

    private FilterProcessorRegistry() {
    }

    /**
     * Processor for the given type. A null or unregistered type gets the identity processor.
     */
    public static FilterProcessor get(FilterType type) {
        if (type == null) {
            return processors.get(FilterType.NONE);
        }
        return processors.getOrDefault(type, processors.get(FilterType.NONE));
    }

    /**
     * Check if a processor exists for the given type.
     */
    public static boolean hasProcessor(FilterType type) {
        return type != null && processors.containsKey(type);
    }
}
