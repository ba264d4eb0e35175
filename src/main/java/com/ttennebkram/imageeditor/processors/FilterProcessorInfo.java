package com.ttennebkram.imageeditor.processors;

import com.ttennebkram.imageeditor.model.FilterType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for FilterProcessor classes to declare their metadata.
 * {@link FilterProcessorBase} reads it so processors don't repeat the same getters.
 *
 * Example usage:
 * <pre>
 * {@literal @}FilterProcessorInfo(
 *     filterType = FilterType.SEPIA,
 *     category = "Color",
 *     description = "Sepia tone\nR' = 0.393R + 0.769G + 0.189B ..."
 * )
 * public class SepiaProcessor extends FilterProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FilterProcessorInfo {

    /**
     * The filter this class implements. Exactly one processor per type is registered.
     */
    FilterType filterType();

    /**
     * Category for grouping (e.g., "Tone", "Blur", "Edges").
     */
    String category();

    /**
     * Description/formula shown in tooltips and usage text.
     */
    String description() default "";
}
