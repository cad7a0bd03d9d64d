package com.ttennebkram.stylize.effects;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Metadata for an effect class, read by the registry when it catalogs built-ins.
 *
 * Example usage:
 * <pre>
 * {@literal @}EffectInfo(
 *     name = "spectral_shift",
 *     category = "Color",
 *     description = "Separates the RGB channels along a direction"
 * )
 * public class SpectralShiftEffect extends EffectBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EffectInfo {

    /**
     * Registry name, e.g. "vertical_cascade".
     */
    String name();

    /**
     * Grouping used in listings, e.g. "Distortion" or "Glitch".
     */
    String category() default "";

    String description() default "";
}
