package com.ttennebkram.stylize.config;

import com.ttennebkram.stylize.error.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Global tunable effect parameters. Immutable; build through {@link Builder}.
 * Every numeric field is range-checked in {@link Builder#build()}.
 */
public final class EffectParameters {

    private final double intensity;
    private final double blurRadius;
    private final double noiseLevel;
    private final double contrast;
    private final double brightness;
    private final double saturation;
    private final double hueShift;
    private final int pixelation;
    private final double edgeDetection;
    private final double distortion;
    private final double grain;
    private final double vignette;
    private final boolean symmetry;
    private final boolean invert;
    private final Long seed;

    private EffectParameters(Builder b) {
        this.intensity = b.intensity;
        this.blurRadius = b.blurRadius;
        this.noiseLevel = b.noiseLevel;
        this.contrast = b.contrast;
        this.brightness = b.brightness;
        this.saturation = b.saturation;
        this.hueShift = b.hueShift;
        this.pixelation = b.pixelation;
        this.edgeDetection = b.edgeDetection;
        this.distortion = b.distortion;
        this.grain = b.grain;
        this.vignette = b.vignette;
        this.symmetry = b.symmetry;
        this.invert = b.invert;
        this.seed = b.seed;
    }

    public static EffectParameters defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.intensity = intensity;
        b.blurRadius = blurRadius;
        b.noiseLevel = noiseLevel;
        b.contrast = contrast;
        b.brightness = brightness;
        b.saturation = saturation;
        b.hueShift = hueShift;
        b.pixelation = pixelation;
        b.edgeDetection = edgeDetection;
        b.distortion = distortion;
        b.grain = grain;
        b.vignette = vignette;
        b.symmetry = symmetry;
        b.invert = invert;
        b.seed = seed;
        return b;
    }

    public double getIntensity() { return intensity; }
    public double getBlurRadius() { return blurRadius; }
    public double getNoiseLevel() { return noiseLevel; }
    public double getContrast() { return contrast; }
    public double getBrightness() { return brightness; }
    public double getSaturation() { return saturation; }
    public double getHueShift() { return hueShift; }
    public int getPixelation() { return pixelation; }
    public double getEdgeDetection() { return edgeDetection; }
    public double getDistortion() { return distortion; }
    public double getGrain() { return grain; }
    public double getVignette() { return vignette; }
    public boolean isSymmetry() { return symmetry; }
    public boolean isInvert() { return invert; }
    public Long getSeed() { return seed; }

    /**
     * Serialize to a plain section (document key names).
     */
    public ConfigSection toSection() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("intensity", intensity);
        map.put("blur_radius", blurRadius);
        map.put("noise_level", noiseLevel);
        map.put("contrast", contrast);
        map.put("brightness", brightness);
        map.put("saturation", saturation);
        map.put("hue_shift", hueShift);
        map.put("pixelation", pixelation);
        map.put("edge_detection", edgeDetection);
        map.put("distortion", distortion);
        map.put("grain", grain);
        map.put("vignette", vignette);
        map.put("symmetry", symmetry);
        map.put("invert", invert);
        if (seed != null) {
            map.put("seed", seed);
        }
        return ConfigSection.of(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EffectParameters)) return false;
        return toSection().equals(((EffectParameters) o).toSection());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toSection());
    }

    public static final class Builder {
        private double intensity = 0.75;
        private double blurRadius = 0.0;
        private double noiseLevel = 0.0;
        private double contrast = 1.0;
        private double brightness = 1.0;
        private double saturation = 1.0;
        private double hueShift = 0.0;
        private int pixelation = 0;
        private double edgeDetection = 0.0;
        private double distortion = 0.0;
        private double grain = 0.0;
        private double vignette = 0.0;
        private boolean symmetry = false;
        private boolean invert = false;
        private Long seed = null;

        private Builder() {
        }

        public Builder intensity(double v) { this.intensity = v; return this; }
        public Builder blurRadius(double v) { this.blurRadius = v; return this; }
        public Builder noiseLevel(double v) { this.noiseLevel = v; return this; }
        public Builder contrast(double v) { this.contrast = v; return this; }
        public Builder brightness(double v) { this.brightness = v; return this; }
        public Builder saturation(double v) { this.saturation = v; return this; }
        public Builder hueShift(double v) { this.hueShift = v; return this; }
        public Builder pixelation(int v) { this.pixelation = v; return this; }
        public Builder edgeDetection(double v) { this.edgeDetection = v; return this; }
        public Builder distortion(double v) { this.distortion = v; return this; }
        public Builder grain(double v) { this.grain = v; return this; }
        public Builder vignette(double v) { this.vignette = v; return this; }
        public Builder symmetry(boolean v) { this.symmetry = v; return this; }
        public Builder invert(boolean v) { this.invert = v; return this; }
        public Builder seed(Long v) { this.seed = v; return this; }

        /**
         * Overlay values from a document section. Only keys present are changed.
         */
        public Builder apply(ConfigSection section) {
            Number n;
            if ((n = section.requireNumber("intensity")) != null) intensity = n.doubleValue();
            if ((n = section.requireNumber("blur_radius")) != null) blurRadius = n.doubleValue();
            if ((n = section.requireNumber("noise_level")) != null) noiseLevel = n.doubleValue();
            if ((n = section.requireNumber("contrast")) != null) contrast = n.doubleValue();
            if ((n = section.requireNumber("brightness")) != null) brightness = n.doubleValue();
            if ((n = section.requireNumber("saturation")) != null) saturation = n.doubleValue();
            if ((n = section.requireNumber("hue_shift")) != null) hueShift = n.doubleValue();
            Integer whole;
            if ((whole = section.requireInt("pixelation")) != null) pixelation = whole;
            if ((n = section.requireNumber("edge_detection")) != null) edgeDetection = n.doubleValue();
            if ((n = section.requireNumber("distortion")) != null) distortion = n.doubleValue();
            if ((n = section.requireNumber("grain")) != null) grain = n.doubleValue();
            if ((n = section.requireNumber("vignette")) != null) vignette = n.doubleValue();
            Long seedValue;
            if ((seedValue = section.requireLong("seed")) != null) seed = seedValue;
            Boolean b;
            if ((b = section.requireBoolean("symmetry")) != null) symmetry = b;
            if ((b = section.requireBoolean("invert")) != null) invert = b;
            return this;
        }

        public EffectParameters build() {
            checkRange("intensity", intensity, 0.0, 1.0);
            checkRange("blur_radius", blurRadius, 0.0, 50.0);
            checkRange("noise_level", noiseLevel, 0.0, 1.0);
            checkRange("contrast", contrast, 0.0, 3.0);
            checkRange("brightness", brightness, 0.0, 3.0);
            checkRange("saturation", saturation, 0.0, 3.0);
            checkRange("hue_shift", hueShift, 0.0, 1.0);
            checkRange("pixelation", pixelation, 0, 100);
            checkRange("edge_detection", edgeDetection, 0.0, 1.0);
            checkRange("distortion", distortion, 0.0, 1.0);
            checkRange("grain", grain, 0.0, 1.0);
            checkRange("vignette", vignette, 0.0, 1.0);
            return new EffectParameters(this);
        }
    }

    static void checkRange(String field, double value, double min, double max) {
        // NaN fails both comparisons, so test the accepted range positively
        if (!(value >= min && value <= max)) {
            throw new ConfigurationException(field + " must be in [" + min + ", " + max + "], got " + value);
        }
    }
}
