package com.ttennebkram.stylize.config;

import com.ttennebkram.stylize.error.ConfigurationException;

/**
 * Color schemes applied by the aesthetic refinement stage.
 * Each scheme is a per-channel RGB tint plus a saturation multiplier.
 */
public enum ColorScheme {
    DEFAULT("default", 1.00, 1.00, 1.00, 1.00),
    LIGHT("light", 1.05, 1.05, 1.05, 0.90),
    DARK("dark", 0.85, 0.85, 0.90, 0.95),
    MONOCHROME("monochrome", 1.00, 1.00, 1.00, 0.00),
    HIGH_CONTRAST("high_contrast", 1.00, 1.00, 1.00, 1.20),
    MUTED("muted", 0.97, 0.97, 0.97, 0.60),
    VIBRANT("vibrant", 1.02, 1.00, 1.02, 1.45),
    NEON("neon", 1.10, 0.90, 1.15, 1.60),
    RETRO("retro", 1.08, 0.98, 0.82, 0.80),
    PHANTOM_CORE("phantom_core", 0.92, 0.96, 1.08, 0.85);

    private final String key;
    private final double red;
    private final double green;
    private final double blue;
    private final double saturation;

    ColorScheme(String key, double red, double green, double blue, double saturation) {
        this.key = key;
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.saturation = saturation;
    }

    public String getKey() {
        return key;
    }

    public double getRed() {
        return red;
    }

    public double getGreen() {
        return green;
    }

    public double getBlue() {
        return blue;
    }

    public double getSaturation() {
        return saturation;
    }

    public static ColorScheme fromKey(String key) {
        for (ColorScheme scheme : values()) {
            if (scheme.key.equalsIgnoreCase(key) || scheme.name().equalsIgnoreCase(key)) {
                return scheme;
            }
        }
        throw new ConfigurationException("Unknown color_scheme '" + key + "'");
    }
}
