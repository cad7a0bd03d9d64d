package com.ttennebkram.stylize.config;

import com.ttennebkram.stylize.error.ConfigurationException;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * Output file formats and their OpenCV encoder parameters.
 */
public enum OutputFormat {
    PNG("png", ".png"),
    JPEG("jpeg", ".jpg"),
    WEBP("webp", ".webp"),
    TIFF("tiff", ".tiff");

    private final String key;
    private final String extension;

    OutputFormat(String key, String extension) {
        this.key = key;
        this.extension = extension;
    }

    public String getKey() {
        return key;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Encoder parameters for Imgcodecs.imwrite.
     *
     * @param quality 1-100, mapped to each codec's own scale
     */
    public MatOfInt encoderParams(int quality) {
        switch (this) {
            case JPEG:
                return new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
            case WEBP:
                return new MatOfInt(Imgcodecs.IMWRITE_WEBP_QUALITY, quality);
            case PNG:
                // 0 = fastest/largest, 9 = smallest
                int compression = (int) Math.round((100 - quality) / 100.0 * 9);
                return new MatOfInt(Imgcodecs.IMWRITE_PNG_COMPRESSION, compression);
            default:
                return new MatOfInt();
        }
    }

    public static OutputFormat fromKey(String key) {
        for (OutputFormat format : values()) {
            if (format.key.equalsIgnoreCase(key) || format.name().equalsIgnoreCase(key)) {
                return format;
            }
        }
        if ("jpg".equalsIgnoreCase(key)) {
            return JPEG;
        }
        if ("tif".equalsIgnoreCase(key)) {
            return TIFF;
        }
        throw new ConfigurationException("Unknown output_format '" + key + "'");
    }
}
