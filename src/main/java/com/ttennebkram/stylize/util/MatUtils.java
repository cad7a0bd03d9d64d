package com.ttennebkram.stylize.util;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Helpers for moving images between the 8-bit display range and the
 * normalized float working range used by every stage.
 *
 * Working images are CV_32FC3 RGB with values in [0,1].
 */
public final class MatUtils {

    private MatUtils() {
    }

    /**
     * Convert an RGB image to the working range.
     * Accepts CV_8UC3 (scaled by 1/255) or CV_32FC3 (copied as-is).
     *
     * @return a new CV_32FC3 Mat owned by the caller
     */
    public static Mat toWorking(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Image is null or empty");
        }
        if (image.type() == CvType.CV_8UC3) {
            Mat working = new Mat();
            image.convertTo(working, CvType.CV_32FC3, 1.0 / 255.0);
            return working;
        }
        if (image.type() == CvType.CV_32FC3) {
            return image.clone();
        }
        throw new IllegalArgumentException("Expected an H x W x 3 image (CV_8UC3 or CV_32FC3), got "
                + CvType.typeToString(image.type()));
    }

    /**
     * Convert a working image to 8-bit RGB. Non-finite values are sanitized first.
     */
    public static Mat toDisplay(Mat working) {
        if (working.type() == CvType.CV_8UC3) {
            return working.clone();
        }
        Mat safe = sanitizeUnit(working);
        Mat display = new Mat();
        safe.convertTo(display, CvType.CV_8UC3, 255.0);
        safe.release();
        return display;
    }

    /**
     * Read all values of a float Mat into a flat array (row-major, interleaved channels).
     */
    public static float[] readFloats(Mat mat) {
        Mat source = mat.isContinuous() ? mat : mat.clone();
        float[] data = new float[(int) (source.total() * source.channels())];
        source.get(0, 0, data);
        if (source != mat) {
            source.release();
        }
        return data;
    }

    /**
     * Create a float Mat of the given shape from a flat array.
     */
    public static Mat fromFloats(int rows, int cols, int channels, float[] data) {
        Mat mat = new Mat(rows, cols, CvType.makeType(CvType.CV_32F, channels));
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * True if any value in the Mat is NaN or infinite.
     */
    public static boolean hasNonFinite(Mat mat) {
        if (mat.depth() != CvType.CV_32F) {
            return false;
        }
        for (float v : readFloats(mat)) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Return a copy with NaN replaced by 0, +Inf by 1, -Inf by 0, and all
     * remaining values clamped to [0,1].
     */
    public static Mat sanitizeUnit(Mat mat) {
        Mat floatMat = mat;
        if (mat.depth() != CvType.CV_32F) {
            floatMat = new Mat();
            mat.convertTo(floatMat, CvType.makeType(CvType.CV_32F, mat.channels()));
        }
        float[] data = readFloats(floatMat);
        for (int i = 0; i < data.length; i++) {
            float v = data[i];
            if (Float.isNaN(v)) {
                data[i] = 0f;
            } else if (v == Float.POSITIVE_INFINITY) {
                data[i] = 1f;
            } else if (v == Float.NEGATIVE_INFINITY) {
                data[i] = 0f;
            } else if (v < 0f) {
                data[i] = 0f;
            } else if (v > 1f) {
                data[i] = 1f;
            }
        }
        Mat result = fromFloats(floatMat.rows(), floatMat.cols(), floatMat.channels(), data);
        if (floatMat != mat) {
            floatMat.release();
        }
        return result;
    }

    /**
     * Clamp a working image to [0,1] in place.
     */
    public static void clampUnit(Mat working) {
        float[] data = readFloats(working);
        for (int i = 0; i < data.length; i++) {
            data[i] = clamp01(data[i]);
        }
        working.put(0, 0, data);
    }

    /**
     * Single-channel float luminance of a working RGB image.
     */
    public static Mat luminance(Mat working) {
        Mat gray = new Mat();
        Imgproc.cvtColor(working, gray, Imgproc.COLOR_RGB2GRAY);
        return gray;
    }

    /**
     * Render a single-channel float map as an 8-bit RGB heat map for visualization.
     */
    public static Mat heatMap(Mat singleChannel) {
        Mat normalized = new Mat();
        Core.normalize(singleChannel, normalized, 0, 255, Core.NORM_MINMAX, CvType.CV_8UC1);
        Mat colored = new Mat();
        Imgproc.applyColorMap(normalized, colored, Imgproc.COLORMAP_INFERNO);
        Imgproc.cvtColor(colored, colored, Imgproc.COLOR_BGR2RGB);
        normalized.release();
        return colored;
    }

    /**
     * Linear blend: alpha * a + (1 - alpha) * b.
     */
    public static Mat blend(Mat a, Mat b, double alpha) {
        Mat out = new Mat();
        Core.addWeighted(a, alpha, b, 1.0 - alpha, 0.0, out);
        return out;
    }

    /**
     * Smallest odd kernel size that is at least {@code size} and at least 3.
     */
    public static int oddKernel(int size) {
        int k = Math.max(3, size);
        return (k % 2 == 0) ? k + 1 : k;
    }

    public static int clampIndex(int v, int max) {
        if (v < 0) return 0;
        if (v >= max) return max - 1;
        return v;
    }

    public static float clamp01(float v) {
        if (v < 0f) return 0f;
        if (v > 1f) return 1f;
        return v;
    }
}
