package com.ttennebkram.stylize.util;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Operations on dense flow fields (CV_32FC2, per-pixel dx/dy in pixels).
 */
public final class FlowFields {

    private FlowFields() {
    }

    public static Mat zeros(int rows, int cols) {
        return Mat.zeros(rows, cols, CvType.CV_32FC2);
    }

    /**
     * Largest vector length in the field.
     */
    public static double maxMagnitude(Mat flow) {
        float[] data = MatUtils.readFloats(flow);
        double max = 0;
        for (int i = 0; i < data.length; i += 2) {
            double m = Math.hypot(data[i], data[i + 1]);
            if (m > max) {
                max = m;
            }
        }
        return max;
    }

    /**
     * Rescale so the longest vector has the given length. A zero field is returned unchanged.
     */
    public static Mat normalize(Mat flow, double targetMagnitude) {
        double max = maxMagnitude(flow);
        Mat out = new Mat();
        if (max < 1e-9) {
            flow.copyTo(out);
            return out;
        }
        flow.convertTo(out, CvType.CV_32FC2, targetMagnitude / max);
        return out;
    }

    /**
     * Weighted sum of two fields of the same shape.
     */
    public static Mat combine(Mat a, double weightA, Mat b, double weightB) {
        Mat out = new Mat();
        Core.addWeighted(a, weightA, b, weightB, 0.0, out);
        return out;
    }

    /**
     * Perturb a field with smooth seeded noise. Draws only from {@code random}.
     */
    public static Mat perturb(Mat flow, double strength, Random random) {
        int rows = flow.rows();
        int cols = flow.cols();
        float[] noise = new float[rows * cols * 2];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = (float) (random.nextGaussian() * strength);
        }
        Mat noiseMat = MatUtils.fromFloats(rows, cols, 2, noise);
        int k = MatUtils.oddKernel(Math.min(rows, cols) / 16);
        Imgproc.GaussianBlur(noiseMat, noiseMat, new Size(k, k), 0);
        Mat out = new Mat();
        Core.add(flow, noiseMat, out);
        noiseMat.release();
        return out;
    }

    /**
     * Sample {@code image} displaced along the field: out(x, y) = image(x + s*dx, y + s*dy).
     */
    public static Mat warp(Mat image, Mat flow, double scale) {
        int rows = image.rows();
        int cols = image.cols();
        float[] f = MatUtils.readFloats(flow);
        float[] mapX = new float[rows * cols];
        float[] mapY = new float[rows * cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int i = y * cols + x;
                mapX[i] = (float) (x + scale * f[i * 2]);
                mapY[i] = (float) (y + scale * f[i * 2 + 1]);
            }
        }
        Mat mx = MatUtils.fromFloats(rows, cols, 1, mapX);
        Mat my = MatUtils.fromFloats(rows, cols, 1, mapY);
        Mat out = new Mat();
        Imgproc.remap(image, out, mx, my, Imgproc.INTER_LINEAR, Core.BORDER_REFLECT, new Scalar(0, 0, 0));
        mx.release();
        my.release();
        return out;
    }

    /**
     * Per-pixel vector length as a CV_32FC1 map.
     */
    public static Mat magnitude(Mat flow) {
        List<Mat> parts = new ArrayList<>();
        Core.split(flow, parts);
        Mat mag = new Mat();
        Core.magnitude(parts.get(0), parts.get(1), mag);
        for (Mat p : parts) {
            p.release();
        }
        return mag;
    }

    /**
     * HSV rendering: hue encodes direction, value encodes magnitude. Returns CV_8UC3 RGB.
     */
    public static Mat visualize(Mat flow) {
        List<Mat> parts = new ArrayList<>();
        Core.split(flow, parts);
        Mat mag = new Mat();
        Mat angle = new Mat();
        Core.cartToPolar(parts.get(0), parts.get(1), mag, angle, true);

        Mat hue = new Mat();
        angle.convertTo(hue, CvType.CV_8UC1, 0.5);
        Mat value = new Mat();
        Core.normalize(mag, value, 0, 255, Core.NORM_MINMAX, CvType.CV_8UC1);
        Mat saturation = new Mat(flow.rows(), flow.cols(), CvType.CV_8UC1, new Scalar(255));

        Mat hsv = new Mat();
        List<Mat> channels = new ArrayList<>();
        channels.add(hue);
        channels.add(saturation);
        channels.add(value);
        Core.merge(channels, hsv);
        Mat rgb = new Mat();
        Imgproc.cvtColor(hsv, rgb, Imgproc.COLOR_HSV2RGB);

        for (Mat m : parts) {
            m.release();
        }
        mag.release();
        angle.release();
        hue.release();
        value.release();
        saturation.release();
        hsv.release();
        return rgb;
    }
}
