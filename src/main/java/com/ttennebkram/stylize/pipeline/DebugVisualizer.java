package com.ttennebkram.stylize.pipeline;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * Debug renderings for inspecting a transformation.
 */
public final class DebugVisualizer {

    private static final Scalar LABEL_COLOR = new Scalar(255, 255, 255);
    private static final Scalar LABEL_SHADOW = new Scalar(0, 0, 0);

    private DebugVisualizer() {
    }

    /**
     * Original and processed images next to each other, labelled.
     * Both must be CV_8UC3; the processed image is resized to the original's height if needed.
     */
    public static Mat sideBySide(Mat original, Mat processed) {
        if (original.type() != CvType.CV_8UC3 || processed.type() != CvType.CV_8UC3) {
            throw new IllegalArgumentException("sideBySide expects two CV_8UC3 images");
        }
        Mat left = original.clone();
        Mat right;
        if (processed.rows() != original.rows()) {
            double scale = original.rows() / (double) processed.rows();
            right = new Mat();
            Imgproc.resize(processed, right, new Size(Math.max(1, processed.cols() * scale), original.rows()));
        } else {
            right = processed.clone();
        }
        label(left, "Original");
        label(right, "Processed");

        Mat combined = new Mat();
        Core.hconcat(Arrays.asList(left, right), combined);
        left.release();
        right.release();
        return combined;
    }

    private static void label(Mat image, String text) {
        double scale = Math.max(0.4, image.cols() / 600.0);
        int thickness = Math.max(1, (int) Math.round(scale * 2));
        Point origin = new Point(10, 10 + 25 * scale);
        Imgproc.putText(image, text, new Point(origin.x + 1, origin.y + 1),
                Imgproc.FONT_HERSHEY_SIMPLEX, scale, LABEL_SHADOW, thickness + 1);
        Imgproc.putText(image, text, origin, Imgproc.FONT_HERSHEY_SIMPLEX, scale, LABEL_COLOR, thickness);
    }
}
