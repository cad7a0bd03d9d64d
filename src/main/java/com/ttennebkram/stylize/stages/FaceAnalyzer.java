package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Portrait analysis stage.
 *
 * Locates the subject with a YCrCb skin-tone segmentation (falling back to a
 * centered portrait region), and derives a feathered subject mask, an edge
 * map, a pseudo depth map and a set of feature points inside the subject.
 */
public class FaceAnalyzer extends StageBase {

    public static final String NAME = "face_analysis";

    // Commonly used skin range in YCrCb
    private static final Scalar SKIN_LOW = new Scalar(0, 133, 77);
    private static final Scalar SKIN_HIGH = new Scalar(255, 173, 127);

    private final boolean detectSkin;
    private final double minSkinFraction;
    private final double cannyLow;
    private final double cannyHigh;
    private final int maxLandmarks;
    private final double feather;

    public FaceAnalyzer(Configuration configuration) {
        super(NAME, StageKind.ANALYZE, configuration, Configuration.SECTION_ANALYSIS,
                EnumSet.of(ArtifactKey.WORKING_IMAGE),
                EnumSet.of(ArtifactKey.FACE_BBOX, ArtifactKey.FACE_MASK, ArtifactKey.EDGE_MAP,
                        ArtifactKey.DEPTH_MAP, ArtifactKey.LANDMARKS));
        this.detectSkin = config.getBoolean("face_detection", true);
        this.minSkinFraction = config.getDouble("min_face_fraction", 0.02);
        this.cannyLow = config.getDouble("canny_low", 50.0);
        this.cannyHigh = config.getDouble("canny_high", 150.0);
        this.maxLandmarks = config.getInt("max_landmarks", 68);
        this.feather = config.getDouble("mask_feather", 0.15);
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat working = store.resolveImage(image);
        int width = working.cols();
        int height = working.rows();

        Mat rgb8 = new Mat();
        working.convertTo(rgb8, CvType.CV_8UC3, 255.0);
        Mat gray8 = new Mat();
        Imgproc.cvtColor(rgb8, gray8, Imgproc.COLOR_RGB2GRAY);

        Rect bbox = detectSkin ? detectSubject(rgb8) : null;
        if (bbox == null) {
            bbox = defaultPortraitRegion(width, height);
        }

        Mat hardMask = Mat.zeros(height, width, CvType.CV_8UC1);
        Imgproc.ellipse(hardMask, center(bbox), new Size(bbox.width / 2.0, bbox.height / 2.0),
                0, 0, 360, new Scalar(255), -1);

        Mat softMask = new Mat();
        int ksize = MatUtils.oddKernel((int) (Math.min(bbox.width, bbox.height) * feather));
        Imgproc.GaussianBlur(hardMask, softMask, new Size(ksize, ksize), 0);
        softMask.convertTo(softMask, CvType.CV_32FC1, 1.0 / 255.0);

        Mat edges8 = new Mat();
        Imgproc.Canny(gray8, edges8, cannyLow, cannyHigh);
        Mat edges = new Mat();
        edges8.convertTo(edges, CvType.CV_32FC1, 1.0 / 255.0);

        Mat depth = estimateDepth(gray8, softMask);
        List<Point> landmarks = findLandmarks(gray8, hardMask, bbox);

        rgb8.release();
        edges8.release();
        hardMask.release();

        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.FACE_BBOX, bbox);
        delta.put(ArtifactKey.FACE_MASK, softMask);
        delta.put(ArtifactKey.EDGE_MAP, edges);
        delta.put(ArtifactKey.DEPTH_MAP, depth);
        delta.put(ArtifactKey.LANDMARKS, landmarks);
        gray8.release();
        return delta;
    }

    /**
     * Largest skin-colored connected region, or null if too little skin is visible.
     */
    private Rect detectSubject(Mat rgb8) {
        Mat ycrcb = new Mat();
        Imgproc.cvtColor(rgb8, ycrcb, Imgproc.COLOR_RGB2YCrCb);
        Mat skin = new Mat();
        Core.inRange(ycrcb, SKIN_LOW, SKIN_HIGH, skin);
        ycrcb.release();

        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(5, 5));
        Imgproc.morphologyEx(skin, skin, Imgproc.MORPH_OPEN, kernel);

        double fraction = Core.countNonZero(skin) / (double) (skin.rows() * skin.cols());
        if (fraction < minSkinFraction) {
            skin.release();
            return null;
        }

        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = new Mat();
        Imgproc.findContours(skin, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
        hierarchy.release();
        skin.release();

        MatOfPoint largest = null;
        double largestArea = 0;
        for (MatOfPoint contour : contours) {
            double area = Imgproc.contourArea(contour);
            if (area > largestArea) {
                largestArea = area;
                largest = contour;
            }
        }
        if (largest == null) {
            return null;
        }
        Rect rect = Imgproc.boundingRect(largest);
        if (rect.width < 4 || rect.height < 4) {
            return null;
        }
        return rect;
    }

    static Rect defaultPortraitRegion(int width, int height) {
        int w = Math.max(1, (int) (width * 0.5));
        int h = Math.max(1, (int) (height * 0.65));
        return new Rect((width - w) / 2, (int) (height * 0.15), w, Math.min(h, height - (int) (height * 0.15)));
    }

    private Mat estimateDepth(Mat gray8, Mat softMask) {
        Mat gray = new Mat();
        gray8.convertTo(gray, CvType.CV_32FC1, 1.0 / 255.0);
        int ksize = MatUtils.oddKernel(Math.min(gray.rows(), gray.cols()) / 8);
        Imgproc.GaussianBlur(gray, gray, new Size(ksize, ksize), 0);

        Mat depth = new Mat();
        Core.addWeighted(gray, 0.4, softMask, 0.6, 0.0, depth);
        Core.normalize(depth, depth, 0.0, 1.0, Core.NORM_MINMAX);
        gray.release();
        return depth;
    }

    private List<Point> findLandmarks(Mat gray8, Mat mask, Rect bbox) {
        MatOfPoint corners = new MatOfPoint();
        double minDistance = Math.max(2.0, Math.min(bbox.width, bbox.height) / 12.0);
        Imgproc.goodFeaturesToTrack(gray8, corners, maxLandmarks, 0.01, minDistance, mask);
        List<Point> points = new ArrayList<>(corners.toList());
        corners.release();

        // Order around the subject center so the mesh outline is stable
        Point c = center(bbox);
        points.sort(Comparator.comparingDouble(p -> Math.atan2(p.y - c.y, p.x - c.x)));
        return points;
    }

    /**
     * Face mesh visualization: subject box, feature points and their outline.
     */
    @Override
    @SuppressWarnings("unchecked")
    public Mat visualize(ArtifactStore store) {
        Mat base = store.getMat(ArtifactKey.ORIGINAL_IMAGE);
        Rect bbox = store.get(ArtifactKey.FACE_BBOX, Rect.class);
        if (base == null || bbox == null) {
            return null;
        }
        Mat canvas = base.clone();
        Imgproc.rectangle(canvas, bbox.tl(), bbox.br(), new Scalar(0, 255, 0), 1);

        List<Point> landmarks = store.get(ArtifactKey.LANDMARKS, List.class);
        if (landmarks != null && !landmarks.isEmpty()) {
            for (int i = 0; i < landmarks.size(); i++) {
                Point p = landmarks.get(i);
                Point next = landmarks.get((i + 1) % landmarks.size());
                Imgproc.line(canvas, p, next, new Scalar(0, 180, 255), 1);
                Imgproc.circle(canvas, p, 2, new Scalar(255, 0, 0), -1);
            }
        }
        return canvas;
    }

    private static Point center(Rect r) {
        return new Point(r.x + r.width / 2.0, r.y + r.height / 2.0);
    }
}
