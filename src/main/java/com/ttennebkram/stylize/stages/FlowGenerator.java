package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.FlowFields;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

/**
 * Builds the dense flow field that guides effect smearing and composition.
 *
 * Structure flow follows image contours (the gradient rotated by 90 degrees)
 * and bends around the depth map when analysis produced one. Effect flow is
 * a synthetic field chosen by {@code flow_type}: liquid, crystal, radial or
 * none. The two are mixed by weight and scaled to {@code strength} pixels.
 */
public class FlowGenerator extends StageBase {

    public static final String NAME = "flow_generation";

    private final String flowType;
    private final double strength;
    private final double structureWeight;
    private final double effectWeight;
    private final double depthWeight;
    private final int variationCount;
    private final double variationStrength;

    public FlowGenerator(Configuration configuration) {
        super(NAME, StageKind.GENERATE, configuration, Configuration.SECTION_FLOW,
                EnumSet.of(ArtifactKey.WORKING_IMAGE, ArtifactKey.DEPTH_MAP, ArtifactKey.FACE_MASK),
                EnumSet.of(ArtifactKey.STRUCTURE_FLOW, ArtifactKey.EFFECT_FLOW,
                        ArtifactKey.FLOW_FIELD, ArtifactKey.FLOW_VARIATIONS));
        this.flowType = config.getString("flow_type", "liquid");
        // distortion in [0,1] scales displacement by up to 2x
        this.strength = config.getDouble("strength", 8.0)
                * (1.0 + configuration.getEffectParams().getDistortion());
        this.structureWeight = config.getDouble("structure_weight", 0.6);
        this.effectWeight = config.getDouble("effect_weight", 0.4);
        this.depthWeight = config.getDouble("depth_weight", 0.5);
        this.variationCount = config.getInt("variations", 0);
        this.variationStrength = config.getDouble("variation_strength", 0.3);
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat working = store.resolveImage(image);
        Random random = store.random();

        Mat structure = structureFlow(working, store.getMat(ArtifactKey.DEPTH_MAP));
        Mat effect = effectFlow(working.rows(), working.cols(), structure, random);

        Mat mixed = FlowFields.combine(structure, structureWeight, effect, effectWeight);
        Mat field = FlowFields.normalize(mixed, strength);
        mixed.release();

        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.STRUCTURE_FLOW, structure);
        delta.put(ArtifactKey.EFFECT_FLOW, effect);
        delta.put(ArtifactKey.FLOW_FIELD, field);

        if (variationCount > 0) {
            List<Mat> variations = new ArrayList<>();
            for (int i = 0; i < variationCount; i++) {
                variations.add(FlowFields.perturb(field, strength * variationStrength, random));
            }
            delta.put(ArtifactKey.FLOW_VARIATIONS, variations);
        }
        return delta;
    }

    /**
     * Contour-following flow, normalized to unit maximum length.
     */
    Mat structureFlow(Mat working, Mat depth) {
        Mat gray = MatUtils.luminance(working);
        Imgproc.GaussianBlur(gray, gray, new Size(5, 5), 0);
        Mat gx = new Mat();
        Mat gy = new Mat();
        Imgproc.Sobel(gray, gx, CvType.CV_32F, 1, 0, 3);
        Imgproc.Sobel(gray, gy, CvType.CV_32F, 0, 1, 3);

        if (depth != null && !depth.empty() && depthWeight > 0) {
            Mat dx = new Mat();
            Mat dy = new Mat();
            Imgproc.Sobel(depth, dx, CvType.CV_32F, 1, 0, 3);
            Imgproc.Sobel(depth, dy, CvType.CV_32F, 0, 1, 3);
            Core.scaleAdd(dx, depthWeight, gx, gx);
            Core.scaleAdd(dy, depthWeight, gy, gy);
            dx.release();
            dy.release();
        }

        // Tangent to the gradient: (-gy, gx)
        Mat negGy = new Mat();
        Core.multiply(gy, new Scalar(-1.0), negGy);
        List<Mat> parts = new ArrayList<>();
        parts.add(negGy);
        parts.add(gx);
        Mat tangent = new Mat();
        Core.merge(parts, tangent);

        Mat result = FlowFields.normalize(tangent, 1.0);
        gray.release();
        gx.release();
        gy.release();
        negGy.release();
        tangent.release();
        return result;
    }

    /**
     * Synthetic flow for the configured type, unit maximum length.
     */
    Mat effectFlow(int rows, int cols, Mat structure, Random random) {
        float[] data = new float[rows * cols * 2];
        switch (flowType) {
            case "liquid": {
                double phaseX = random.nextDouble() * Math.PI * 2;
                double phaseY = random.nextDouble() * Math.PI * 2;
                double freq = 2 * Math.PI * config.getDouble("wave_frequency", 3.0) / Math.max(rows, cols);
                for (int y = 0; y < rows; y++) {
                    for (int x = 0; x < cols; x++) {
                        int i = (y * cols + x) * 2;
                        data[i] = (float) Math.sin(y * freq + phaseX);
                        data[i + 1] = (float) (0.5 * Math.cos(x * freq + phaseY));
                    }
                }
                break;
            }
            case "crystal": {
                // Snap structure directions to multiples of 60 degrees
                float[] s = MatUtils.readFloats(structure);
                double step = Math.PI / 3;
                for (int i = 0; i < data.length; i += 2) {
                    double mag = Math.hypot(s[i], s[i + 1]);
                    double angle = Math.round(Math.atan2(s[i + 1], s[i]) / step) * step;
                    data[i] = (float) (Math.cos(angle) * mag);
                    data[i + 1] = (float) (Math.sin(angle) * mag);
                }
                break;
            }
            case "radial": {
                double cx = cols / 2.0;
                double cy = rows / 2.0;
                for (int y = 0; y < rows; y++) {
                    for (int x = 0; x < cols; x++) {
                        int i = (y * cols + x) * 2;
                        data[i] = (float) (x - cx);
                        data[i + 1] = (float) (y - cy);
                    }
                }
                break;
            }
            default:
                // "none" and unknown types contribute nothing
                break;
        }
        Mat flow = MatUtils.fromFloats(rows, cols, 2, data);
        Mat normalized = FlowFields.normalize(flow, 1.0);
        flow.release();
        return normalized;
    }

    @Override
    public Mat visualize(ArtifactStore store) {
        Mat field = store.getMat(ArtifactKey.FLOW_FIELD);
        return field == null ? null : FlowFields.visualize(field);
    }
}
