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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Random;

/**
 * Renders the working image as a physical material.
 *
 * Material types: default (edge-preserving smoothing), liquid (flow-warped),
 * crystalline (faceted), fabric (woven texture) and particle (scattered).
 * Also derives a transition map from the flow magnitude that the compositor
 * uses to decide where the material shows through.
 */
public class MaterialSimulator extends StageBase {

    private static final Logger log = LoggerFactory.getLogger(MaterialSimulator.class);

    public static final String NAME = "material_simulation";

    public static final String DEFAULT = "default";
    public static final String LIQUID = "liquid";
    public static final String CRYSTALLINE = "crystalline";
    public static final String FABRIC = "fabric";
    public static final String PARTICLE = "particle";

    private final String materialType;
    private final int facetSize;
    private final double weaveFrequency;
    private final double weaveAmplitude;
    private final int scatterRadius;

    public MaterialSimulator(Configuration configuration) {
        super(NAME, StageKind.SIMULATE, configuration, Configuration.SECTION_MATERIAL,
                EnumSet.of(ArtifactKey.WORKING_IMAGE, ArtifactKey.FLOW_FIELD),
                EnumSet.of(ArtifactKey.MATERIAL_TYPE, ArtifactKey.MATERIAL_DIFFUSE, ArtifactKey.TRANSITION_MAP));
        String type = config.getString("material_type", DEFAULT);
        if (!isKnownType(type)) {
            log.warn("Unknown material_type '{}', using '{}'", type, DEFAULT);
            type = DEFAULT;
        }
        this.materialType = type;
        this.facetSize = Math.max(2, config.getInt("facet_size", 12));
        this.weaveFrequency = config.getDouble("weave_frequency", 0.8);
        this.weaveAmplitude = config.getDouble("weave_amplitude", 0.08);
        this.scatterRadius = Math.max(1, config.getInt("scatter_radius", 3));
    }

    static boolean isKnownType(String type) {
        return DEFAULT.equals(type) || LIQUID.equals(type) || CRYSTALLINE.equals(type)
                || FABRIC.equals(type) || PARTICLE.equals(type);
    }

    public String getMaterialType() {
        return materialType;
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat working = store.resolveImage(image);
        Mat flow = store.getMat(ArtifactKey.FLOW_FIELD);

        Mat diffuse;
        switch (materialType) {
            case LIQUID:
                diffuse = liquid(working, flow);
                break;
            case CRYSTALLINE:
                diffuse = crystalline(working);
                break;
            case FABRIC:
                diffuse = fabric(working);
                break;
            case PARTICLE:
                diffuse = particle(working, store.random());
                break;
            default:
                diffuse = smooth(working);
                break;
        }
        MatUtils.clampUnit(diffuse);

        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.MATERIAL_TYPE, materialType);
        delta.put(ArtifactKey.MATERIAL_DIFFUSE, diffuse);
        delta.put(ArtifactKey.TRANSITION_MAP, transitionMap(working, flow));
        return delta;
    }

    private Mat smooth(Mat working) {
        Mat out = new Mat();
        Imgproc.bilateralFilter(working, out, 7, 0.1, 5.0);
        return out;
    }

    private Mat liquid(Mat working, Mat flow) {
        Mat base = smooth(working);
        if (flow == null) {
            return base;
        }
        Mat warped = FlowFields.warp(base, flow, 1.0);
        base.release();
        Imgproc.GaussianBlur(warped, warped, new Size(3, 3), 0);
        return warped;
    }

    private Mat crystalline(Mat working) {
        Mat small = new Mat();
        Size reduced = new Size(Math.max(1, working.cols() / facetSize), Math.max(1, working.rows() / facetSize));
        Imgproc.resize(working, small, reduced, 0, 0, Imgproc.INTER_AREA);
        Mat facets = new Mat();
        Imgproc.resize(small, facets, working.size(), 0, 0, Imgproc.INTER_NEAREST);
        small.release();

        // Facet edges catch the light
        Mat gray = MatUtils.luminance(facets);
        Mat lap = new Mat();
        Imgproc.Laplacian(gray, lap, CvType.CV_32F);
        Core.absdiff(lap, new Scalar(0), lap);
        Mat highlight = new Mat();
        Imgproc.cvtColor(lap, highlight, Imgproc.COLOR_GRAY2RGB);
        Core.scaleAdd(highlight, 0.5, facets, facets);
        gray.release();
        lap.release();
        highlight.release();
        return facets;
    }

    private Mat fabric(Mat working) {
        int rows = working.rows();
        int cols = working.cols();
        float[] data = MatUtils.readFloats(working);
        for (int y = 0; y < rows; y++) {
            double wy = Math.sin(y * weaveFrequency);
            for (int x = 0; x < cols; x++) {
                double weave = 1.0 + weaveAmplitude * (Math.sin(x * weaveFrequency) * 0.5 + wy * 0.5);
                int i = (y * cols + x) * 3;
                data[i] *= weave;
                data[i + 1] *= weave;
                data[i + 2] *= weave;
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, data);
    }

    private Mat particle(Mat working, Random random) {
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);
        float[] dst = new float[src.length];
        int span = scatterRadius * 2 + 1;
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int sx = MatUtils.clampIndex(x + random.nextInt(span) - scatterRadius, cols);
                int sy = MatUtils.clampIndex(y + random.nextInt(span) - scatterRadius, rows);
                int d = (y * cols + x) * 3;
                int s = (sy * cols + sx) * 3;
                dst[d] = src[s];
                dst[d + 1] = src[s + 1];
                dst[d + 2] = src[s + 2];
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, dst);
    }

    /**
     * CV_32FC1 map in [0,1]: high where the flow is strong.
     */
    private Mat transitionMap(Mat working, Mat flow) {
        if (flow == null) {
            return Mat.zeros(working.rows(), working.cols(), CvType.CV_32FC1);
        }
        Mat mag = FlowFields.magnitude(flow);
        Imgproc.GaussianBlur(mag, mag, new Size(9, 9), 0);
        Core.normalize(mag, mag, 0.0, 1.0, Core.NORM_MINMAX);
        return mag;
    }

    @Override
    public Mat visualize(ArtifactStore store) {
        Mat diffuse = store.getMat(ArtifactKey.MATERIAL_DIFFUSE);
        return diffuse == null ? null : MatUtils.toDisplay(diffuse);
    }
}
