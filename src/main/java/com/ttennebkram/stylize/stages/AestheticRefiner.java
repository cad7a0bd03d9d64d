package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.ColorScheme;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.config.EffectParameters;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.EnumSet;
import java.util.Random;

/**
 * Final grading pass driven by the global effect parameters and color scheme.
 *
 * Order: pixelation, blur, per-pixel tone (brightness, contrast, saturation,
 * scheme tint, hue rotation, invert), edge overlay, vignette, grain and noise,
 * symmetry, clamp.
 */
public class AestheticRefiner extends StageBase {

    public static final String NAME = "aesthetic_refinement";

    private static final double SQRT_THIRD = Math.sqrt(1.0 / 3.0);

    private final EffectParameters params;
    private final ColorScheme scheme;
    private final double edgeDarkening;

    public AestheticRefiner(Configuration configuration) {
        super(NAME, StageKind.REFINE, configuration, Configuration.SECTION_AESTHETICS,
                EnumSet.of(ArtifactKey.COMPOSED_IMAGE, ArtifactKey.EDGE_MAP),
                EnumSet.of(ArtifactKey.REFINED_IMAGE, ArtifactKey.FINAL_IMAGE));
        this.params = configuration.getEffectParams();
        this.scheme = configuration.getColorScheme();
        this.edgeDarkening = config.getDouble("edge_darkening", 0.6);
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat source = store.resolveImage(image, ArtifactKey.COMPOSED_IMAGE);
        Mat graded = source.clone();

        if (params.getPixelation() > 0) {
            Mat pixelated = pixelate(graded, params.getPixelation());
            graded.release();
            graded = pixelated;
        }
        if (params.getBlurRadius() > 0) {
            Imgproc.GaussianBlur(graded, graded, new Size(0, 0), params.getBlurRadius());
        }

        int rows = graded.rows();
        int cols = graded.cols();
        float[] data = MatUtils.readFloats(graded);
        graded.release();

        Mat edgeMap = store.getMat(ArtifactKey.EDGE_MAP);
        float[] edges = (params.getEdgeDetection() > 0 && edgeMap != null
                && edgeMap.rows() == rows && edgeMap.cols() == cols) ? MatUtils.readFloats(edgeMap) : null;

        double theta = params.getHueShift() * Math.PI * 2;
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double m0 = cos + (1 - cos) / 3.0;
        double m1 = (1 - cos) / 3.0 - SQRT_THIRD * sin;
        double m2 = (1 - cos) / 3.0 + SQRT_THIRD * sin;

        double saturation = params.getSaturation() * scheme.getSaturation();
        double contrast = params.getContrast();
        double brightness = params.getBrightness();
        double cx = cols / 2.0;
        double cy = rows / 2.0;
        double maxDist = Math.hypot(cx, cy);
        double grainAmount = params.getGrain() * 0.15 + params.getNoiseLevel() * 0.1;
        Random random = store.random();

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int p = y * cols + x;
                int i = p * 3;
                double r = data[i] * brightness;
                double g = data[i + 1] * brightness;
                double b = data[i + 2] * brightness;

                r = (r - 0.5) * contrast + 0.5;
                g = (g - 0.5) * contrast + 0.5;
                b = (b - 0.5) * contrast + 0.5;

                double lum = 0.299 * r + 0.587 * g + 0.114 * b;
                r = lum + (r - lum) * saturation;
                g = lum + (g - lum) * saturation;
                b = lum + (b - lum) * saturation;

                r *= scheme.getRed();
                g *= scheme.getGreen();
                b *= scheme.getBlue();

                if (theta != 0) {
                    double nr = r * m0 + g * m1 + b * m2;
                    double ng = r * m2 + g * m0 + b * m1;
                    double nb = r * m1 + g * m2 + b * m0;
                    r = nr;
                    g = ng;
                    b = nb;
                }
                if (params.isInvert()) {
                    r = 1 - r;
                    g = 1 - g;
                    b = 1 - b;
                }
                if (edges != null) {
                    double k = 1 - edges[p] * params.getEdgeDetection() * edgeDarkening;
                    r *= k;
                    g *= k;
                    b *= k;
                }
                if (params.getVignette() > 0) {
                    double d = Math.hypot(x - cx, y - cy) / maxDist;
                    double k = 1 - params.getVignette() * d * d;
                    r *= k;
                    g *= k;
                    b *= k;
                }
                if (grainAmount > 0) {
                    double n = random.nextGaussian() * grainAmount;
                    r += n;
                    g += n;
                    b += n;
                }
                data[i] = MatUtils.clamp01((float) r);
                data[i + 1] = MatUtils.clamp01((float) g);
                data[i + 2] = MatUtils.clamp01((float) b);
            }
        }

        if (params.isSymmetry()) {
            mirrorLeftToRight(data, rows, cols);
        }

        Mat refined = MatUtils.fromFloats(rows, cols, 3, data);
        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.REFINED_IMAGE, refined);
        delta.put(ArtifactKey.FINAL_IMAGE, refined);
        return delta;
    }

    private static Mat pixelate(Mat image, int blockSize) {
        Mat small = new Mat();
        Size reduced = new Size(Math.max(1, image.cols() / blockSize), Math.max(1, image.rows() / blockSize));
        Imgproc.resize(image, small, reduced, 0, 0, Imgproc.INTER_AREA);
        Mat out = new Mat();
        Imgproc.resize(small, out, image.size(), 0, 0, Imgproc.INTER_NEAREST);
        small.release();
        return out;
    }

    private static void mirrorLeftToRight(float[] data, int rows, int cols) {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols / 2; x++) {
                int src = (y * cols + x) * 3;
                int dst = (y * cols + (cols - 1 - x)) * 3;
                data[dst] = data[src];
                data[dst + 1] = data[src + 1];
                data[dst + 2] = data[src + 2];
            }
        }
    }

    @Override
    public Mat visualize(ArtifactStore store) {
        Mat refined = store.getMat(ArtifactKey.REFINED_IMAGE);
        return refined == null ? null : MatUtils.toDisplay(refined);
    }
}
