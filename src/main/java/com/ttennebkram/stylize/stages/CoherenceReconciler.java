package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;

/**
 * Makes sure a bounded composed image exists before refinement.
 *
 * Picks the best available image (composed, then material, then effect, then
 * the working image), replaces NaN with 0, +Inf with 1 and -Inf with 0,
 * clamps to [0,1], and optionally smooths high-frequency artifacts.
 */
public class CoherenceReconciler extends StageBase {

    private static final Logger log = LoggerFactory.getLogger(CoherenceReconciler.class);

    public static final String NAME = "coherence";

    private final double smoothing;

    public CoherenceReconciler(Configuration configuration) {
        super(NAME, StageKind.RECONCILE, configuration, Configuration.SECTION_TEMPORAL,
                EnumSet.of(ArtifactKey.COMPOSED_IMAGE, ArtifactKey.MATERIAL_DIFFUSE,
                        ArtifactKey.EFFECT_IMAGE, ArtifactKey.WORKING_IMAGE),
                EnumSet.of(ArtifactKey.COMPOSED_IMAGE, ArtifactKey.FINAL_IMAGE));
        this.smoothing = config.getDouble("smoothing", 0.0);
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat candidate = store.resolveImage(image, ArtifactKey.COMPOSED_IMAGE,
                ArtifactKey.MATERIAL_DIFFUSE, ArtifactKey.EFFECT_IMAGE);
        if (candidate.type() == CvType.CV_8UC3) {
            candidate = MatUtils.toWorking(candidate);
        }
        if (MatUtils.hasNonFinite(candidate)) {
            log.warn("Non-finite values in composed image, sanitizing");
        }
        Mat reconciled = MatUtils.sanitizeUnit(candidate);

        if (smoothing > 0) {
            Mat blurred = new Mat();
            Imgproc.GaussianBlur(reconciled, blurred, new Size(3, 3), 0);
            Mat mixed = MatUtils.blend(blurred, reconciled, Math.min(1.0, smoothing));
            blurred.release();
            reconciled.release();
            reconciled = mixed;
        }

        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.COMPOSED_IMAGE, reconciled);
        delta.put(ArtifactKey.FINAL_IMAGE, reconciled);
        return delta;
    }
}
