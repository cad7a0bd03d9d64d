package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.stages.Stage;
import com.ttennebkram.stylize.stages.StageKind;
import org.opencv.core.Mat;

import java.util.EnumSet;
import java.util.Set;

/**
 * A named, pluggable image transformation.
 *
 * Effects are stages of kind {@link StageKind#EFFECT}. Built-in effects and
 * plugin effects loaded from jars implement this interface; plugin classes
 * need a public constructor taking a {@link com.ttennebkram.stylize.config.ConfigSection}
 * or a public no-arg constructor.
 */
public interface Effect extends Stage {

    /**
     * Apply the effect.
     *
     * @param image the original input image (do not modify)
     * @param state the current artifact store (read only)
     * @return the keys produced, normally {@link ArtifactKey#EFFECT_IMAGE}
     */
    ArtifactStore apply(Mat image, ArtifactStore state);

    /**
     * Render the effect's output for inspection.
     *
     * @return an 8-bit RGB image, or null if the effect has not run
     */
    @Override
    Mat visualize(ArtifactStore state);

    @Override
    default StageKind getKind() {
        return StageKind.EFFECT;
    }

    @Override
    default Set<ArtifactKey> reads() {
        return EnumSet.of(ArtifactKey.WORKING_IMAGE);
    }

    @Override
    default Set<ArtifactKey> writes() {
        return EnumSet.of(ArtifactKey.EFFECT_IMAGE);
    }

    @Override
    default ArtifactStore run(Mat image, ArtifactStore store) {
        return apply(image, store);
    }
}
