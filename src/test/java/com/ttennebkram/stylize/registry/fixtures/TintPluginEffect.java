package com.ttennebkram.stylize.registry.fixtures;

import com.ttennebkram.stylize.effects.Effect;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Plugin-style effect packaged into jars at test time. Only has a no-arg constructor.
 */
public class TintPluginEffect implements Effect {

    public TintPluginEffect() {
    }

    @Override
    public String getName() {
        return "tint";
    }

    @Override
    public ArtifactStore apply(Mat image, ArtifactStore state) {
        Mat working = state.resolveImage(image);
        Mat tinted = new Mat();
        Core.multiply(working, new Scalar(1.0, 0.5, 0.5), tinted);
        return ArtifactStore.delta().put(ArtifactKey.EFFECT_IMAGE, tinted);
    }

    @Override
    public Mat visualize(ArtifactStore state) {
        Mat effect = state.getMat(ArtifactKey.EFFECT_IMAGE);
        return effect == null ? null : MatUtils.toDisplay(effect);
    }
}
