package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Abstract base class for the built-in effects.
 *
 * Resolves the working image, calls {@link #render(Mat, ArtifactStore)} and
 * publishes the result as {@link ArtifactKey#EFFECT_IMAGE}. Parameters come
 * from the effect's own configuration section; {@code intensity} is shared
 * by every effect.
 */
public abstract class EffectBase implements Effect {

    protected final ConfigSection config;
    protected final double intensity;

    private final String name;
    private final String category;
    private final String description;

    protected EffectBase(ConfigSection config) {
        this.config = config != null ? config : ConfigSection.EMPTY;
        EffectInfo info = getClass().getAnnotation(EffectInfo.class);
        this.name = info != null ? info.name() : getClass().getSimpleName();
        this.category = info != null ? info.category() : "";
        this.description = info != null ? info.description() : "";
        this.intensity = MatUtils.clamp01((float) this.config.getDouble("intensity", 0.75));
    }

    @Override
    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public ConfigSection getConfig() {
        return config;
    }

    @Override
    public ArtifactStore apply(Mat image, ArtifactStore state) {
        Mat working = state.resolveImage(image);
        Mat rendered = render(working, state);
        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.EFFECT_IMAGE, rendered);
        return delta;
    }

    /**
     * Produce the effect image.
     *
     * @param working CV_32FC3 working image (do not modify)
     * @param state   store for auxiliary artifacts and the run's random generator
     * @return a new CV_32FC3 image of the same size
     */
    protected abstract Mat render(Mat working, ArtifactStore state);

    @Override
    public Mat visualize(ArtifactStore state) {
        Mat effect = state.getMat(ArtifactKey.EFFECT_IMAGE);
        return effect == null ? null : MatUtils.toDisplay(effect);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
