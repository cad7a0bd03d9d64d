package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.FlowFields;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Locale;

/**
 * Layers the effect output over the working image.
 *
 * The top layer is the primary effect image when there is one, else the
 * material rendering. Material shows through the effect where the transition
 * map is high, the subject region is partially preserved, and a light streak
 * along the flow field ties the layers together.
 */
public class Compositor extends StageBase {

    private static final Logger log = LoggerFactory.getLogger(Compositor.class);

    public static final String NAME = "composition";

    public enum BlendMode {
        NORMAL, SCREEN, MULTIPLY, OVERLAY, SOFT_LIGHT;

        static BlendMode fromKey(String key) {
            for (BlendMode mode : values()) {
                if (mode.name().equalsIgnoreCase(key)) {
                    return mode;
                }
            }
            return null;
        }

        float apply(float base, float top) {
            switch (this) {
                case SCREEN:
                    return 1f - (1f - base) * (1f - top);
                case MULTIPLY:
                    return base * top;
                case OVERLAY:
                    return base < 0.5f ? 2f * base * top : 1f - 2f * (1f - base) * (1f - top);
                case SOFT_LIGHT:
                    return (1f - 2f * top) * base * base + 2f * top * base;
                default:
                    return top;
            }
        }
    }

    private final BlendMode blendMode;
    private final double effectOpacity;
    private final double materialOpacity;
    private final double facePreservation;
    private final double streakStrength;

    public Compositor(Configuration configuration) {
        super(NAME, StageKind.COMPOSE, configuration, Configuration.SECTION_COMPOSITION,
                EnumSet.of(ArtifactKey.WORKING_IMAGE, ArtifactKey.EFFECT_IMAGE, ArtifactKey.MATERIAL_DIFFUSE,
                        ArtifactKey.TRANSITION_MAP, ArtifactKey.FACE_MASK, ArtifactKey.FLOW_FIELD),
                EnumSet.of(ArtifactKey.COMPOSED_IMAGE));
        String mode = config.getString("blend_mode", "normal");
        BlendMode parsed = BlendMode.fromKey(mode);
        if (parsed == null) {
            log.warn("Unknown blend_mode '{}', using normal", mode);
            parsed = BlendMode.NORMAL;
        }
        this.blendMode = parsed;
        this.effectOpacity = config.getDouble("effect_opacity", 0.85);
        this.materialOpacity = config.getDouble("material_opacity", 0.35);
        this.facePreservation = config.getDouble("face_preservation", 0.3);
        this.streakStrength = config.getDouble("streak_strength", 0.15);
    }

    public BlendMode getBlendMode() {
        return blendMode;
    }

    @Override
    public ArtifactStore run(Mat image, ArtifactStore store) {
        Mat working = store.resolveImage(image);
        Mat top = store.resolveImage(image, ArtifactKey.EFFECT_IMAGE, ArtifactKey.MATERIAL_DIFFUSE);
        Mat material = store.getMat(ArtifactKey.MATERIAL_DIFFUSE);
        Mat transition = store.getMat(ArtifactKey.TRANSITION_MAP);
        Mat faceMask = store.getMat(ArtifactKey.FACE_MASK);
        if (!top.size().equals(working.size()) || top.type() != working.type()) {
            top = conform(top, working);
        }

        int rows = working.rows();
        int cols = working.cols();
        float[] base = MatUtils.readFloats(working);
        float[] layer = MatUtils.readFloats(top);
        float[] mat = (material != null && material != top) ? MatUtils.readFloats(material) : null;
        float[] trans = transition != null ? MatUtils.readFloats(transition) : null;
        float[] face = faceMask != null ? MatUtils.readFloats(faceMask) : null;

        float[] out = new float[base.length];
        for (int p = 0; p < rows * cols; p++) {
            float faceKeep = face != null ? (float) (face[p] * facePreservation) : 0f;
            float materialMix = (mat != null && trans != null) ? (float) (trans[p] * materialOpacity) : 0f;
            for (int c = 0; c < 3; c++) {
                int i = p * 3 + c;
                float t = layer[i];
                if (materialMix > 0f) {
                    t = t * (1f - materialMix) + mat[i] * materialMix;
                }
                float blended = blendMode.apply(base[i], t);
                float v = (float) (base[i] * (1.0 - effectOpacity) + blended * effectOpacity);
                v = v * (1f - faceKeep) + base[i] * faceKeep;
                out[i] = v;
            }
        }
        Mat composed = MatUtils.fromFloats(rows, cols, 3, out);

        Mat flow = store.getMat(ArtifactKey.FLOW_FIELD);
        if (flow != null && streakStrength > 0) {
            Mat streak = FlowFields.warp(composed, flow, 0.5);
            Mat mixed = MatUtils.blend(streak, composed, streakStrength);
            streak.release();
            composed.release();
            composed = mixed;
        }

        ArtifactStore delta = ArtifactStore.delta();
        delta.put(ArtifactKey.COMPOSED_IMAGE, composed);
        return delta;
    }

    // Plugin effects may return another size or depth
    private static Mat conform(Mat layer, Mat reference) {
        Mat resized = new Mat();
        Imgproc.resize(layer, resized, reference.size());
        if (resized.type() != reference.type()) {
            Mat converted = resized.type() == CvType.CV_8UC3 ? MatUtils.toWorking(resized) : new Mat();
            if (converted.empty()) {
                resized.convertTo(converted, reference.type());
            }
            resized.release();
            return converted;
        }
        return resized;
    }

    @Override
    public Mat visualize(ArtifactStore store) {
        Mat composed = store.getMat(ArtifactKey.COMPOSED_IMAGE);
        return composed == null ? null : MatUtils.toDisplay(composed);
    }

    @Override
    public String toString() {
        return super.toString() + "{" + blendMode.name().toLowerCase(Locale.ROOT) + "}";
    }
}
