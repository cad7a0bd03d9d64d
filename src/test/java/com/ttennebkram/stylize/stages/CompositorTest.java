package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.TestImages;
import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompositorTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    private static Compositor compositor(Map<String, Object> section) {
        return new Compositor(Configuration.builder()
                .stageSection(Configuration.SECTION_COMPOSITION, ConfigSection.of(section))
                .build());
    }

    @Test
    void blendModes_matchTheirFormulas() {
        assertEquals(0.75f, Compositor.BlendMode.SCREEN.apply(0.5f, 0.5f), 1e-6f);
        assertEquals(0.25f, Compositor.BlendMode.MULTIPLY.apply(0.5f, 0.5f), 1e-6f);
        assertEquals(0.08f, Compositor.BlendMode.OVERLAY.apply(0.2f, 0.2f), 1e-6f);
        assertEquals(0.3f, Compositor.BlendMode.NORMAL.apply(0.9f, 0.3f), 1e-6f);
    }

    @Test
    void unknownBlendMode_fallsBackToNormal() {
        assertEquals(Compositor.BlendMode.NORMAL, compositor(Map.of("blend_mode", "dissolve")).getBlendMode());
        assertEquals(Compositor.BlendMode.SOFT_LIGHT, compositor(Map.of("blend_mode", "soft_light")).getBlendMode());
    }

    @Test
    void run_layersEffectAtConfiguredOpacity() {
        Mat image = TestImages.solid(8, 8, 0, 0, 0);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        store.put(ArtifactKey.EFFECT_IMAGE, new Mat(8, 8, CvType.CV_32FC3, new Scalar(1, 1, 1)));
        Compositor compositor = compositor(Map.of("effect_opacity", 0.5, "streak_strength", 0.0));

        Mat composed = compositor.run(image, store).getMat(ArtifactKey.COMPOSED_IMAGE);

        for (float v : MatUtils.readFloats(composed)) {
            assertEquals(0.5f, v, 1e-5f);
        }
    }

    @Test
    void run_preservesFaceRegion() {
        Mat image = TestImages.solid(4, 4, 0, 0, 0);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        store.put(ArtifactKey.EFFECT_IMAGE, new Mat(4, 4, CvType.CV_32FC3, new Scalar(1, 1, 1)));
        store.put(ArtifactKey.FACE_MASK, new Mat(4, 4, CvType.CV_32FC1, new Scalar(1)));
        Compositor compositor = compositor(Map.of("effect_opacity", 1.0, "face_preservation", 1.0,
                "streak_strength", 0.0));

        Mat composed = compositor.run(image, store).getMat(ArtifactKey.COMPOSED_IMAGE);

        for (float v : MatUtils.readFloats(composed)) {
            assertEquals(0f, v, 1e-6f);
        }
    }

    @Test
    void run_conformsMismatchedEffectLayer() {
        Mat image = TestImages.portrait(20, 10);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        store.put(ArtifactKey.EFFECT_IMAGE, TestImages.solid(7, 5, 255, 255, 255));

        Mat composed = compositor(Map.of()).run(image, store).getMat(ArtifactKey.COMPOSED_IMAGE);

        assertEquals(10, composed.rows());
        assertEquals(20, composed.cols());
        assertEquals(CvType.CV_32FC3, composed.type());
    }
}
