package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.TestImages;
import com.ttennebkram.stylize.config.ColorScheme;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.config.EffectParameters;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AestheticRefinerTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    private static Mat refine(Configuration config, Mat image, long seed) {
        return new AestheticRefiner(config).run(image, ArtifactStore.forTransformation(new Random(seed)))
                .getMat(ArtifactKey.REFINED_IMAGE);
    }

    @Test
    void neutralSettings_leaveImageUnchanged() {
        Configuration config = Configuration.builder().colorScheme(ColorScheme.DEFAULT).build();
        Mat image = TestImages.portrait(16, 12);

        Mat refined = refine(config, image, 1);

        assertArrayEquals(MatUtils.readFloats(MatUtils.toWorking(image)), MatUtils.readFloats(refined), 1e-5f);
    }

    @Test
    void monochromeScheme_removesColor() {
        Configuration config = Configuration.builder().colorScheme(ColorScheme.MONOCHROME).build();

        float[] px = MatUtils.readFloats(refine(config, TestImages.portrait(8, 8), 1));

        for (int i = 0; i < px.length; i += 3) {
            assertEquals(px[i], px[i + 1], 1e-5f);
            assertEquals(px[i], px[i + 2], 1e-5f);
        }
    }

    @Test
    void invertAndSymmetry_applied() {
        Configuration config = Configuration.builder()
                .colorScheme(ColorScheme.DEFAULT)
                .effectParams(EffectParameters.builder().invert(true).symmetry(true).build())
                .build();
        Mat image = TestImages.solid(6, 2, 255, 0, 51);

        Mat refined = refine(config, image, 1);

        assertArrayEquals(new double[]{0.0, 1.0, 0.8}, refined.get(0, 0), 1e-5);
        assertArrayEquals(refined.get(1, 0), refined.get(1, 5), 1e-6);
    }

    @Test
    void grain_isSeededAndBounded() {
        Configuration config = Configuration.builder()
                .effectParams(EffectParameters.builder().grain(1.0).vignette(0.8).pixelation(4).build())
                .build();
        Mat image = TestImages.portrait(24, 24);

        float[] a = MatUtils.readFloats(refine(config, image, 5));
        float[] b = MatUtils.readFloats(refine(config, image, 5));

        assertArrayEquals(a, b);
        for (float v : a) {
            assertTrue(v >= 0f && v <= 1f);
        }
    }
}
