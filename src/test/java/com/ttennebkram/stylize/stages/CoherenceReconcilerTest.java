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

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoherenceReconcilerTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    @Test
    void run_sanitizesNonFiniteComposedImage() {
        Mat image = TestImages.portrait(8, 8);
        float[] data = MatUtils.readFloats(MatUtils.toWorking(image));
        data[0] = Float.NaN;
        data[1] = Float.POSITIVE_INFINITY;
        data[2] = Float.NEGATIVE_INFINITY;
        data[3] = 4f;
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        store.put(ArtifactKey.COMPOSED_IMAGE, MatUtils.fromFloats(8, 8, 3, data));

        ArtifactStore delta = new CoherenceReconciler(Configuration.defaults()).run(image, store);

        Mat reconciled = delta.getMat(ArtifactKey.FINAL_IMAGE);
        assertFalse(MatUtils.hasNonFinite(reconciled));
        float[] out = MatUtils.readFloats(reconciled);
        assertEquals(0f, out[0]);
        assertEquals(1f, out[1]);
        assertEquals(0f, out[2]);
        assertEquals(1f, out[3]);
        for (float v : out) {
            assertTrue(v >= 0f && v <= 1f);
        }
        assertSame(reconciled, delta.getMat(ArtifactKey.COMPOSED_IMAGE));
    }

    @Test
    void run_fallsBackToMaterialThenWorkingImage() {
        Mat image = TestImages.portrait(8, 8);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        Mat material = MatUtils.fromFloats(8, 8, 3, new float[8 * 8 * 3]);
        store.put(ArtifactKey.MATERIAL_DIFFUSE, material);

        Mat fromMaterial = new CoherenceReconciler(Configuration.defaults()).run(image, store)
                .getMat(ArtifactKey.FINAL_IMAGE);
        assertEquals(0f, MatUtils.readFloats(fromMaterial)[10]);

        ArtifactStore empty = ArtifactStore.forTransformation(new Random(1));
        Mat fromWorking = new CoherenceReconciler(Configuration.defaults()).run(image, empty)
                .getMat(ArtifactKey.FINAL_IMAGE);
        assertEquals(CvType.CV_32FC3, fromWorking.type());
        assertEquals(MatUtils.readFloats(MatUtils.toWorking(image))[10], MatUtils.readFloats(fromWorking)[10], 1e-6f);
    }

    @Test
    void run_smoothingKeepsRange() {
        Configuration config = Configuration.builder()
                .stageSection(Configuration.SECTION_TEMPORAL, ConfigSection.of(Map.of("smoothing", 0.5)))
                .build();

        Mat out = new CoherenceReconciler(config).run(TestImages.portrait(16, 16),
                ArtifactStore.forTransformation(new Random(1))).getMat(ArtifactKey.FINAL_IMAGE);

        for (float v : MatUtils.readFloats(out)) {
            assertTrue(v >= 0f && v <= 1f);
        }
    }
}
