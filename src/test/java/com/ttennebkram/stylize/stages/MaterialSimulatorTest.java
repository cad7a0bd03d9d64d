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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaterialSimulatorTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    private static MaterialSimulator simulator(String type) {
        return new MaterialSimulator(Configuration.builder()
                .stageSection(Configuration.SECTION_MATERIAL, ConfigSection.of(Map.of("material_type", type)))
                .build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"default", "liquid", "crystalline", "fabric", "particle"})
    void run_rendersBoundedDiffuse(String type) {
        Mat image = TestImages.portrait(48, 40);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(2));
        store.merge(new FlowGenerator(Configuration.defaults()).run(image, store));

        ArtifactStore delta = simulator(type).run(image, store);

        assertEquals(type, delta.getString(ArtifactKey.MATERIAL_TYPE));
        Mat diffuse = delta.getMat(ArtifactKey.MATERIAL_DIFFUSE);
        assertEquals(CvType.CV_32FC3, diffuse.type());
        assertEquals(40, diffuse.rows());
        for (float v : MatUtils.readFloats(diffuse)) {
            assertTrue(v >= 0f && v <= 1f);
        }
        assertEquals(CvType.CV_32FC1, delta.getMat(ArtifactKey.TRANSITION_MAP).type());
    }

    @Test
    void unknownType_fallsBackToDefault() {
        assertEquals(MaterialSimulator.DEFAULT, simulator("velvet").getMaterialType());
        assertFalse(MaterialSimulator.isKnownType("velvet"));
    }

    @Test
    void run_withoutFlowGivesEmptyTransitionMap() {
        ArtifactStore delta = simulator("liquid").run(TestImages.portrait(16, 16),
                ArtifactStore.forTransformation(new Random(1)));

        for (float v : MatUtils.readFloats(delta.getMat(ArtifactKey.TRANSITION_MAP))) {
            assertEquals(0f, v);
        }
    }
}
