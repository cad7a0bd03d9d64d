package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.TestImages;
import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.FlowFields;
import com.ttennebkram.stylize.util.MatUtils;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowGeneratorTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    private static Configuration flowConfig(Map<String, Object> flow) {
        return Configuration.builder()
                .stageSection(Configuration.SECTION_FLOW, ConfigSection.of(flow))
                .build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"liquid", "crystal", "radial", "none"})
    void run_producesFieldScaledToStrength(String type) {
        Mat image = TestImages.portrait(64, 48);
        FlowGenerator generator = new FlowGenerator(flowConfig(Map.of("flow_type", type, "strength", 5)));

        ArtifactStore delta = generator.run(image, ArtifactStore.forTransformation(new Random(3)));

        Mat field = delta.getMat(ArtifactKey.FLOW_FIELD);
        assertEquals(CvType.CV_32FC2, field.type());
        assertEquals(48, field.rows());
        assertEquals(64, field.cols());
        assertEquals(5.0, FlowFields.maxMagnitude(field), 1e-3);
        assertTrue(delta.contains(ArtifactKey.STRUCTURE_FLOW));
        assertTrue(delta.contains(ArtifactKey.EFFECT_FLOW));
    }

    @Test
    void run_isDeterministicForSeed() {
        Mat image = TestImages.portrait(40, 40);
        FlowGenerator generator = new FlowGenerator(Configuration.defaults());

        Mat a = generator.run(image, ArtifactStore.forTransformation(new Random(9))).getMat(ArtifactKey.FLOW_FIELD);
        Mat b = generator.run(image, ArtifactStore.forTransformation(new Random(9))).getMat(ArtifactKey.FLOW_FIELD);

        assertArrayEquals(MatUtils.readFloats(a), MatUtils.readFloats(b));
    }

    @Test
    void run_writesRequestedVariations() {
        FlowGenerator generator = new FlowGenerator(flowConfig(Map.of("variations", 3)));

        ArtifactStore delta = generator.run(TestImages.portrait(32, 32), ArtifactStore.forTransformation(new Random(1)));

        assertEquals(3, delta.get(ArtifactKey.FLOW_VARIATIONS, List.class).size());
    }

    @Test
    void visualize_rendersFlowField() {
        FlowGenerator generator = new FlowGenerator(Configuration.defaults());
        ArtifactStore store = ArtifactStore.forTransformation(new Random(1));
        store.merge(generator.run(TestImages.portrait(32, 24), store));

        Mat view = generator.visualize(store);

        assertEquals(CvType.CV_8UC3, view.type());
        assertEquals(24, view.rows());
    }
}
