package com.ttennebkram.stylize.state;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.List;

/**
 * Well-known artifacts produced and consumed by pipeline stages.
 * Each key declares the value type the store accepts for it.
 */
public enum ArtifactKey {
    /** 8-bit RGB copy of the input. */
    ORIGINAL_IMAGE("original_image", Mat.class),
    /** Input converted to CV_32FC3 [0,1]. */
    WORKING_IMAGE("working_image", Mat.class),
    VARIATION_SEED("variation_seed", Long.class),

    FACE_BBOX("face_bbox", Rect.class),
    /** CV_32FC1 soft mask, 1 inside the subject region. */
    FACE_MASK("face_mask", Mat.class),
    EDGE_MAP("edge_map", Mat.class),
    DEPTH_MAP("depth_map", Mat.class),
    /** List of org.opencv.core.Point feature locations. */
    LANDMARKS("landmarks", List.class),

    /** CV_32FC2 per-pixel (dx, dy). */
    STRUCTURE_FLOW("structure_flow", Mat.class),
    EFFECT_FLOW("effect_flow", Mat.class),
    FLOW_FIELD("flow_field", Mat.class),
    FLOW_VARIATIONS("flow_variations", List.class),

    MATERIAL_TYPE("material_type", String.class),
    MATERIAL_DIFFUSE("material_diffuse", Mat.class),
    TRANSITION_MAP("transition_map", Mat.class),

    EFFECT_IMAGE("effect_image", Mat.class),
    PRIMARY_EFFECT_NAME("primary_effect_name", String.class),

    COMPOSED_IMAGE("composed_image", Mat.class),
    REFINED_IMAGE("refined_image", Mat.class),
    FINAL_IMAGE("final_image", Mat.class);

    private final String key;
    private final Class<?> valueType;

    ArtifactKey(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    public String key() {
        return key;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Look up a well-known key by its string form.
     *
     * @return the key, or null for plugin-defined names
     */
    public static ArtifactKey fromKey(String key) {
        for (ArtifactKey k : values()) {
            if (k.key.equals(key)) {
                return k;
            }
        }
        return null;
    }
}
