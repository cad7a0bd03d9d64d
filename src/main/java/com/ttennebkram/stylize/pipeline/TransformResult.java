package com.ttennebkram.stylize.pipeline;

import com.ttennebkram.stylize.state.ArtifactStore;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one transformation: the final 8-bit RGB image plus, when
 * requested, the intermediate visualizations and the artifact store.
 */
public class TransformResult {

    private final Mat image;
    private final Map<String, Mat> intermediates;
    private final ArtifactStore store;
    private final long seed;
    private final List<String> failedStages;

    TransformResult(Mat image, Map<String, Mat> intermediates, ArtifactStore store,
                    long seed, List<String> failedStages) {
        this.image = image;
        this.intermediates = Collections.unmodifiableMap(new LinkedHashMap<>(intermediates));
        this.store = store;
        this.seed = seed;
        this.failedStages = Collections.unmodifiableList(failedStages);
    }

    /**
     * CV_8UC3 RGB image with the input's height and width.
     */
    public Mat getImage() {
        return image;
    }

    /**
     * Visualizations by name ("face_mesh", "depth_map", ...). Empty unless requested.
     */
    public Map<String, Mat> getIntermediates() {
        return intermediates;
    }

    public Mat getIntermediate(String name) {
        return intermediates.get(name);
    }

    /**
     * The run's artifact store, or null unless intermediates were requested.
     */
    public ArtifactStore getStore() {
        return store;
    }

    /**
     * The seed that drove this run, whether supplied or drawn.
     */
    public long getSeed() {
        return seed;
    }

    public List<String> getFailedStages() {
        return failedStages;
    }

    public boolean hasFailures() {
        return !failedStages.isEmpty();
    }

    /**
     * Release the native memory of the image and intermediates.
     */
    public void release() {
        image.release();
        for (Mat mat : intermediates.values()) {
            mat.release();
        }
    }
}
