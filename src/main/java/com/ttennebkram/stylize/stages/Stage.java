package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import org.opencv.core.Mat;

import java.util.Set;

/**
 * One step of the transformation pipeline.
 *
 * A stage reads artifacts from the store, computes new ones, and returns them
 * as a delta; the pipeline merges the delta. Stages keep no state between runs
 * other than the configuration they were built with.
 */
public interface Stage {

    /**
     * Stable stage name, used for logging and for the {@code <name>_failed} sentinel.
     */
    String getName();

    StageKind getKind();

    /**
     * Artifacts this stage consumes when present.
     */
    Set<ArtifactKey> reads();

    /**
     * Artifacts this stage may produce.
     */
    Set<ArtifactKey> writes();

    /**
     * Run the stage.
     *
     * Recoverable problems should not throw; leave the dependent keys absent
     * instead. Any exception that does escape is contained by the pipeline.
     *
     * @param image the original input image (do not modify)
     * @param store the current store (read only)
     * @return the keys to merge into the store
     */
    ArtifactStore run(Mat image, ArtifactStore store);

    /**
     * Observational rendering of this stage's output for debugging.
     *
     * @return an 8-bit RGB image, or null if there is nothing to show
     */
    default Mat visualize(ArtifactStore store) {
        return null;
    }
}
