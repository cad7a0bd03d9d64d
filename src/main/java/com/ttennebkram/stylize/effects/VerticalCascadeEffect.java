package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Lets columns of pixels run downward like dripping paint.
 */
@EffectInfo(
    name = "vertical_cascade",
    category = "Motion",
    description = "Vertical drips that pull color down the image"
)
public class VerticalCascadeEffect extends EffectBase {

    private final double columnProbability;
    private final double maxLength;
    private final double decay;

    public VerticalCascadeEffect(ConfigSection config) {
        super(config);
        this.columnProbability = this.config.getDouble("column_probability", 0.4);
        this.maxLength = this.config.getDouble("max_length", 0.5);
        this.decay = this.config.getDouble("decay", 0.99);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Random random = state.random();
        int rows = working.rows();
        int cols = working.cols();
        float[] data = MatUtils.readFloats(working);
        double probability = columnProbability * intensity;
        int longest = Math.max(1, (int) (rows * maxLength * intensity));

        for (int x = 0; x < cols; x++) {
            if (random.nextDouble() >= probability) {
                continue;
            }
            int start = random.nextInt(rows);
            int length = 1 + random.nextInt(longest);
            double weight = intensity;
            int prev = (start * cols + x) * 3;
            for (int y = start + 1; y < Math.min(rows, start + length); y++) {
                int i = (y * cols + x) * 3;
                // Each pixel takes on part of the one above, so the drip carries color
                data[i] = (float) (data[i] * (1 - weight) + data[prev] * weight);
                data[i + 1] = (float) (data[i + 1] * (1 - weight) + data[prev + 1] * weight);
                data[i + 2] = (float) (data[i + 2] * (1 - weight) + data[prev + 2] * weight);
                prev = i;
                weight *= decay;
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, data);
    }
}
