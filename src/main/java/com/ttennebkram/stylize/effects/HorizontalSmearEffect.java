package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Drags pixel color sideways along randomly chosen rows.
 */
@EffectInfo(
    name = "horizontal_smear",
    category = "Motion",
    description = "Horizontal streaks that carry color across the row"
)
public class HorizontalSmearEffect extends EffectBase {

    private final double rowProbability;
    private final double maxLength;
    private final double decay;

    public HorizontalSmearEffect(ConfigSection config) {
        super(config);
        this.rowProbability = this.config.getDouble("row_probability", 0.35);
        this.maxLength = this.config.getDouble("max_length", 0.6);
        this.decay = this.config.getDouble("decay", 0.985);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Random random = state.random();
        int rows = working.rows();
        int cols = working.cols();
        float[] data = MatUtils.readFloats(working);
        double probability = rowProbability * intensity;
        int longest = Math.max(1, (int) (cols * maxLength * intensity));

        for (int y = 0; y < rows; y++) {
            if (random.nextDouble() >= probability) {
                continue;
            }
            int start = random.nextInt(cols);
            int length = 1 + random.nextInt(longest);
            int anchor = (y * cols + start) * 3;
            float r = data[anchor];
            float g = data[anchor + 1];
            float b = data[anchor + 2];
            double weight = intensity;
            for (int x = start + 1; x < Math.min(cols, start + length); x++) {
                int i = (y * cols + x) * 3;
                data[i] = (float) (data[i] * (1 - weight) + r * weight);
                data[i + 1] = (float) (data[i + 1] * (1 - weight) + g * weight);
                data[i + 2] = (float) (data[i + 2] * (1 - weight) + b * weight);
                weight *= decay;
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, data);
    }
}
