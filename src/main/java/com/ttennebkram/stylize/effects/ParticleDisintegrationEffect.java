package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Breaks the image into drifting particles, strongest away from the subject
 * and toward the configured side.
 */
@EffectInfo(
    name = "particle_disintegration",
    category = "Stylize",
    description = "Scatters pixels into drifting particles"
)
public class ParticleDisintegrationEffect extends EffectBase {

    private final String direction;
    private final double maxDrift;
    private final double dropout;

    public ParticleDisintegrationEffect(ConfigSection config) {
        super(config);
        this.direction = this.config.getString("direction", "right");
        this.maxDrift = this.config.getDouble("max_drift", 24.0);
        this.dropout = this.config.getDouble("dropout", 0.35);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Random random = state.random();
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);
        Mat faceMask = state.getMat(ArtifactKey.FACE_MASK);
        float[] face = (faceMask != null && faceMask.rows() == rows && faceMask.cols() == cols)
                ? MatUtils.readFloats(faceMask) : null;

        // Background starts dim; particles land on top of it
        float[] dst = new float[src.length];
        for (int i = 0; i < src.length; i++) {
            dst[i] = (float) (src[i] * (1 - 0.6 * intensity));
        }

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int p = y * cols + x;
                double amount = gradient(x, y, cols, rows) * intensity;
                if (face != null) {
                    amount *= 1 - 0.7 * face[p];
                }
                int tx = x;
                int ty = y;
                if (amount > 0 && random.nextDouble() < amount) {
                    if (random.nextDouble() < dropout) {
                        continue;
                    }
                    double drift = maxDrift * amount;
                    tx = MatUtils.clampIndex((int) Math.round(x + driftX() * drift + random.nextGaussian() * drift * 0.3), cols);
                    ty = MatUtils.clampIndex((int) Math.round(y + driftY() * drift + random.nextGaussian() * drift * 0.3), rows);
                }
                int s = p * 3;
                int d = (ty * cols + tx) * 3;
                dst[d] = src[s];
                dst[d + 1] = src[s + 1];
                dst[d + 2] = src[s + 2];
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, dst);
    }

    // 0 on the anchored side, 1 on the side particles drift toward
    private double gradient(int x, int y, int cols, int rows) {
        switch (direction) {
            case "left":
                return 1.0 - x / (double) Math.max(1, cols - 1);
            case "up":
                return 1.0 - y / (double) Math.max(1, rows - 1);
            case "down":
                return y / (double) Math.max(1, rows - 1);
            default:
                return x / (double) Math.max(1, cols - 1);
        }
    }

    private int driftX() {
        if ("left".equals(direction)) return -1;
        if ("up".equals(direction) || "down".equals(direction)) return 0;
        return 1;
    }

    private int driftY() {
        if ("up".equals(direction)) return -1;
        if ("down".equals(direction)) return 1;
        return 0;
    }
}
