package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Ghosted trail of shifted copies, fading with distance.
 */
@EffectInfo(
    name = "echo_motion",
    category = "Motion",
    description = "Fading echoes offset along a motion direction"
)
public class EchoMotionEffect extends EffectBase {

    private final int echoes;
    private final double spacing;
    private final double falloff;
    private final Double angleDegrees;

    public EchoMotionEffect(ConfigSection config) {
        super(config);
        this.echoes = Math.max(1, this.config.getInt("echoes", 4));
        this.spacing = this.config.getDouble("spacing", 10.0);
        this.falloff = this.config.getDouble("falloff", 0.6);
        this.angleDegrees = this.config.has("angle") ? this.config.getDouble("angle", 0.0) : null;
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        double angle = angleDegrees != null
                ? Math.toRadians(angleDegrees)
                : state.random().nextDouble() * Math.PI * 2;
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);
        float[] acc = src.clone();
        double totalWeight = 1.0;
        double weight = intensity;

        for (int e = 1; e <= echoes; e++) {
            int dx = (int) Math.round(Math.cos(angle) * spacing * e);
            int dy = (int) Math.round(Math.sin(angle) * spacing * e);
            for (int y = 0; y < rows; y++) {
                int sy = MatUtils.clampIndex(y - dy, rows);
                for (int x = 0; x < cols; x++) {
                    int sx = MatUtils.clampIndex(x - dx, cols);
                    int i = (y * cols + x) * 3;
                    int s = (sy * cols + sx) * 3;
                    acc[i] += (float) (src[s] * weight);
                    acc[i + 1] += (float) (src[s + 1] * weight);
                    acc[i + 2] += (float) (src[s + 2] * weight);
                }
            }
            totalWeight += weight;
            weight *= falloff;
        }
        for (int i = 0; i < acc.length; i++) {
            acc[i] = (float) (acc[i] / totalWeight);
        }
        return MatUtils.fromFloats(rows, cols, 3, acc);
    }
}
