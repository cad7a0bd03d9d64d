package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Chromatic separation: red and blue are displaced in opposite directions,
 * with faint scanlines over the result.
 */
@EffectInfo(
    name = "spectral_shift",
    category = "Color",
    description = "Separates the RGB channels along a direction"
)
public class SpectralShiftEffect extends EffectBase {

    private final double shiftPixels;
    private final double angleDegrees;
    private final double scanlines;

    public SpectralShiftEffect(ConfigSection config) {
        super(config);
        this.shiftPixels = this.config.getDouble("shift_pixels", 8.0);
        this.angleDegrees = this.config.getDouble("angle", 0.0);
        this.scanlines = this.config.getDouble("scanlines", 0.1);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);
        float[] dst = new float[src.length];
        double shift = shiftPixels * intensity;
        int dx = (int) Math.round(Math.cos(Math.toRadians(angleDegrees)) * shift);
        int dy = (int) Math.round(Math.sin(Math.toRadians(angleDegrees)) * shift);

        for (int y = 0; y < rows; y++) {
            float line = (y % 2 == 1) ? (float) (1 - scanlines * intensity) : 1f;
            for (int x = 0; x < cols; x++) {
                int i = (y * cols + x) * 3;
                int red = (MatUtils.clampIndex(y - dy, rows) * cols + MatUtils.clampIndex(x - dx, cols)) * 3;
                int blue = (MatUtils.clampIndex(y + dy, rows) * cols + MatUtils.clampIndex(x + dx, cols)) * 3;
                dst[i] = src[red] * line;
                dst[i + 1] = src[i + 1] * line;
                dst[i + 2] = src[blue + 2] * line;
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, dst);
    }
}
