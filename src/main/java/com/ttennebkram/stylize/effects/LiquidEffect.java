package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.FlowFields;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Melts the image along the flow field, or along seeded waves when no flow exists.
 */
@EffectInfo(
    name = "liquid",
    category = "Distortion",
    description = "Flow-guided liquid displacement"
)
public class LiquidEffect extends EffectBase {

    private final double amplitude;
    private final double frequency;

    public LiquidEffect(ConfigSection config) {
        super(config);
        this.amplitude = this.config.getDouble("amplitude", 12.0);
        this.frequency = this.config.getDouble("frequency", 4.0);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Mat flow = state.getMat(ArtifactKey.FLOW_FIELD);
        Mat displacement;
        if (flow != null && flow.rows() == working.rows() && flow.cols() == working.cols()) {
            displacement = FlowFields.normalize(flow, amplitude * intensity);
        } else {
            displacement = waves(working.rows(), working.cols(), state);
        }
        Mat warped = FlowFields.warp(working, displacement, 1.0);
        displacement.release();
        Imgproc.GaussianBlur(warped, warped, new Size(3, 3), 0);
        return warped;
    }

    private Mat waves(int rows, int cols, ArtifactStore state) {
        double phase = state.random().nextDouble() * Math.PI * 2;
        double k = 2 * Math.PI * frequency / Math.max(rows, cols);
        double a = amplitude * intensity;
        float[] data = new float[rows * cols * 2];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int i = (y * cols + x) * 2;
                data[i] = (float) (a * Math.sin(y * k + phase));
                data[i + 1] = (float) (a * 0.5 * Math.sin(x * k * 0.7 + phase));
            }
        }
        return MatUtils.fromFloats(rows, cols, 2, data);
    }
}
