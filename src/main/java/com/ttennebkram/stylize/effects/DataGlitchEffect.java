package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Digital corruption: displaced horizontal bands with per-band channel offsets.
 */
@EffectInfo(
    name = "data_glitch",
    category = "Glitch",
    description = "Shifted bands and torn color channels"
)
public class DataGlitchEffect extends EffectBase {

    private final int bandCount;
    private final double maxShift;
    private final int channelOffset;

    public DataGlitchEffect(ConfigSection config) {
        super(config);
        this.bandCount = Math.max(1, this.config.getInt("bands", 12));
        this.maxShift = this.config.getDouble("max_shift", 0.15);
        this.channelOffset = Math.max(0, this.config.getInt("channel_offset", 6));
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Random random = state.random();
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);
        float[] dst = src.clone();
        int maxBandHeight = Math.max(1, rows / bandCount);
        int shiftLimit = Math.max(1, (int) (cols * maxShift * intensity));
        int bands = Math.max(1, (int) Math.round(bandCount * intensity));

        for (int band = 0; band < bands; band++) {
            int top = random.nextInt(rows);
            int height = 1 + random.nextInt(maxBandHeight);
            int shift = random.nextInt(shiftLimit * 2 + 1) - shiftLimit;
            int tear = channelOffset > 0 ? random.nextInt(channelOffset + 1) : 0;
            for (int y = top; y < Math.min(rows, top + height); y++) {
                for (int x = 0; x < cols; x++) {
                    int i = (y * cols + x) * 3;
                    int sx = Math.floorMod(x - shift, cols);
                    int red = (y * cols + Math.floorMod(sx - tear, cols)) * 3;
                    int rest = (y * cols + sx) * 3;
                    int blue = (y * cols + Math.floorMod(sx + tear, cols)) * 3;
                    dst[i] = src[red];
                    dst[i + 1] = src[rest + 1];
                    dst[i + 2] = src[blue + 2];
                }
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, dst);
    }
}
