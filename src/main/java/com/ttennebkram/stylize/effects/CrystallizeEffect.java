package com.ttennebkram.stylize.effects;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Random;

/**
 * Voronoi facets: each pixel takes the color of its nearest jittered cell seed,
 * with darkened borders where two cells meet.
 */
@EffectInfo(
    name = "crystallize",
    category = "Stylize",
    description = "Voronoi crystal facets"
)
public class CrystallizeEffect extends EffectBase {

    private final int cellSize;
    private final double borderWidth;

    public CrystallizeEffect(ConfigSection config) {
        super(config);
        this.cellSize = Math.max(2, this.config.getInt("cell_size", 16));
        this.borderWidth = this.config.getDouble("border_width", 1.5);
    }

    @Override
    protected Mat render(Mat working, ArtifactStore state) {
        Random random = state.random();
        int rows = working.rows();
        int cols = working.cols();
        float[] src = MatUtils.readFloats(working);

        int gridW = (cols + cellSize - 1) / cellSize;
        int gridH = (rows + cellSize - 1) / cellSize;
        double[] seedX = new double[gridW * gridH];
        double[] seedY = new double[gridW * gridH];
        for (int gy = 0; gy < gridH; gy++) {
            for (int gx = 0; gx < gridW; gx++) {
                int s = gy * gridW + gx;
                seedX[s] = Math.min(cols - 1, (gx + random.nextDouble()) * cellSize);
                seedY[s] = Math.min(rows - 1, (gy + random.nextDouble()) * cellSize);
            }
        }

        float[] dst = new float[src.length];
        for (int y = 0; y < rows; y++) {
            int gy = y / cellSize;
            for (int x = 0; x < cols; x++) {
                int gx = x / cellSize;
                double best = Double.MAX_VALUE;
                double second = Double.MAX_VALUE;
                int bestSeed = 0;
                for (int ny = Math.max(0, gy - 1); ny <= Math.min(gridH - 1, gy + 1); ny++) {
                    for (int nx = Math.max(0, gx - 1); nx <= Math.min(gridW - 1, gx + 1); nx++) {
                        int s = ny * gridW + nx;
                        double d = Math.hypot(x - seedX[s], y - seedY[s]);
                        if (d < best) {
                            second = best;
                            best = d;
                            bestSeed = s;
                        } else if (d < second) {
                            second = d;
                        }
                    }
                }
                int sx = (int) seedX[bestSeed];
                int sy = (int) seedY[bestSeed];
                int from = (sy * cols + sx) * 3;
                int to = (y * cols + x) * 3;
                float shade = (second - best) < borderWidth ? (float) (1 - 0.5 * intensity) : 1f;
                for (int c = 0; c < 3; c++) {
                    float facet = src[from + c] * shade;
                    dst[to + c] = (float) (src[to + c] * (1 - intensity) + facet * intensity);
                }
            }
        }
        return MatUtils.fromFloats(rows, cols, 3, dst);
    }
}
