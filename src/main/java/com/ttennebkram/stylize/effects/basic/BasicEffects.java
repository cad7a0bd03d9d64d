package com.ttennebkram.stylize.effects.basic;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Self-contained effects used when the full pipeline cannot run.
 *
 * They work directly on 8-bit RGB images, need no analysis artifacts, and
 * share their names with the advanced effects they stand in for. Output has
 * the input's size and type, and a given seed always gives the same result.
 */
public final class BasicEffects {

    private static final Logger log = LoggerFactory.getLogger(BasicEffects.class);

    public static final String DEFAULT_EFFECT = "vertical_cascade";

    /**
     * A basic effect: 8-bit RGB in, new 8-bit RGB out.
     */
    public interface BasicEffect {
        Mat apply(Mat rgb, Random random);
    }

    private static final Map<String, BasicEffect> EFFECTS;

    static {
        Map<String, BasicEffect> map = new LinkedHashMap<>();
        map.put("vertical_cascade", BasicEffects::verticalCascade);
        map.put("horizontal_smear", BasicEffects::horizontalSmear);
        map.put("data_glitch", BasicEffects::dataGlitch);
        EFFECTS = Collections.unmodifiableMap(map);
    }

    private BasicEffects() {
    }

    public static Set<String> names() {
        return EFFECTS.keySet();
    }

    public static boolean has(String name) {
        return EFFECTS.containsKey(name);
    }

    /**
     * Apply a basic effect by name. Unknown names fall back to {@value #DEFAULT_EFFECT}.
     *
     * @param name  effect name, may be null
     * @param rgb   CV_8UC3 RGB image
     * @param seed  seed for the effect's random choices
     */
    public static Mat apply(String name, Mat rgb, long seed) {
        if (rgb == null || rgb.empty() || rgb.type() != CvType.CV_8UC3) {
            throw new IllegalArgumentException("Basic effects need a CV_8UC3 image");
        }
        BasicEffect effect = name == null ? null : EFFECTS.get(name);
        if (effect == null) {
            log.warn("No basic effect named '{}', using {}", name, DEFAULT_EFFECT);
            effect = EFFECTS.get(DEFAULT_EFFECT);
        }
        return effect.apply(rgb, new Random(seed));
    }

    static Mat verticalCascade(Mat rgb, Random random) {
        int rows = rgb.rows();
        int cols = rgb.cols();
        byte[] data = read(rgb);
        for (int x = 0; x < cols; x++) {
            if (random.nextDouble() >= 0.3) {
                continue;
            }
            int start = random.nextInt(rows);
            int length = 1 + random.nextInt(Math.max(1, rows / 2));
            int src = (start * cols + x) * 3;
            for (int y = start + 1; y < Math.min(rows, start + length); y++) {
                int i = (y * cols + x) * 3;
                for (int c = 0; c < 3; c++) {
                    data[i + c] = mix(data[i + c], data[src + c], 0.7);
                }
            }
        }
        return write(rgb, data);
    }

    static Mat horizontalSmear(Mat rgb, Random random) {
        int rows = rgb.rows();
        int cols = rgb.cols();
        byte[] data = read(rgb);
        for (int y = 0; y < rows; y++) {
            if (random.nextDouble() >= 0.25) {
                continue;
            }
            int start = random.nextInt(cols);
            int length = 1 + random.nextInt(Math.max(1, cols / 2));
            int src = (y * cols + start) * 3;
            for (int x = start + 1; x < Math.min(cols, start + length); x++) {
                int i = (y * cols + x) * 3;
                for (int c = 0; c < 3; c++) {
                    data[i + c] = mix(data[i + c], data[src + c], 0.7);
                }
            }
        }
        return write(rgb, data);
    }

    static Mat dataGlitch(Mat rgb, Random random) {
        int rows = rgb.rows();
        int cols = rgb.cols();
        byte[] src = read(rgb);
        byte[] dst = src.clone();
        int bands = 8;
        int shiftLimit = Math.max(1, cols / 10);
        for (int band = 0; band < bands; band++) {
            int top = random.nextInt(rows);
            int height = 1 + random.nextInt(Math.max(1, rows / bands));
            int shift = random.nextInt(shiftLimit * 2 + 1) - shiftLimit;
            for (int y = top; y < Math.min(rows, top + height); y++) {
                for (int x = 0; x < cols; x++) {
                    int i = (y * cols + x) * 3;
                    int s = (y * cols + Math.floorMod(x - shift, cols)) * 3;
                    dst[i] = src[s];
                    dst[i + 1] = src[i + 1];
                    dst[i + 2] = src[s + 2];
                }
            }
        }
        return write(rgb, dst);
    }

    private static byte mix(byte current, byte source, double weight) {
        int a = current & 0xFF;
        int b = source & 0xFF;
        return (byte) Math.round(a * (1 - weight) + b * weight);
    }

    private static byte[] read(Mat rgb) {
        Mat source = rgb.isContinuous() ? rgb : rgb.clone();
        byte[] data = new byte[(int) (source.total() * 3)];
        source.get(0, 0, data);
        return data;
    }

    private static Mat write(Mat like, byte[] data) {
        Mat out = new Mat(like.rows(), like.cols(), CvType.CV_8UC3);
        out.put(0, 0, data);
        return out;
    }
}
