package com.ttennebkram.stylize.state;

import com.ttennebkram.stylize.util.MatUtils;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Insertion-ordered artifact map threaded through one transformation.
 *
 * Keys are never removed; a later stage may overwrite a value. A missing
 * optional key means the producing stage did not run or failed. Well-known
 * keys are type-checked against {@link ArtifactKey#valueType()}; any other
 * string key is accepted so late-bound plugins can publish their own artifacts.
 *
 * A store created for a transformation owns that run's {@link Random}; every
 * stochastic step draws from it so that a fixed seed gives a fixed result.
 */
public class ArtifactStore {

    public static final String FAILED_SUFFIX = "_failed";
    public static final String ERROR_SUFFIX = "_error";

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Random random;

    private ArtifactStore(Random random) {
        this.random = random;
    }

    /**
     * Store for a whole transformation, owning its random generator.
     */
    public static ArtifactStore forTransformation(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        return new ArtifactStore(random);
    }

    /**
     * Empty store used by stages to return the keys they produced.
     */
    public static ArtifactStore delta() {
        return new ArtifactStore(null);
    }

    /**
     * The transformation's random generator.
     *
     * @throws IllegalStateException on a delta store
     */
    public Random random() {
        if (random == null) {
            throw new IllegalStateException("Delta stores do not carry a random generator");
        }
        return random;
    }

    public ArtifactStore put(ArtifactKey key, Object value) {
        if (value != null && !key.valueType().isInstance(value)) {
            throw new IllegalArgumentException("Artifact '" + key.key() + "' expects "
                    + key.valueType().getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        values.put(key.key(), value);
        return this;
    }

    public ArtifactStore put(String key, Object value) {
        ArtifactKey known = ArtifactKey.fromKey(key);
        if (known != null) {
            return put(known, value);
        }
        values.put(key, value);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object get(ArtifactKey key) {
        return values.get(key.key());
    }

    public <T> T get(ArtifactKey key, Class<T> type) {
        Object value = values.get(key.key());
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public Mat getMat(ArtifactKey key) {
        return get(key, Mat.class);
    }

    public String getString(ArtifactKey key) {
        return get(key, String.class);
    }

    public boolean contains(ArtifactKey key) {
        return values.get(key.key()) != null;
    }

    public boolean contains(String key) {
        return values.get(key) != null;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Merge a stage's delta into this store.
     */
    public ArtifactStore merge(ArtifactStore delta) {
        if (delta != null && delta != this) {
            for (Map.Entry<String, Object> entry : delta.values.entrySet()) {
                values.put(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    /**
     * Record that a stage failed: writes {@code <stage>_failed = true} and {@code <stage>_error}.
     */
    public void markFailed(String stageName, Throwable cause) {
        values.put(stageName + FAILED_SUFFIX, Boolean.TRUE);
        String message = cause == null ? "unknown"
                : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        values.put(stageName + ERROR_SUFFIX, message);
    }

    public boolean isFailed(String stageName) {
        return Boolean.TRUE.equals(values.get(stageName + FAILED_SUFFIX));
    }

    /**
     * Resolve an image input through a priority-ordered fallback chain.
     * Returns the first present key in {@code preferred}; then the working image;
     * then the original converted to the working range.
     *
     * The returned Mat may be shared with the store - callers must not modify it.
     */
    public Mat resolveImage(Mat original, ArtifactKey... preferred) {
        for (ArtifactKey key : preferred) {
            Mat mat = getMat(key);
            if (mat != null && !mat.empty()) {
                return mat;
            }
        }
        Mat working = getMat(ArtifactKey.WORKING_IMAGE);
        if (working != null && !working.empty()) {
            return working;
        }
        Mat converted = MatUtils.toWorking(original);
        values.put(ArtifactKey.WORKING_IMAGE.key(), converted);
        return converted;
    }

    @Override
    public String toString() {
        return "ArtifactStore" + values.keySet();
    }
}
