package com.ttennebkram.stylize.pipeline;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.effects.Effect;
import com.ttennebkram.stylize.error.FatalIOException;
import com.ttennebkram.stylize.error.StageFailureException;
import com.ttennebkram.stylize.registry.BuiltinEffects;
import com.ttennebkram.stylize.registry.EffectRegistry;
import com.ttennebkram.stylize.stages.Stage;
import com.ttennebkram.stylize.state.ArtifactKey;
import com.ttennebkram.stylize.state.ArtifactStore;
import com.ttennebkram.stylize.util.MatUtils;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs one image through the fixed stage sequence:
 * analyze, flow, material, primary effect (optional), compose, reconcile, refine.
 *
 * Each call owns a fresh {@link ArtifactStore} and {@link Random}; the same
 * image, configuration and seed always give the same output. A stage that
 * throws is logged, recorded as {@code <stage>_failed} in the store, and
 * skipped; later stages fall back to whatever earlier artifacts exist.
 *
 * Instances are not thread-safe. Batch workers each build their own.
 */
public class TransformationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    // Intermediate visualization names
    public static final String FACE_MESH = "face_mesh";
    public static final String DEPTH_MAP = "depth_map";
    public static final String FLOW_FIELD = "flow_field";
    public static final String MATERIAL_MAP = "material_map";
    public static final String PRIMARY_EFFECT = "primary_effect";
    public static final String COMPOSED = "composed";
    public static final String REFINED = "refined";

    private final Configuration configuration;
    private final DeviceHint device;
    private final EffectRegistry registry;
    private final boolean ownsRegistry;
    private final PipelineStages stages;
    private final Effect primaryEffect;

    public TransformationPipeline(Configuration configuration) {
        this(configuration, DeviceHint.AUTO);
    }

    public TransformationPipeline(Configuration configuration, DeviceHint device) {
        this(configuration, device, EffectRegistry.forConfiguration(configuration), true,
                PipelineStages.defaults(configuration));
    }

    /**
     * Pipeline over a caller-supplied registry and stage set. The registry is not closed by this pipeline.
     */
    public TransformationPipeline(Configuration configuration, DeviceHint device,
                                  EffectRegistry registry, PipelineStages stages) {
        this(configuration, device, registry, false, stages);
    }

    private TransformationPipeline(Configuration configuration, DeviceHint device, EffectRegistry registry,
                                   boolean ownsRegistry, PipelineStages stages) {
        OpenCVLoader.ensureLoaded();
        this.configuration = configuration;
        this.device = device == null ? DeviceHint.CPU : device.resolve();
        this.registry = registry;
        this.ownsRegistry = ownsRegistry;
        this.stages = stages;
        this.primaryEffect = resolvePrimaryEffect();
        log.debug("Pipeline ready: device={}, primaryEffect={}", this.device,
                primaryEffect == null ? "none" : primaryEffect.getName());
    }

    private Effect resolvePrimaryEffect() {
        String name = configuration.getPrimaryEffect();
        if (name == null) {
            return null;
        }
        Effect effect = registry.get(name);
        if (effect != null) {
            return effect;
        }
        log.warn("Primary effect '{}' is not available, falling back to {}", name, BuiltinEffects.DEFAULT_EFFECT);
        effect = registry.get(BuiltinEffects.DEFAULT_EFFECT);
        if (effect == null) {
            log.warn("Default effect {} is not registered either, running without a primary effect",
                    BuiltinEffects.DEFAULT_EFFECT);
        }
        return effect;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public DeviceHint getDevice() {
        return device;
    }

    public EffectRegistry getRegistry() {
        return registry;
    }

    public PipelineStages getStages() {
        return stages;
    }

    /**
     * @return the resolved primary effect, or null if none is configured
     */
    public Effect getPrimaryEffect() {
        return primaryEffect;
    }

    /**
     * Transform with the configured seed and no intermediates.
     */
    public Mat transform(Mat image) {
        return transform(image, null, false).getImage();
    }

    /**
     * Transform one image.
     *
     * @param image             H x W x 3 RGB, CV_8UC3 or CV_32FC3 in [0,1]; not modified
     * @param variationSeed     seed for this run; null uses the configured seed, or a fresh one
     * @param wantIntermediates also collect stage visualizations and keep the store
     * @throws FatalIOException if the image is null, empty or not a 3-channel image
     */
    public TransformResult transform(Mat image, Long variationSeed, boolean wantIntermediates) {
        validate(image);

        long seed = chooseSeed(variationSeed);
        ArtifactStore store = ArtifactStore.forTransformation(new Random(seed));
        store.put(ArtifactKey.VARIATION_SEED, seed);
        store.put(ArtifactKey.ORIGINAL_IMAGE, image.type() == CvType.CV_8UC3 ? image.clone() : MatUtils.toDisplay(image));
        store.put(ArtifactKey.WORKING_IMAGE, MatUtils.toWorking(image));

        Map<String, Mat> intermediates = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        if (runStage(stages.getAnalyzer(), image, store, failed) && wantIntermediates) {
            capture(intermediates, FACE_MESH, stages.getAnalyzer(), store);
            Mat depth = store.getMat(ArtifactKey.DEPTH_MAP);
            if (depth != null) {
                intermediates.put(DEPTH_MAP, MatUtils.heatMap(depth));
            }
        }
        if (runStage(stages.getFlow(), image, store, failed) && wantIntermediates) {
            capture(intermediates, FLOW_FIELD, stages.getFlow(), store);
        }
        if (runStage(stages.getMaterial(), image, store, failed) && wantIntermediates) {
            capture(intermediates, MATERIAL_MAP, stages.getMaterial(), store);
        }
        if (primaryEffect != null) {
            if (runStage(primaryEffect, image, store, failed)) {
                store.put(ArtifactKey.PRIMARY_EFFECT_NAME, primaryEffect.getName());
                if (wantIntermediates) {
                    capture(intermediates, PRIMARY_EFFECT, primaryEffect, store);
                }
            }
        }
        if (runStage(stages.getCompositor(), image, store, failed) && wantIntermediates) {
            capture(intermediates, COMPOSED, stages.getCompositor(), store);
        }
        runStage(stages.getReconciler(), image, store, failed);
        if (runStage(stages.getRefiner(), image, store, failed) && wantIntermediates) {
            capture(intermediates, REFINED, stages.getRefiner(), store);
        }

        Mat finalImage = extractFinal(image, store);
        if (!failed.isEmpty()) {
            log.warn("Transformation finished with failed stages: {}", failed);
        }
        return new TransformResult(finalImage, intermediates, wantIntermediates ? store : null, seed, failed);
    }

    private long chooseSeed(Long variationSeed) {
        if (variationSeed != null) {
            return variationSeed;
        }
        Long configured = configuration.getRandomSeed();
        if (configured != null) {
            return configured;
        }
        return new Random().nextLong();
    }

    private static void validate(Mat image) {
        if (image == null || image.empty()) {
            throw new FatalIOException("Input image is null or empty");
        }
        if (image.type() != CvType.CV_8UC3 && image.type() != CvType.CV_32FC3) {
            throw new FatalIOException("Input image must be H x W x 3 (CV_8UC3 or CV_32FC3), got "
                    + CvType.typeToString(image.type()));
        }
    }

    /**
     * Run a stage and merge its delta. Failures are contained here.
     *
     * @return true if the stage completed
     */
    private boolean runStage(Stage stage, Mat image, ArtifactStore store, List<String> failed) {
        long start = System.nanoTime();
        try {
            ArtifactStore delta = stage.run(image, store);
            store.merge(delta);
            log.debug("Stage {} finished in {} ms", stage.getName(), (System.nanoTime() - start) / 1_000_000);
            return true;
        } catch (RuntimeException | LinkageError e) {
            StageFailureException failure = new StageFailureException(stage.getName(), e);
            log.warn(failure.getMessage(), e);
            store.markFailed(stage.getName(), e);
            failed.add(stage.getName());
            return false;
        }
    }

    private static void capture(Map<String, Mat> intermediates, String name, Stage stage, ArtifactStore store) {
        try {
            Mat view = stage.visualize(store);
            if (view != null && !view.empty()) {
                intermediates.put(name, sharesStoreData(view, store) ? view.clone() : view);
            }
        } catch (RuntimeException e) {
            log.warn("Could not render {} for stage {}: {}", name, stage.getName(), e.toString());
        }
    }

    // True if the view is, or is a region of, a Mat held in the store
    static boolean sharesStoreData(Mat view, ArtifactStore store) {
        for (String key : store.keys()) {
            Object value = store.get(key);
            if (value instanceof Mat) {
                Mat held = (Mat) value;
                if (held == view || (!held.empty() && overlaps(view, held))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean overlaps(Mat view, Mat held) {
        long start = held.dataAddr();
        long end = start + held.step1(0) * held.elemSize1() * held.rows();
        return view.dataAddr() >= start && view.dataAddr() < end;
    }

    /**
     * Final image, falling back through refined, composed and material renderings to the input.
     */
    private static Mat extractFinal(Mat image, ArtifactStore store) {
        Mat best = store.resolveImage(image, ArtifactKey.FINAL_IMAGE, ArtifactKey.REFINED_IMAGE,
                ArtifactKey.COMPOSED_IMAGE, ArtifactKey.MATERIAL_DIFFUSE);
        if (best.rows() != image.rows() || best.cols() != image.cols()) {
            log.warn("Final image size {}x{} differs from input, using the working image",
                    best.cols(), best.rows());
            best = store.resolveImage(image);
        }
        if (best.type() == CvType.CV_8UC3) {
            return best.clone();
        }
        return MatUtils.toDisplay(best);
    }

    @Override
    public void close() {
        if (ownsRegistry) {
            registry.close();
        }
    }
}
