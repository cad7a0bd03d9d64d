package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.effects.basic.BasicEffects;
import com.ttennebkram.stylize.error.FatalIOException;
import com.ttennebkram.stylize.error.JobFailureException;
import com.ttennebkram.stylize.io.ImageFiles;
import com.ttennebkram.stylize.pipeline.DeviceHint;
import com.ttennebkram.stylize.pipeline.TransformationPipeline;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Runs jobs on the calling thread with the full pipeline.
 *
 * Pipelines are built lazily per (preset, effect) pair and reused for later
 * jobs of the same kind. If the pipeline cannot be built or fails on an
 * image, the job is retried with the basic effect of the same name.
 */
public class InProcessJobRunner implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(InProcessJobRunner.class);

    private final Configuration baseConfiguration;
    private final DeviceHint device;
    private final BiFunction<Configuration, DeviceHint, TransformationPipeline> pipelineFactory;
    private final Map<String, TransformationPipeline> pipelines = new LinkedHashMap<>();

    public InProcessJobRunner(Configuration baseConfiguration) {
        this(baseConfiguration, DeviceHint.AUTO);
    }

    public InProcessJobRunner(Configuration baseConfiguration, DeviceHint device) {
        this(baseConfiguration, device, TransformationPipeline::new);
    }

    InProcessJobRunner(Configuration baseConfiguration, DeviceHint device,
                       BiFunction<Configuration, DeviceHint, TransformationPipeline> pipelineFactory) {
        this.baseConfiguration = baseConfiguration;
        this.device = device;
        this.pipelineFactory = pipelineFactory;
    }

    @Override
    public Path run(BatchJob job) {
        Mat image;
        try {
            image = ImageFiles.read(job.getInputPath());
        } catch (FatalIOException e) {
            throw new JobFailureException(e.getMessage(), e);
        }

        Configuration config;
        try {
            config = configurationFor(job);
        } catch (RuntimeException e) {
            image.release();
            throw new JobFailureException("Invalid settings for " + job.getLabel() + ": " + e.getMessage(), e);
        }

        Mat output = null;
        try {
            output = transform(job, config, image);
            checkNotInterrupted(job);
            ImageFiles.write(output, job.getOutputPath(), config.getOutputFormat(), config.getOutputQuality());
            return job.getOutputPath();
        } catch (FatalIOException e) {
            throw new JobFailureException(e.getMessage(), e);
        } finally {
            image.release();
            if (output != null) {
                output.release();
            }
        }
    }

    private Configuration configurationFor(BatchJob job) {
        Configuration config = baseConfiguration;
        if (job.getPresetName() != null) {
            config = config.withPreset(job.getPresetName());
        }
        if (job.getEffectName() != null) {
            config = config.withPrimaryEffect(job.getEffectName());
        }
        return config;
    }

    private Mat transform(BatchJob job, Configuration config, Mat image) {
        try {
            TransformationPipeline pipeline = pipelineFor(job, config);
            return pipeline.transform(image, job.getVariationSeed(), false).getImage();
        } catch (RuntimeException | LinkageError e) {
            checkNotInterrupted(job);
            String effect = job.getEffectName() != null ? job.getEffectName() : config.getPrimaryEffect();
            log.warn("Advanced pipeline failed for {} ({}), using basic effect {}", job.getLabel(), e.toString(),
                    effect != null ? effect : BasicEffects.DEFAULT_EFFECT);
            long seed = job.getVariationSeed() != null ? job.getVariationSeed()
                    : config.getRandomSeed() != null ? config.getRandomSeed() : 0L;
            return BasicEffects.apply(effect, image, seed);
        }
    }

    private TransformationPipeline pipelineFor(BatchJob job, Configuration config) {
        String key = job.getPresetName() + "|" + job.getEffectName();
        TransformationPipeline pipeline = pipelines.get(key);
        if (pipeline == null) {
            pipeline = pipelineFactory.apply(config, device);
            pipelines.put(key, pipeline);
        }
        return pipeline;
    }

    // An abandoned job must not write its output
    private static void checkNotInterrupted(BatchJob job) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobFailureException("Interrupted while processing " + job.getLabel());
        }
    }

    @Override
    public void close() {
        for (TransformationPipeline pipeline : pipelines.values()) {
            pipeline.close();
        }
        pipelines.clear();
    }
}
