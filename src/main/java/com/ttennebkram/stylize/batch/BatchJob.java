package com.ttennebkram.stylize.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of batch work: one input image to one output image. Immutable.
 */
public final class BatchJob {

    private final Path inputPath;
    private final Path outputPath;
    private final String effectName;
    private final String presetName;
    private final Path configPath;
    private final Long variationSeed;

    public BatchJob(Path inputPath, Path outputPath, String effectName, String presetName,
                    Path configPath, Long variationSeed) {
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
        this.effectName = effectName;
        this.presetName = presetName;
        this.configPath = configPath;
        this.variationSeed = variationSeed;
    }

    public BatchJob(Path inputPath, Path outputPath) {
        this(inputPath, outputPath, null, null, null, null);
    }

    public Path getInputPath() {
        return inputPath;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Effect override for this job, or null to use the configured primary effect.
     */
    public String getEffectName() {
        return effectName;
    }

    public String getPresetName() {
        return presetName;
    }

    /**
     * Configuration document for subprocess runs, or null.
     */
    public Path getConfigPath() {
        return configPath;
    }

    public Long getVariationSeed() {
        return variationSeed;
    }

    /**
     * Short label for console output: the output file name.
     */
    public String getLabel() {
        return outputPath.getFileName().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatchJob)) return false;
        BatchJob other = (BatchJob) o;
        return inputPath.equals(other.inputPath) && outputPath.equals(other.outputPath)
                && Objects.equals(effectName, other.effectName)
                && Objects.equals(presetName, other.presetName)
                && Objects.equals(configPath, other.configPath)
                && Objects.equals(variationSeed, other.variationSeed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputPath, outputPath, effectName, presetName, configPath, variationSeed);
    }

    @Override
    public String toString() {
        return "BatchJob{" + inputPath.getFileName() + " -> " + outputPath.getFileName()
                + (effectName != null ? ", effect=" + effectName : "")
                + (presetName != null ? ", preset=" + presetName : "")
                + (variationSeed != null ? ", seed=" + variationSeed : "") + "}";
    }
}
