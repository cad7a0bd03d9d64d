package com.ttennebkram.stylize.cli;

import com.ttennebkram.stylize.StylizeLauncher;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.config.ConfigurationLoader;
import com.ttennebkram.stylize.io.ImageFiles;
import com.ttennebkram.stylize.pipeline.DebugVisualizer;
import com.ttennebkram.stylize.pipeline.TransformResult;
import com.ttennebkram.stylize.pipeline.TransformationPipeline;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Transforms a single image. Also the command batch child processes run.
 */
@CommandLine.Command(
        name = "process",
        description = "Transform one image."
)
public class ProcessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);

    @CommandLine.ParentCommand
    StylizeLauncher parent;

    @CommandLine.Parameters(index = "0", description = "Input image.")
    Path input;

    @CommandLine.Parameters(index = "1", description = "Output image.")
    Path output;

    @CommandLine.Option(names = {"-e", "--effect"}, description = "Primary effect name.")
    String effect;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration JSON file.")
    Path config;

    @CommandLine.Option(names = {"-p", "--preset"}, description = "Preset to apply.")
    String preset;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Variation seed.")
    Long seed;

    @CommandLine.Option(names = "--debug", description = "Also write stage visualizations and a side-by-side comparison.")
    boolean debug;

    @Override
    public Integer call() {
        OpenCVLoader.ensureLoaded();
        Configuration configuration = ConfigurationLoader.load(config, preset);
        if (effect != null) {
            configuration = configuration.withPrimaryEffect(effect);
        }

        Mat image = ImageFiles.read(input);
        TransformResult result = null;
        try (TransformationPipeline pipeline = new TransformationPipeline(configuration)) {
            result = pipeline.transform(image, seed, debug);
            ImageFiles.write(result.getImage(), output, configuration.getOutputFormat(),
                    configuration.getOutputQuality());
            if (debug) {
                writeDebugImages(image, result, configuration);
            }
        } finally {
            image.release();
            if (result != null) {
                result.release();
            }
        }

        log.info("Saved {} (seed {})", output, result.getSeed());
        parent.getOut().println("Saved " + output);
        return StylizeLauncher.EXIT_OK;
    }

    private void writeDebugImages(Mat original, TransformResult result, Configuration configuration) {
        Path dir = output.toAbsolutePath().getParent();
        String stem = ImageFiles.stem(output);
        String extension = configuration.getOutputFormat().getExtension();
        int quality = configuration.getOutputQuality();

        for (Map.Entry<String, Mat> entry : result.getIntermediates().entrySet()) {
            Path target = dir.resolve(stem + "_" + entry.getKey() + extension);
            ImageFiles.write(entry.getValue(), target, configuration.getOutputFormat(), quality);
        }
        Mat comparison = DebugVisualizer.sideBySide(original, result.getImage());
        try {
            ImageFiles.write(comparison, dir.resolve(stem + "_comparison" + extension),
                    configuration.getOutputFormat(), quality);
        } finally {
            comparison.release();
        }
        log.info("Wrote {} debug image(s) next to {}", result.getIntermediates().size() + 1, output);
    }
}
