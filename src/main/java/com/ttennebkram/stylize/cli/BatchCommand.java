package com.ttennebkram.stylize.cli;

import com.ttennebkram.stylize.StylizeLauncher;
import com.ttennebkram.stylize.batch.BatchCoordinator;
import com.ttennebkram.stylize.batch.BatchOptions;
import com.ttennebkram.stylize.batch.BatchReport;
import com.ttennebkram.stylize.batch.ConsoleOutput;
import com.ttennebkram.stylize.batch.JobOutcome;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.config.ConfigurationLoader;
import com.ttennebkram.stylize.util.OpenCVLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Transforms every image in a directory with a pool of workers.
 * Exits non-zero when any job failed.
 */
@CommandLine.Command(
        name = "batch",
        description = "Transform every image in a directory."
)
public class BatchCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    StylizeLauncher parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Input directory.")
    Path inputDir;

    @CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Output directory.")
    Path outputDir;

    @CommandLine.Option(names = {"-e", "--effect"}, description = "Primary effect name for every job.")
    String effect;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration JSON file.")
    Path config;

    @CommandLine.Option(names = {"-p", "--preset"}, description = "Preset to apply.")
    String preset;

    @CommandLine.Option(names = {"-v", "--variations"}, defaultValue = "1",
            description = "Seeded variations per image.")
    int variations;

    @CommandLine.Option(names = {"-j", "--parallel"}, description = "Worker count (default: available processors).")
    Integer parallel;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Base seed for variations.")
    Long seed;

    @CommandLine.Option(names = "--subprocess", description = "Run each job in a child JVM.")
    boolean subprocess;

    @CommandLine.Option(names = "--timeout", description = "Per-job timeout in seconds.")
    Long timeoutSeconds;

    @Override
    public Integer call() {
        OpenCVLoader.ensureLoaded();
        Configuration configuration = ConfigurationLoader.load(config);

        BatchOptions options;
        try {
            BatchOptions.Builder builder = BatchOptions.builder()
                    .inputDir(inputDir)
                    .outputDir(outputDir)
                    .configuration(configuration)
                    .configPath(config)
                    .effectName(effect)
                    .presetName(preset)
                    .variations(variations)
                    .baseSeed(seed)
                    .subprocess(subprocess);
            if (parallel != null) {
                builder.parallelism(parallel);
            }
            if (timeoutSeconds != null) {
                builder.jobTimeout(Duration.ofSeconds(timeoutSeconds));
            }
            options = builder.build();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e, null, null);
        }

        ConsoleOutput console = new ConsoleOutput(parent.getOut(), parent.getErr());
        BatchCoordinator coordinator = new BatchCoordinator(options,
                BatchCoordinator.defaultRunnerFactory(options), console);
        BatchReport report = coordinator.run();

        console.printBlock("[batch] Done: " + report.getSavedCount() + " saved, "
                + report.getFailedCount() + " failed");
        for (JobOutcome failure : report.getFailures()) {
            console.printErrorBlock("[batch]   " + failure.getJob().getInputPath().getFileName()
                    + ": " + failure.getReason());
        }
        return report.getFailedCount() == 0 ? StylizeLauncher.EXIT_OK : StylizeLauncher.EXIT_FAILURE;
    }
}
