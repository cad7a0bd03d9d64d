package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.StylizeLauncher;
import com.ttennebkram.stylize.error.JobFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs each job in a child JVM through {@code StylizeLauncher process}.
 *
 * The child's exit code decides the outcome: 0 with the output file present
 * is success, anything else is a failure carrying the child's stderr.
 * Interrupting the calling thread kills the child.
 */
public class SubprocessJobRunner implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(SubprocessJobRunner.class);

    private static final int MAX_DIAGNOSTIC_LINES = 5;

    private final String javaExecutable;
    private final String classpath;

    public SubprocessJobRunner() {
        this(Path.of(System.getProperty("java.home"), "bin", "java").toString(),
                System.getProperty("java.class.path"));
    }

    public SubprocessJobRunner(String javaExecutable, String classpath) {
        this.javaExecutable = javaExecutable;
        this.classpath = classpath;
    }

    List<String> command(BatchJob job) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable);
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(StylizeLauncher.class.getName());
        cmd.add("process");
        cmd.add(job.getInputPath().toString());
        cmd.add(job.getOutputPath().toString());
        if (job.getEffectName() != null) {
            cmd.add("-e");
            cmd.add(job.getEffectName());
        }
        if (job.getPresetName() != null) {
            cmd.add("-p");
            cmd.add(job.getPresetName());
        }
        if (job.getConfigPath() != null) {
            cmd.add("-c");
            cmd.add(job.getConfigPath().toString());
        }
        if (job.getVariationSeed() != null) {
            cmd.add("-s");
            cmd.add(String.valueOf(job.getVariationSeed()));
        }
        return cmd;
    }

    @Override
    public Path run(BatchJob job) {
        Path stderrFile = null;
        Process process = null;
        try {
            stderrFile = Files.createTempFile("stylize-job-", ".err");
            ProcessBuilder builder = new ProcessBuilder(command(job));
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            builder.redirectError(stderrFile.toFile());
            process = builder.start();
            int exitCode = process.waitFor();

            if (exitCode == 0 && Files.exists(job.getOutputPath())) {
                return job.getOutputPath();
            }
            String diagnostic = tail(stderrFile);
            if (exitCode == 0) {
                throw new JobFailureException("Child process reported success but wrote no output for "
                        + job.getLabel());
            }
            throw new JobFailureException("Child process exited with " + exitCode
                    + (diagnostic.isEmpty() ? "" : ": " + diagnostic));
        } catch (IOException e) {
            throw new JobFailureException("Could not launch child process for " + job.getLabel()
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobFailureException("Interrupted while processing " + job.getLabel(), e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            if (stderrFile != null) {
                deleteTemp(stderrFile);
            }
        }
    }

    private static String tail(Path file) {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - MAX_DIAGNOSTIC_LINES);
            return String.join(" | ", lines.subList(from, lines.size())).trim();
        } catch (IOException e) {
            return "(stderr unavailable: " + e.getMessage() + ")";
        }
    }

    private static void deleteTemp(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
