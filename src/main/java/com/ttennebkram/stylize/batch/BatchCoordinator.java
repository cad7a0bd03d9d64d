package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.config.ConfigurationLoader;
import com.ttennebkram.stylize.error.FatalIOException;
import com.ttennebkram.stylize.error.JobFailureException;
import com.ttennebkram.stylize.io.ImageFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies the transformation to every image in a directory using a fixed
 * pool of worker threads.
 *
 * Jobs go onto a bounded queue that the workers drain; each worker owns its
 * own {@link JobRunner}, so no pipeline state is shared. Outcomes come back on
 * a result queue while the coordinating thread sleeps between progress
 * updates. A failing job becomes a {@link JobOutcome#failed} entry and never
 * stops its worker or any other job.
 */
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final String TIMEOUT_REASON = "timeout";
    public static final String CANCELLED_REASON = "cancelled";

    private final BatchOptions options;
    private final JobRunnerFactory runnerFactory;
    private final ConsoleOutput console;
    private final ProgressCounter counter = new ProgressCounter();

    private volatile BatchState state = BatchState.IDLE;

    public BatchCoordinator(BatchOptions options) {
        this(options, defaultRunnerFactory(options), new ConsoleOutput());
    }

    public BatchCoordinator(BatchOptions options, JobRunnerFactory runnerFactory, ConsoleOutput console) {
        this.options = options;
        this.runnerFactory = runnerFactory;
        this.console = console;
    }

    public static JobRunnerFactory defaultRunnerFactory(BatchOptions options) {
        if (options.isSubprocess()) {
            return SubprocessJobRunner::new;
        }
        return () -> new InProcessJobRunner(options.getConfiguration());
    }

    public BatchState getState() {
        return state;
    }

    public ProgressCounter getProgress() {
        return counter;
    }

    /**
     * Discover the input images and process them all.
     *
     * @throws com.ttennebkram.stylize.error.DiscoveryException if the input directory is missing
     * @throws FatalIOException if the output directory cannot be created
     */
    public BatchReport run() {
        state = BatchState.DISCOVERING;
        List<Path> images = ImageDiscovery.discover(options.getInputDir());
        if (images.isEmpty()) {
            log.warn("No supported images found in {}", options.getInputDir());
            console.printBlock("[batch] No images found in " + options.getInputDir());
            state = BatchState.DONE;
            return new BatchReport(new ArrayList<>(), counter.get(), state, true);
        }
        log.info("Found {} image(s) in {}", images.size(), options.getInputDir());

        try {
            Files.createDirectories(options.getOutputDir());
        } catch (IOException e) {
            throw new FatalIOException("Cannot create output directory " + options.getOutputDir()
                    + ": " + e.getMessage(), e);
        }

        Path tempConfig = null;
        Path configPath = options.getConfigPath();
        if (options.isSubprocess() && configPath == null) {
            tempConfig = writeConfigForChildren();
            configPath = tempConfig;
        }
        try {
            List<BatchJob> jobs = planJobs(images, configPath);
            List<JobOutcome> outcomes = batch(jobs);
            return new BatchReport(outcomes, counter.get(), state, false);
        } finally {
            if (tempConfig != null) {
                try {
                    Files.deleteIfExists(tempConfig);
                } catch (IOException e) {
                    log.warn("Could not delete temporary configuration {}: {}", tempConfig, e.getMessage());
                }
            }
        }
    }

    private Path writeConfigForChildren() {
        try {
            Path file = Files.createTempFile("stylize-config-", ".json");
            ConfigurationLoader.save(options.getConfiguration(), file);
            return file;
        } catch (IOException e) {
            throw new FatalIOException("Cannot write configuration for child processes: " + e.getMessage(), e);
        }
    }

    /**
     * One job per image and variation. With several variations, outputs are
     * named {@code stem_vN} and seeded with base seed + N. Inputs sharing a
     * stem ({@code photo.png}, {@code photo.jpg}) keep their extension in the
     * output name ({@code photo_png}, {@code photo_jpg}) so no two jobs write
     * the same file.
     */
    List<BatchJob> planJobs(List<Path> images, Path configPath) {
        int variations = options.getVariations();
        Long baseSeed = options.getBaseSeed() != null ? options.getBaseSeed()
                : options.getConfiguration().getRandomSeed();
        String extension = options.getConfiguration().getOutputFormat().getExtension();

        Map<String, Integer> stemCounts = new HashMap<>();
        for (Path image : images) {
            stemCounts.merge(ImageFiles.stem(image).toLowerCase(Locale.ROOT), 1, Integer::sum);
        }

        Set<String> plannedNames = new HashSet<>();
        List<BatchJob> jobs = new ArrayList<>();
        for (Path image : images) {
            String stem = ImageFiles.stem(image);
            if (stemCounts.get(stem.toLowerCase(Locale.ROOT)) > 1) {
                String inputExtension = ImageFiles.extension(image);
                stem = stem + "_" + (inputExtension == null ? "" : inputExtension.toLowerCase(Locale.ROOT));
            }
            for (int n = 1; n <= variations; n++) {
                String name = uniqueName(variations > 1 ? stem + "_v" + n : stem, extension, plannedNames);
                Long seed;
                if (variations > 1) {
                    seed = (baseSeed != null ? baseSeed : 0L) + n;
                } else {
                    seed = baseSeed;
                }
                jobs.add(new BatchJob(image, options.getOutputDir().resolve(name + extension),
                        options.getEffectName(), options.getPresetName(), configPath, seed));
            }
        }
        return jobs;
    }

    private static String uniqueName(String name, String extension, Set<String> plannedNames) {
        String candidate = name;
        int suffix = 2;
        while (!plannedNames.add((candidate + extension).toLowerCase(Locale.ROOT))) {
            candidate = name + "_" + suffix++;
        }
        if (!candidate.equals(name)) {
            log.warn("Output name {}{} is already taken, using {}{}", name, extension, candidate, extension);
        }
        return candidate;
    }

    /**
     * Process the given jobs and return one outcome per job, in completion order.
     */
    public List<JobOutcome> batch(List<BatchJob> jobs) {
        List<JobOutcome> outcomes = new ArrayList<>();
        int total = jobs.size();
        if (total == 0) {
            state = BatchState.DONE;
            return outcomes;
        }

        state = BatchState.DISPATCHING;
        BlockingQueue<BatchJob> jobQueue = new ArrayBlockingQueue<>(total);
        jobQueue.addAll(jobs);
        BlockingQueue<JobOutcome> results = new LinkedBlockingQueue<>();

        int workerCount = Math.min(options.getParallelism(), total);
        List<Thread> workers = new ArrayList<>();
        for (int i = 0; i < workerCount; i++) {
            Thread thread = new Thread(new Worker(jobQueue, results), "stylize-worker-" + (i + 1));
            thread.setDaemon(true);
            workers.add(thread);
        }
        log.info("Processing {} job(s) with {} worker(s)", total, workerCount);
        for (Thread thread : workers) {
            thread.start();
        }
        state = BatchState.RUNNING;

        ProgressReporter reporter = new ProgressReporter(console, total);
        long pollMillis = options.getPollInterval().toMillis();
        boolean interrupted = false;
        while (counter.get() < total) {
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                interrupted = true;
                log.warn("Batch interrupted, cancelling remaining jobs");
                for (Thread thread : workers) {
                    thread.interrupt();
                }
                cancelQueued(jobQueue, results, CANCELLED_REASON);
                break;
            }
            results.drainTo(outcomes);
            reporter.update(counter.get());
            if (allStopped(workers) && counter.get() < total) {
                log.error("All workers stopped with {} job(s) unfinished", total - counter.get());
                cancelQueued(jobQueue, results, "worker terminated");
            }
        }

        state = BatchState.DRAINING;
        for (Thread thread : workers) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        results.drainTo(outcomes);
        reporter.update(counter.get());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        state = BatchState.DONE;
        int saved = 0;
        for (JobOutcome outcome : outcomes) {
            if (outcome.isSaved()) saved++;
        }
        log.info("Batch finished: {} saved, {} failed", saved, outcomes.size() - saved);
        return outcomes;
    }

    private void cancelQueued(BlockingQueue<BatchJob> jobQueue, BlockingQueue<JobOutcome> results, String reason) {
        BatchJob job;
        while ((job = jobQueue.poll()) != null) {
            results.add(JobOutcome.failed(job, reason, null));
            counter.increment();
        }
    }

    private static boolean allStopped(List<Thread> workers) {
        for (Thread thread : workers) {
            if (thread.isAlive()) return false;
        }
        return true;
    }

    /**
     * Drains the job queue with its own runner. Records exactly one outcome per job taken.
     */
    private class Worker implements Runnable {

        private final BlockingQueue<BatchJob> jobQueue;
        private final BlockingQueue<JobOutcome> results;
        private JobRunner runner;
        private ExecutorService executor;

        Worker(BlockingQueue<BatchJob> jobQueue, BlockingQueue<JobOutcome> results) {
            this.jobQueue = jobQueue;
            this.results = results;
        }

        @Override
        public void run() {
            try {
                BatchJob job;
                while (!Thread.currentThread().isInterrupted() && (job = jobQueue.poll()) != null) {
                    JobOutcome outcome = null;
                    try {
                        outcome = execute(job);
                    } catch (InterruptedException e) {
                        outcome = JobOutcome.failed(job, CANCELLED_REASON, e);
                        Thread.currentThread().interrupt();
                    } catch (Exception | LinkageError e) {
                        outcome = JobOutcome.failed(job, describe(e), e);
                    } finally {
                        if (outcome == null) {
                            outcome = JobOutcome.failed(job, "worker error", null);
                        }
                        record(outcome);
                    }
                }
            } finally {
                closeRunner();
                if (executor != null) {
                    executor.shutdownNow();
                }
            }
        }

        private JobOutcome execute(BatchJob job) throws InterruptedException {
            long start = System.currentTimeMillis();
            if (runner == null) {
                runner = runnerFactory.create();
            }
            Path output;
            if (options.getJobTimeout() == null) {
                output = runner.run(job);
            } else {
                output = runWithTimeout(job);
                if (output == null) {
                    return JobOutcome.failed(job, TIMEOUT_REASON, null);
                }
            }
            return JobOutcome.saved(job, output, System.currentTimeMillis() - start);
        }

        private Path runWithTimeout(BatchJob job) throws InterruptedException {
            if (executor == null) {
                executor = Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, Thread.currentThread().getName() + "-job");
                    t.setDaemon(true);
                    return t;
                });
            }
            final JobRunner current = runner;
            final Attempt attempt = new Attempt();
            Future<Path> future = executor.submit(() -> {
                if (!attempt.start()) {
                    return null;
                }
                try {
                    return current.run(job);
                } finally {
                    if (attempt.finish()) {
                        discardAbandoned(job, current);
                    }
                }
            });
            try {
                return future.get(options.getJobTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.error("Job {} exceeded {} ms, abandoning it", job.getLabel(), options.getJobTimeout().toMillis());
                abandon(job, future, attempt);
                return null;
            } catch (InterruptedException e) {
                log.warn("Job {} cancelled", job.getLabel());
                abandon(job, future, attempt);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new JobFailureException(describe(cause), cause);
            }
        }

        /**
         * Give up on a running job. Whichever of this thread and the job thread
         * finishes last deletes the job's output and closes its runner; the
         * worker continues with a fresh executor and runner.
         */
        private void abandon(BatchJob job, Future<Path> future, Attempt attempt) {
            JobRunner current = runner;
            future.cancel(true);
            executor.shutdownNow();
            executor = null;
            runner = null;
            if (attempt.abandon()) {
                discardAbandoned(job, current);
            }
        }

        private void record(JobOutcome outcome) {
            if (outcome.isSaved()) {
                console.printBlock("[batch] Saved " + outcome.getJob().getLabel()
                        + " (" + outcome.getElapsedMillis() + " ms)");
            } else {
                log.error("Job {} failed: {}", outcome.getJob(), outcome.getReason(), outcome.getCause());
                console.printErrorBlock("[batch] FAILED " + outcome.getJob().getLabel(),
                        "        " + outcome.getReason());
            }
            results.add(outcome);
            counter.increment();
        }

        private void closeRunner() {
            closeQuietly(runner);
            runner = null;
        }
    }

    /**
     * Hand-off between a worker and the thread running its job under a timeout.
     * {@link #abandon()} and {@link #finish()} return true to exactly one caller,
     * the one that must clean up after an abandoned job.
     */
    private static final class Attempt {
        private boolean started;
        private boolean finished;
        private boolean abandoned;

        synchronized boolean start() {
            if (abandoned) {
                return false;
            }
            started = true;
            return true;
        }

        synchronized boolean finish() {
            finished = true;
            return abandoned;
        }

        synchronized boolean abandon() {
            abandoned = true;
            return finished || !started;
        }
    }

    private static void discardAbandoned(BatchJob job, JobRunner runner) {
        try {
            if (Files.deleteIfExists(job.getOutputPath())) {
                log.warn("Removed output of abandoned job {}", job.getLabel());
            }
        } catch (IOException e) {
            log.warn("Could not remove output of abandoned job {}: {}", job.getLabel(), e.getMessage());
        }
        closeQuietly(runner);
    }

    private static void closeQuietly(JobRunner runner) {
        if (runner == null) {
            return;
        }
        try {
            runner.close();
        } catch (RuntimeException e) {
            log.warn("Error closing job runner: {}", e.toString());
        }
    }

    static String describe(Throwable e) {
        if (e instanceof JobFailureException && e.getMessage() != null) {
            return e.getMessage();
        }
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }
}
