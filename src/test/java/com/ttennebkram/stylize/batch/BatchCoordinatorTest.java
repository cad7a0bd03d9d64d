package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.config.OutputFormat;
import com.ttennebkram.stylize.error.DiscoveryException;
import com.ttennebkram.stylize.error.JobFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchCoordinatorTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ConsoleOutput console;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("in"));
        outputDir = tempDir.resolve("out");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        console = new ConsoleOutput(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_processesEveryImage() throws IOException {
        createInputs(5);
        BatchCoordinator coordinator = new BatchCoordinator(options(3).build(), CopyRunner::new, console);

        BatchReport report = coordinator.run();

        assertEquals(5, report.getOutcomes().size());
        assertEquals(5, report.getSavedCount());
        assertEquals(5, report.getCompletedCount());
        assertEquals(5, coordinator.getProgress().get());
        assertEquals(BatchState.DONE, coordinator.getState());
        for (int i = 0; i < 5; i++) {
            assertTrue(Files.exists(outputDir.resolve("img" + i + ".png")));
        }
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("5/5 (100%)"));
    }

    @Test
    void run_failingJobsDoNotStopTheBatch() throws IOException {
        createInputs(6);
        JobRunnerFactory factory = () -> job -> {
            String name = job.getInputPath().getFileName().toString();
            if (name.startsWith("img1") || name.startsWith("img4")) {
                throw new JobFailureException("cannot process " + name);
            }
            if (name.startsWith("img2")) {
                throw new MissingNativeLibraryError();
            }
            return writeOutput(job);
        };
        BatchCoordinator coordinator = new BatchCoordinator(options(2).build(), factory, console);

        BatchReport report = coordinator.run();

        assertEquals(6, report.getOutcomes().size());
        assertEquals(3, report.getSavedCount());
        assertEquals(3, report.getFailedCount());
        Set<Path> seen = new HashSet<>();
        for (JobOutcome outcome : report.getOutcomes()) {
            assertTrue(seen.add(outcome.getJob().getInputPath()), "duplicate outcome for " + outcome.getJob());
        }
        String errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("[batch] FAILED img1.png"));
        assertTrue(errors.contains("cannot process img4.png"));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 16})
    void run_anyPoolSizeCompletesAllJobs(int parallelism) throws IOException {
        createInputs(4);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        JobRunnerFactory factory = () -> job -> {
            threads.add(Thread.currentThread().getName());
            return writeOutput(job);
        };

        BatchReport report = new BatchCoordinator(options(parallelism).build(), factory, console).run();

        assertEquals(4, report.getSavedCount());
        assertTrue(threads.size() <= Math.min(parallelism, 4));
    }

    @Test
    void run_eachWorkerOwnsAndClosesItsRunner() throws IOException {
        createInputs(8);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger closed = new AtomicInteger();
        JobRunnerFactory factory = () -> {
            created.incrementAndGet();
            return new CopyRunner() {
                @Override
                public void close() {
                    closed.incrementAndGet();
                }
            };
        };

        new BatchCoordinator(options(3).build(), factory, console).run();

        assertTrue(created.get() >= 1 && created.get() <= 3);
        assertEquals(created.get(), closed.get());
    }

    @Test
    void run_emptyDirectoryFinishesWithWarning() {
        BatchCoordinator coordinator = new BatchCoordinator(options(2).build(), CopyRunner::new, console);

        BatchReport report = coordinator.run();

        assertTrue(report.isEmptyDiscovery());
        assertTrue(report.getOutcomes().isEmpty());
        assertEquals(BatchState.DONE, report.getState());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("No images found"));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void run_missingDirectoryThrows() {
        BatchOptions options = BatchOptions.builder()
                .inputDir(tempDir.resolve("missing"))
                .outputDir(outputDir)
                .configuration(Configuration.defaults())
                .build();

        assertThrows(DiscoveryException.class,
                () -> new BatchCoordinator(options, CopyRunner::new, console).run());
    }

    @Test
    void run_slowJobTimesOutAndBatchContinues() throws IOException {
        createInputs(3);
        JobRunnerFactory factory = () -> job -> {
            if (job.getInputPath().getFileName().toString().startsWith("img0")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JobFailureException("interrupted", e);
                }
            }
            return writeOutput(job);
        };
        BatchOptions options = options(1).jobTimeout(Duration.ofMillis(300)).build();

        BatchReport report = new BatchCoordinator(options, factory, console).run();

        assertEquals(3, report.getOutcomes().size());
        assertEquals(2, report.getSavedCount());
        JobOutcome failure = report.getFailures().get(0);
        assertEquals("img0.png", failure.getJob().getInputPath().getFileName().toString());
        assertEquals(BatchCoordinator.TIMEOUT_REASON, failure.getReason());
        assertEquals(JobOutcome.Status.FAILED, failure.getStatus());
    }

    @Test
    void run_abandonedJobLeavesNoOutputAndClosesItsRunner() throws Exception {
        createInputs(2);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger closed = new AtomicInteger();
        CountDownLatch slowRunnerClosed = new CountDownLatch(1);
        JobRunnerFactory factory = () -> {
            created.incrementAndGet();
            return new JobRunner() {
                private boolean ranSlowJob;

                @Override
                public Path run(BatchJob job) {
                    if (job.getInputPath().getFileName().toString().startsWith("img0")) {
                        ranSlowJob = true;
                        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
                        while (System.nanoTime() < until) {
                            Thread.onSpinWait();
                        }
                    }
                    return writeOutput(job);
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                    if (ranSlowJob) {
                        slowRunnerClosed.countDown();
                    }
                }
            };
        };
        BatchOptions options = options(1).jobTimeout(Duration.ofMillis(200)).build();

        BatchReport report = new BatchCoordinator(options, factory, console).run();

        assertEquals(1, report.getSavedCount());
        assertEquals(BatchCoordinator.TIMEOUT_REASON, report.getFailures().get(0).getReason());
        assertTrue(slowRunnerClosed.await(5, TimeUnit.SECONDS));
        assertFalse(Files.exists(outputDir.resolve("img0.png")));
        assertTrue(Files.exists(outputDir.resolve("img1.png")));
        assertEquals(2, created.get());
        assertEquals(created.get(), closed.get());
    }

    @Test
    void run_interruptCancelsRunningAndQueuedJobs() throws Exception {
        createInputs(3);
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        JobRunnerFactory factory = () -> job -> {
            runs.incrementAndGet();
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobFailureException("interrupted", e);
            }
            return writeOutput(job);
        };
        BatchOptions options = options(1).jobTimeout(Duration.ofSeconds(30)).build();
        BatchCoordinator coordinator = new BatchCoordinator(options, factory, console);
        AtomicReference<BatchReport> report = new AtomicReference<>();
        AtomicBoolean interruptKept = new AtomicBoolean();

        Thread batchThread = new Thread(() -> {
            report.set(coordinator.run());
            interruptKept.set(Thread.currentThread().isInterrupted());
        });
        batchThread.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        batchThread.interrupt();
        batchThread.join(5_000);

        assertFalse(batchThread.isAlive());
        assertEquals(3, report.get().getOutcomes().size());
        assertEquals(3, report.get().getFailedCount());
        for (JobOutcome outcome : report.get().getOutcomes()) {
            assertEquals(BatchCoordinator.CANCELLED_REASON, outcome.getReason());
        }
        assertEquals(1, runs.get());
        assertTrue(interruptKept.get());
        assertEquals(BatchState.DONE, coordinator.getState());
    }

    @Test
    void planJobs_inputsSharingAStemGetDistinctOutputs() throws IOException {
        Files.writeString(inputDir.resolve("photo.png"), "png");
        Files.writeString(inputDir.resolve("photo.jpg"), "jpg");
        Files.writeString(inputDir.resolve("other.png"), "other");
        BatchCoordinator coordinator = new BatchCoordinator(options(2).build(), CopyRunner::new, console);

        List<BatchJob> jobs = coordinator.planJobs(ImageDiscovery.discover(inputDir), null);

        assertEquals(List.of("other.png", "photo_jpg.png", "photo_png.png"),
                List.of(jobs.get(0).getLabel(), jobs.get(1).getLabel(), jobs.get(2).getLabel()));
    }

    @Test
    void planJobs_disambiguatedNameCollidingWithRealStemGetsCounter() throws IOException {
        Files.writeString(inputDir.resolve("photo.png"), "png");
        Files.writeString(inputDir.resolve("photo.jpg"), "jpg");
        Files.writeString(inputDir.resolve("photo_jpg.bmp"), "bmp");
        BatchCoordinator coordinator = new BatchCoordinator(options(2).build(), CopyRunner::new, console);

        List<BatchJob> jobs = coordinator.planJobs(ImageDiscovery.discover(inputDir), null);

        Set<Path> outputs = new HashSet<>();
        for (BatchJob job : jobs) {
            outputs.add(job.getOutputPath());
        }
        assertEquals(3, outputs.size());
    }

    @Test
    void run_inputsSharingAStemAllWriteOutputs() throws IOException {
        Files.writeString(inputDir.resolve("photo.png"), "png");
        Files.writeString(inputDir.resolve("photo.jpg"), "jpg");

        BatchReport report = new BatchCoordinator(options(2).build(), CopyRunner::new, console).run();

        assertEquals(2, report.getSavedCount());
        assertTrue(Files.exists(outputDir.resolve("photo_png.png")));
        assertTrue(Files.exists(outputDir.resolve("photo_jpg.png")));
    }

    @Test
    void planJobs_variationsGetSuffixAndSeed() throws IOException {
        createInputs(2);
        BatchOptions options = options(2).variations(3).baseSeed(100L).build();
        BatchCoordinator coordinator = new BatchCoordinator(options, CopyRunner::new, console);

        List<BatchJob> jobs = coordinator.planJobs(ImageDiscovery.discover(inputDir), null);

        assertEquals(6, jobs.size());
        assertEquals("img0_v1.png", jobs.get(0).getLabel());
        assertEquals(101L, jobs.get(0).getVariationSeed());
        assertEquals("img0_v3.png", jobs.get(2).getLabel());
        assertEquals(103L, jobs.get(2).getVariationSeed());
        assertEquals("img1_v1.png", jobs.get(3).getLabel());
    }

    @Test
    void planJobs_singleVariationKeepsStemAndConfiguredFormat() throws IOException {
        createInputs(1);
        Configuration config = Configuration.builder().outputFormat(OutputFormat.JPEG).build();
        BatchOptions options = BatchOptions.builder()
                .inputDir(inputDir).outputDir(outputDir).configuration(config).build();

        List<BatchJob> jobs = new BatchCoordinator(options, CopyRunner::new, console)
                .planJobs(ImageDiscovery.discover(inputDir), null);

        assertEquals(1, jobs.size());
        assertEquals(outputDir.resolve("img0.jpg"), jobs.get(0).getOutputPath());
        assertNull(jobs.get(0).getVariationSeed());
    }

    @Test
    void batch_noJobsIsDone() {
        BatchCoordinator coordinator = new BatchCoordinator(options(2).build(), CopyRunner::new, console);

        assertTrue(coordinator.batch(new ArrayList<>()).isEmpty());
        assertEquals(BatchState.DONE, coordinator.getState());
    }

    @Test
    void options_rejectInvalidCounts() {
        assertThrows(IllegalArgumentException.class, () -> options(0).build());
        assertThrows(IllegalArgumentException.class, () -> options(1).variations(0).build());
        assertThrows(IllegalArgumentException.class, () -> options(1).jobTimeout(Duration.ZERO).build());
    }

    private BatchOptions.Builder options(int parallelism) {
        return BatchOptions.builder()
                .inputDir(inputDir)
                .outputDir(outputDir)
                .configuration(Configuration.defaults())
                .parallelism(parallelism)
                .pollInterval(Duration.ofMillis(10));
    }

    private void createInputs(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            Files.writeString(inputDir.resolve("img" + i + ".png"), "image " + i);
        }
        Files.writeString(inputDir.resolve("notes.txt"), "ignored");
    }

    private static Path writeOutput(BatchJob job) {
        try {
            Files.createDirectories(job.getOutputPath().getParent());
            Files.copy(job.getInputPath(), job.getOutputPath());
            return job.getOutputPath();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static class CopyRunner implements JobRunner {
        @Override
        public Path run(BatchJob job) {
            return writeOutput(job);
        }
    }

    private static class MissingNativeLibraryError extends LinkageError {
        MissingNativeLibraryError() {
            super("native library missing");
        }
    }
}
