package com.ttennebkram.stylize.batch;

import java.nio.file.Path;

/**
 * Result of one batch job: either saved to an output file, or failed with a reason.
 */
public final class JobOutcome {

    public enum Status {
        SAVED,
        FAILED
    }

    private final BatchJob job;
    private final Status status;
    private final Path outputPath;
    private final long elapsedMillis;
    private final String reason;
    private final Throwable cause;

    private JobOutcome(BatchJob job, Status status, Path outputPath, long elapsedMillis,
                       String reason, Throwable cause) {
        this.job = job;
        this.status = status;
        this.outputPath = outputPath;
        this.elapsedMillis = elapsedMillis;
        this.reason = reason;
        this.cause = cause;
    }

    public static JobOutcome saved(BatchJob job, Path outputPath, long elapsedMillis) {
        return new JobOutcome(job, Status.SAVED, outputPath, elapsedMillis, null, null);
    }

    public static JobOutcome failed(BatchJob job, String reason, Throwable cause) {
        return new JobOutcome(job, Status.FAILED, null, 0L, reason, cause);
    }

    public BatchJob getJob() {
        return job;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSaved() {
        return status == Status.SAVED;
    }

    /**
     * Written file, or null for a failed job.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * Failure reason, or null for a saved job.
     */
    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isSaved()
                ? "Saved(" + job.getLabel() + ", " + elapsedMillis + " ms)"
                : "Failed(" + job.getLabel() + ", " + reason + ")";
    }
}
