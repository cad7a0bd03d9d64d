package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.error.JobFailureException;

import java.nio.file.Path;

/**
 * Executes batch jobs for one worker. A runner is used by a single thread.
 */
public interface JobRunner extends AutoCloseable {

    /**
     * Process one job and write its output.
     *
     * @return the written output file
     * @throws JobFailureException if the job could not produce an output
     */
    Path run(BatchJob job);

    @Override
    default void close() {
    }
}
