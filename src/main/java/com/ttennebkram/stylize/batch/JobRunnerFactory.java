package com.ttennebkram.stylize.batch;

/**
 * Creates one {@link JobRunner} per worker, so workers share no pipeline state.
 */
@FunctionalInterface
public interface JobRunnerFactory {

    JobRunner create();
}
