package com.ttennebkram.stylize.batch;

/**
 * Lifecycle of one batch run. States only move forward.
 */
public enum BatchState {
    IDLE,
    DISCOVERING,
    DISPATCHING,
    RUNNING,
    DRAINING,
    DONE
}
