package com.ttennebkram.stylize.batch;

/**
 * Number of finished jobs, shared by all workers.
 * Writes happen under a lock; reads never block.
 */
public class ProgressCounter {

    private final Object lock = new Object();
    private volatile int value;

    /**
     * Record one finished job.
     *
     * @return the new count
     */
    public int increment() {
        synchronized (lock) {
            value = value + 1;
            return value;
        }
    }

    public int get() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
