package com.ttennebkram.stylize.batch;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Console shared by concurrent workers. A block of lines is written while
 * holding one lock, so blocks from different workers never interleave.
 */
public class ConsoleOutput {

    private final PrintStream out;
    private final PrintStream err;
    private final ReentrantLock lock = new ReentrantLock();

    public ConsoleOutput() {
        this(System.out, System.err);
    }

    public ConsoleOutput(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void printBlock(List<String> lines) {
        write(out, lines);
    }

    public void printBlock(String... lines) {
        write(out, Arrays.asList(lines));
    }

    public void printErrorBlock(List<String> lines) {
        write(err, lines);
    }

    public void printErrorBlock(String... lines) {
        write(err, Arrays.asList(lines));
    }

    private void write(PrintStream stream, List<String> lines) {
        lock.lock();
        try {
            for (String line : lines) {
                stream.println(line);
            }
            stream.flush();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True while some thread is writing. Exposed for tests.
     */
    boolean isLocked() {
        return lock.isLocked();
    }
}
