package com.ttennebkram.stylize.batch;

/**
 * Renders the progress line printed by the coordinating thread.
 * Prints only when the count has changed since the last call.
 */
public class ProgressReporter {

    private final ConsoleOutput console;
    private final int total;
    private int lastReported = -1;

    public ProgressReporter(ConsoleOutput console, int total) {
        this.console = console;
        this.total = total;
    }

    public void update(int completed) {
        if (completed == lastReported) {
            return;
        }
        lastReported = completed;
        console.printBlock(format(completed, total));
    }

    static String format(int completed, int total) {
        int percent = total == 0 ? 100 : (int) Math.round(completed * 100.0 / total);
        int width = 30;
        int filled = total == 0 ? width : (int) ((long) completed * width / total);
        StringBuilder bar = new StringBuilder();
        for (int i = 0; i < width; i++) {
            bar.append(i < filled ? '#' : '-');
        }
        return String.format("[batch] [%s] %d/%d (%d%%)", bar, completed, total, percent);
    }
}
