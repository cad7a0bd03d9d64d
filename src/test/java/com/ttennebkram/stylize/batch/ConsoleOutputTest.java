package com.ttennebkram.stylize.batch;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleOutputTest {

    @Test
    void printBlock_blocksFromConcurrentWritersDoNotInterleave() throws InterruptedException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        ConsoleOutput console = new ConsoleOutput(stream, stream);

        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final String id = "w" + t;
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    console.printBlock(id + " begin", id + " middle", id + " end");
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(4 * 50 * 3, lines.length);
        for (int i = 0; i < lines.length; i += 3) {
            String id = lines[i].substring(0, 2);
            assertEquals(id + " begin", lines[i]);
            assertEquals(id + " middle", lines[i + 1]);
            assertEquals(id + " end", lines[i + 2]);
        }
        assertFalse(console.isLocked());
    }

    @Test
    void printErrorBlock_writesToErrorStream() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ConsoleOutput console = new ConsoleOutput(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        console.printErrorBlock("bad", "worse");

        assertEquals(0, out.size());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("bad"));
    }

    @Test
    void progressFormat_showsBarAndPercent() {
        assertEquals("[batch] [###############---------------] 5/10 (50%)", ProgressReporter.format(5, 10));
        assertEquals("[batch] [------------------------------] 0/3 (0%)", ProgressReporter.format(0, 3));
        assertTrue(ProgressReporter.format(3, 3).endsWith("3/3 (100%)"));
    }
}
