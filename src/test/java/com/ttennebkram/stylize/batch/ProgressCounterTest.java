package com.ttennebkram.stylize.batch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProgressCounterTest {

    @Test
    void increment_isAtomicAcrossThreads() throws InterruptedException {
        ProgressCounter counter = new ProgressCounter();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 1000; i++) {
                    counter.increment();
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(8000, counter.get());
    }

    @Test
    void increment_returnsNewValue() {
        ProgressCounter counter = new ProgressCounter();

        assertEquals(1, counter.increment());
        assertEquals(2, counter.increment());
    }
}
