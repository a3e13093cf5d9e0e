package com.wmskiosk.application.reader;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ScanQueueTest {

    @Test
    void popsInArrivalOrder() {
        ScanQueue<String> queue = new ScanQueue<>(3);
        queue.push("a");
        queue.push("b");

        assertEquals(Optional.of("a"), queue.tryPop());
        assertEquals(Optional.of("b"), queue.tryPop());
        assertEquals(Optional.empty(), queue.tryPop());
    }

    @Test
    void pushIntoFullQueueEvictsOldest() {
        ScanQueue<Integer> queue = new ScanQueue<>();
        for (int i = 1; i <= ScanQueue.DEFAULT_CAPACITY; i++) {
            assertTrue(queue.push(i).isEmpty());
        }

        assertEquals(Optional.of(1), queue.push(11));
        assertEquals(Optional.of(2), queue.push(12));
        assertEquals(ScanQueue.DEFAULT_CAPACITY, queue.size());

        for (int expected = 3; expected <= 12; expected++) {
            assertEquals(Optional.of(expected), queue.tryPop());
        }
        assertEquals(0, queue.size());
    }

    @Test
    void popTimesOutOnEmptyQueue() {
        ScanQueue<String> queue = new ScanQueue<>(2);

        long start = System.nanoTime();
        Optional<String> item = queue.pop(Duration.ofMillis(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(item.isEmpty());
        assertTrue(elapsedMs >= 40, "pop devolvió antes del timeout: " + elapsedMs + " ms");
    }

    @Test
    void popWakesUpWhenAnotherThreadPushes() throws Exception {
        ScanQueue<String> queue = new ScanQueue<>(2);
        CountDownLatch waiting = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                waiting.await();
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            queue.push("CARD0001");
        });
        producer.start();

        waiting.countDown();
        assertEquals(Optional.of("CARD0001"), queue.pop(Duration.ofSeconds(2)));
        producer.join(1000);
    }

    @Test
    void interruptedPopReturnsEmptyAndKeepsFlag() {
        ScanQueue<String> queue = new ScanQueue<>(2);
        Thread.currentThread().interrupt();
        try {
            assertTrue(queue.pop(Duration.ofSeconds(1)).isEmpty());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void clearEmptiesQueue() {
        ScanQueue<String> queue = new ScanQueue<>(2);
        queue.push("a");
        queue.push("b");

        queue.clear();

        assertEquals(0, queue.size());
        assertEquals(2, queue.capacity());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ScanQueue<String>(0));
    }
}
