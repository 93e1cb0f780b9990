package eryxon.qrm.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedDebouncerTest {

    private static final Duration WINDOW = Duration.ofMillis(100);

    private ScheduledExecutorService scheduler;
    private KeyedDebouncer<String> debouncer;

    @BeforeEach
    void setup() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        debouncer = new KeyedDebouncer<>(scheduler);
    }

    @AfterEach
    void teardown() {
        scheduler.shutdownNow();
    }

    @Test
    void burstRunsOnce() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        for (int i = 0; i < 10; i++) {
            debouncer.submit("k", WINDOW, runs::incrementAndGet);
            Thread.sleep(10);
        }
        assertTrue(debouncer.isArmed("k"));

        Thread.sleep(400);
        assertEquals(1, runs.get());
        assertFalse(debouncer.isArmed("k"));
    }

    @Test
    void spacedNotificationsRunEachTime() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            debouncer.submit("k", WINDOW, runs::incrementAndGet);
            Thread.sleep(350);
        }

        assertEquals(3, runs.get());
    }

    @Test
    void keysAreIndependent() throws Exception {
        AtomicInteger a = new AtomicInteger();
        AtomicInteger b = new AtomicInteger();

        debouncer.submit("a", WINDOW, a::incrementAndGet);
        debouncer.submit("b", WINDOW, b::incrementAndGet);
        assertEquals(2, debouncer.armedCount());

        Thread.sleep(400);
        assertEquals(1, a.get());
        assertEquals(1, b.get());
    }

    @Test
    void cancelledTimerNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        debouncer.submit("k", WINDOW, runs::incrementAndGet);
        assertTrue(debouncer.cancel("k"));
        assertFalse(debouncer.cancel("k"));

        Thread.sleep(300);
        assertEquals(0, runs.get());
    }

    @Test
    void cancelAllDisarmsEverything() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        debouncer.submit("a", WINDOW, runs::incrementAndGet);
        debouncer.submit("b", WINDOW, runs::incrementAndGet);

        debouncer.cancelAll();

        assertEquals(0, debouncer.armedCount());
        Thread.sleep(300);
        assertEquals(0, runs.get());
    }

    @Test
    void failingTaskDoesNotBreakLaterTimers() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        debouncer.submit("k", WINDOW, () -> {
            throw new IllegalStateException("boom");
        });
        Thread.sleep(300);

        debouncer.submit("k", WINDOW, runs::incrementAndGet);
        Thread.sleep(300);

        assertEquals(1, runs.get());
    }
}
