package eryxon.qrm.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-key trailing debounce. Each {@link #submit} re-arms the key's timer; the
 * task runs once the key has been quiet for the whole window. At most one timer
 * is armed per key.
 *
 * Timers run on the supplied scheduler. A timer that was replaced or cancelled
 * never runs its task, even if the scheduler already dequeued it.
 */
public final class KeyedDebouncer<K> {

    private static final Logger log = LoggerFactory.getLogger(KeyedDebouncer.class);

    private final ScheduledExecutorService scheduler;
    private final Map<K, Timer> timers = new HashMap<>();

    public KeyedDebouncer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Arm or re-arm the timer for {@code key}.
     */
    public synchronized void submit(K key, Duration window, Runnable task) {
        Timer previous = timers.remove(key);
        if (previous != null) {
            previous.future.cancel(false);
        }
        Timer timer = new Timer(key, task);
        timers.put(key, timer);
        timer.future = scheduler.schedule(timer, window.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Disarm the timer for {@code key} without running it.
     *
     * @return true if a timer was armed
     */
    public synchronized boolean cancel(K key) {
        Timer timer = timers.remove(key);
        if (timer == null) {
            return false;
        }
        timer.future.cancel(false);
        return true;
    }

    public synchronized boolean isArmed(K key) {
        return timers.containsKey(key);
    }

    public synchronized int armedCount() {
        return timers.size();
    }

    /** Disarm every timer. */
    public synchronized void cancelAll() {
        timers.values().forEach(t -> t.future.cancel(false));
        timers.clear();
    }

    private final class Timer implements Runnable {
        private final K key;
        private final Runnable task;
        private ScheduledFuture<?> future;

        Timer(K key, Runnable task) {
            this.key = key;
            this.task = task;
        }

        @Override
        public void run() {
            synchronized (KeyedDebouncer.this) {
                if (timers.get(key) != this) {
                    return;
                }
                timers.remove(key);
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Debounced task for {} failed", key, e);
            }
        }
    }
}
