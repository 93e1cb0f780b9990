package eryxon.qrm.live;

import eryxon.qrm.error.QrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-threaded event loop of the live layer.
 *
 * Notification delivery, debounce timers, fetch completions and every cache
 * mutation run here, one at a time, so per-key state needs no locking.
 */
public class LiveLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveLoop.class);

    private final ScheduledExecutorService executor;
    private final Duration callTimeout;
    private volatile Thread loopThread;
    private volatile boolean running = true;

    public LiveLoop(Duration callTimeout) {
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "qrm-live-loop");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        // pending debounce timers must not fire once the loop is closing
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
        this.callTimeout = callTimeout;
    }

    /**
     * Scheduler backing the loop, for timers.
     */
    public ScheduledExecutorService scheduler() {
        return executor;
    }

    /**
     * Executor view of the loop, for hopping future completions onto it.
     */
    public Executor executor() {
        return this::execute;
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Queue a task. Failures are logged; tasks queued after {@link #close()} are dropped.
     */
    public void execute(Runnable task) {
        if (!running) {
            log.debug("Live loop closed, dropping task");
            return;
        }
        try {
            executor.execute(wrapRunnable(task));
        } catch (RejectedExecutionException e) {
            log.debug("Live loop shut down, dropping task");
        }
    }

    /**
     * Queue {@code task} and return its result as a future. Runs inline when
     * already on the loop. A closed loop fails the future.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (inLoop()) {
            complete(result, task);
            return result;
        }
        if (!running) {
            result.completeExceptionally(new QrmException("Live loop is closed"));
            return result;
        }
        try {
            executor.execute(() -> complete(result, task));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new QrmException("Live loop is closed", e));
        }
        return result;
    }

    /**
     * Wait up to the call timeout for a task queued with {@link #submit}. A task
     * that is late is not cancelled: it still runs once the loop reaches it.
     *
     * @throws QrmException if the task fails or the loop does not answer in time
     */
    public <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new QrmException("Live loop task failed", cause);
        } catch (TimeoutException e) {
            throw new QrmException("Live loop did not answer within " + callTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QrmException("Interrupted waiting for live loop", e);
        }
    }

    /**
     * Run {@code task} on the loop and wait for it. Runs inline when already on the loop.
     *
     * @throws QrmException if the task fails or the loop does not answer in time
     * @see #await(CompletableFuture)
     */
    public <T> T call(Callable<T> task) {
        if (inLoop()) {
            return callInline(task);
        }
        if (!running) {
            throw new QrmException("Live loop is closed");
        }
        return await(submit(task));
    }

    /**
     * Run {@code task} on the loop and wait for it.
     */
    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    private static <T> void complete(CompletableFuture<T> result, Callable<T> task) {
        try {
            result.complete(task.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
    }

    private static <T> T callInline(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new QrmException("Live loop task failed", e);
        }
    }

    /**
     * Stop the loop gracefully.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Live loop forcefully stopped");
            } else {
                log.info("Live loop stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable wrapRunnable(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Live loop task failed", e);
            }
        };
    }
}
