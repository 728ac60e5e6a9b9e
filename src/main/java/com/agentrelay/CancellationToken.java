package com.agentrelay;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal for one unit of work. It can be polled, awaited, or observed with
 * callbacks; a callback registered after cancellation runs immediately on the caller.
 */
public class CancellationToken {

    private final String taskKey;
    private final CountDownLatch signal = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public CancellationToken(String taskKey) {
        this.taskKey = taskKey;
    }

    public String getTaskKey() {
        return taskKey;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel the token and run its callbacks outside the token's lock.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        signal.countDown();
        for (Runnable callback : toRun) {
            callback.run();
        }
        return true;
    }

    /**
     * Register a callback that runs once when the token is cancelled.
     *
     * @return handle that unregisters the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    /**
     * Block until cancelled or until the timeout elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return signal.await(timeout, unit);
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new TaskCancelledException(taskKey);
        }
    }

    /**
     * Callback registration; closing it never throws.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
