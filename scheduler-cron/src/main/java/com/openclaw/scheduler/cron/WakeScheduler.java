package com.openclaw.scheduler.cron;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One-shot delayed task source for the wake timer.
 */
public interface WakeScheduler {

    /** Handle to a pending wake. */
    interface Handle {
        void cancel();
    }

    Handle schedule(Runnable task, long delayMs);

    default void shutdown() {
    }

    /**
     * Executor-backed scheduler with two daemon threads, so a watchdog wake
     * can still fire while a tick occupies the other thread.
     */
    static WakeScheduler executorBacked() {
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "cron-timer");
            t.setDaemon(true);
            return t;
        });
        return new WakeScheduler() {
            @Override
            public Handle schedule(Runnable task, long delayMs) {
                ScheduledFuture<?> future = executor.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
                return () -> future.cancel(false);
            }

            @Override
            public void shutdown() {
                executor.shutdownNow();
            }
        };
    }
}
