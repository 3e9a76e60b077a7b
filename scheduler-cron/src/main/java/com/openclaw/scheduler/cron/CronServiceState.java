package com.openclaw.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable scheduler state owned by one {@link CronService}: the cached job
 * store, the single wake-timer handle, the tick flag and the lock that
 * serializes every store load/mutate/persist.
 */
@Slf4j
public class CronServiceState {

    /** Store work executed under the lock. */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    private final CronState.CronServiceDeps deps;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object timerMonitor = new Object();
    private final WakeScheduler wakeScheduler;
    private final boolean ownsWakeScheduler;
    private final ExecutorService executor;
    private final CronSessionReaper sessionReaper = new CronSessionReaper();

    private volatile CronTypes.CronStoreFile store;
    private WakeScheduler.Handle timer;

    public CronServiceState(CronState.CronServiceDeps deps) {
        this.deps = deps;
        this.ownsWakeScheduler = deps.getWakeScheduler() == null;
        this.wakeScheduler = ownsWakeScheduler ? WakeScheduler.executorBacked() : deps.getWakeScheduler();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cron-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public CronState.CronServiceDeps deps() {
        return deps;
    }

    public long nowMs() {
        return deps.getNowMs().getAsLong();
    }

    public CronTypes.CronStoreFile store() {
        return store;
    }

    void setStore(CronTypes.CronStoreFile store) {
        this.store = store;
    }

    AtomicBoolean running() {
        return running;
    }

    ExecutorService executor() {
        return executor;
    }

    CronSessionReaper sessionReaper() {
        return sessionReaper;
    }

    /**
     * Run {@code action} inside the process-wide store lock.
     */
    public <T> T locked(LockedAction<T> action) throws IOException {
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    /** Same lock as {@link #locked}, for work that does no store I/O. */
    void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    boolean isLockedByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    // =========================================================================
    // Timer handle
    // =========================================================================

    /**
     * Replace the armed wake with a new one.
     */
    void replaceTimer(Runnable task, long delayMs) {
        synchronized (timerMonitor) {
            if (timer != null) {
                timer.cancel();
            }
            timer = wakeScheduler.schedule(task, delayMs);
        }
    }

    void clearTimer() {
        synchronized (timerMonitor) {
            if (timer != null) {
                timer.cancel();
            }
            timer = null;
        }
    }

    boolean hasTimer() {
        synchronized (timerMonitor) {
            return timer != null;
        }
    }

    void shutdown() {
        clearTimer();
        if (ownsWakeScheduler) {
            wakeScheduler.shutdown();
        }
        executor.shutdownNow();
    }
}
