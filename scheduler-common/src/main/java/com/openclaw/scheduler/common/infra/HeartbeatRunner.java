package com.openclaw.scheduler.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Heartbeat runner: periodically invokes a heartbeat action and serves
 * on-demand heartbeat requests. Only one heartbeat executes at a time; a
 * synchronous attempt made while another is in flight reports
 * {@code skipped / requests-in-flight}.
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    public static final String REASON_IN_FLIGHT = "requests-in-flight";
    private static final long MIN_INTERVAL_MS = 1_000;
    private static final long BUSY_RETRY_DELAY_MS = 1_000;

    /**
     * A heartbeat request. {@code target} selects where the reply goes
     * ("last" = last active channel); null keeps the configured default.
     */
    public record Request(String reason, String agentId, String sessionKey, String target) {

        public static Request of(String reason) {
            return new Request(reason, null, null, null);
        }
    }

    public record RunResult(String status, String reason, Long durationMs) {
        public static RunResult ran(long durationMs) {
            return new RunResult("ran", null, durationMs);
        }

        public static RunResult skipped(String reason) {
            return new RunResult("skipped", reason, null);
        }

        public static RunResult failed(String reason) {
            return new RunResult("error", reason, null);
        }

        public boolean isBusy() {
            return "skipped".equals(status) && REASON_IN_FLIGHT.equals(reason);
        }
    }

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile long intervalMs;
    private volatile Function<Request, RunResult> heartbeatAction;
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param intervalMs      interval between heartbeats in milliseconds
     * @param heartbeatAction performs the actual heartbeat
     */
    public HeartbeatRunner(long intervalMs, Function<Request, RunResult> heartbeatAction) {
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
        this.heartbeatAction = heartbeatAction;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-runner");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Heartbeat runner already running");
            return;
        }
        scheduleNext();
        log.info("Heartbeat runner started (interval: {}ms)", intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.info("Heartbeat runner stopped");
    }

    public void updateAction(Function<Request, RunResult> newAction) {
        this.heartbeatAction = newAction;
    }

    /**
     * Fire-and-forget heartbeat request. A request that lands while another
     * heartbeat is executing is retried shortly after.
     */
    public void requestNow(Request request) {
        scheduler.execute(() -> runRequested(request));
    }

    /**
     * Attempt one heartbeat synchronously on the caller's thread.
     */
    public RunResult runOnce(Request request) {
        if (!inFlight.compareAndSet(false, true)) {
            return RunResult.skipped(REASON_IN_FLIGHT);
        }
        long startedAt = System.currentTimeMillis();
        try {
            var action = heartbeatAction;
            if (action == null) {
                return RunResult.skipped("no-action");
            }
            RunResult result = action.apply(request);
            return result != null ? result : RunResult.ran(System.currentTimeMillis() - startedAt);
        } catch (Exception e) {
            log.warn("Heartbeat failed after {}ms: {}", System.currentTimeMillis() - startedAt, e.getMessage());
            return RunResult.failed(ErrorUtils.formatErrorMessage(e));
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isInFlight() {
        return inFlight.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void runRequested(Request request) {
        RunResult result = runOnce(request);
        if (result.isBusy() && !scheduler.isShutdown()) {
            scheduler.schedule(() -> runRequested(request), BUSY_RETRY_DELAY_MS, TimeUnit.MILLISECONDS);
        }
    }

    private void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce(Request.of("interval"));
        if (running.get()) {
            scheduleNext();
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
