package com.openclaw.scheduler.cron;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal handed to job bodies. Cancelling never
 * stops a body by force; bodies poll {@link #isCancelled()} or wait through
 * {@link #sleep(long)}.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String reason) {
        if (latch.getCount() > 0) {
            this.reason = reason;
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Wait up to {@code ms}, returning early on cancellation.
     *
     * @return true if the token was cancelled
     */
    public boolean sleep(long ms) throws InterruptedException {
        if (ms <= 0) {
            return isCancelled();
        }
        return latch.await(ms, TimeUnit.MILLISECONDS);
    }
}
