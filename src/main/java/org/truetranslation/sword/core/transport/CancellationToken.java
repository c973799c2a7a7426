package org.truetranslation.sword.core.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation shared by a caller and the operations it starts.
 * A token is cancelled explicitly through {@link #cancel()} or implicitly once
 * its optional deadline passes. Operations poll it between units of work;
 * a pending retry delay wakes up as soon as the token is cancelled.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final boolean hasDeadline;
    private final long deadlineNanos;

    private CancellationToken(boolean hasDeadline, long deadlineNanos) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /** A token that is cancelled only explicitly. */
    public static CancellationToken create() {
        return new CancellationToken(false, 0);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(true, System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            cancel();
            return true;
        }
        return false;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("operation cancelled");
        }
    }

    /**
     * Waits for the given delay unless the token is cancelled first.
     *
     * @throws CancellationException if the token is or becomes cancelled
     * @throws IOException           if the calling thread is interrupted
     */
    public void sleep(Duration delay) throws IOException {
        throwIfCancelled();
        long waitNanos = delay.toNanos();
        boolean endsAtDeadline = false;
        if (hasDeadline) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= waitNanos) {
                waitNanos = Math.max(0, remaining);
                endsAtDeadline = true;
            }
        }
        try {
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry", e);
        }
        if (endsAtDeadline) {
            cancel();
        }
        throwIfCancelled();
    }
}
