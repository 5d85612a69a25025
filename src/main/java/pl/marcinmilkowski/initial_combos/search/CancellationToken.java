package pl.marcinmilkowski.initial_combos.search;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal that fires when {@link #cancel()} is called or an
 * optional deadline passes. Safe to cancel from another thread.
 */
public final class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final long deadlineNanos;
    private final boolean hasDeadline;

    public CancellationToken() {
        this.deadlineNanos = 0L;
        this.hasDeadline = false;
    }

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = true;
    }

    /**
     * A token that cancels itself once {@code timeout} has elapsed.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        if (cancelled.get()) {
            return true;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            cancelled.set(true);
            return true;
        }
        return false;
    }
}
