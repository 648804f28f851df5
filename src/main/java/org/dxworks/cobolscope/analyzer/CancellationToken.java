package org.dxworks.cobolscope.analyzer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal checked by the analyzers between top-level traversal steps.
 * Trips either on an explicit {@link #cancel()} or once the optional deadline has passed.
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final long deadlineNanos;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken none() {
        return new CancellationToken(NO_DEADLINE);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return none();
        }
        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            cancelled.set(true);
            return true;
        }
        return false;
    }

    /**
     * @throws AnalysisCancelledException once the token has tripped
     */
    public void checkpoint(String step) {
        if (isCancelled()) {
            throw new AnalysisCancelledException("Analysis cancelled during " + step);
        }
    }
}
