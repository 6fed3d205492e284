package io.minichain.core.consensus;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a proof-of-work search: an explicit flag plus an optional deadline.
 * The search polls {@link #isCancelled()} once per nonce, so a cancelled search stops between
 * two hash attempts and never leaves a half-built block behind.
 */
public final class CancellationToken {
    private static final CancellationToken NEVER = new CancellationToken(Long.MAX_VALUE);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final long deadlineNanos;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /** Token that can be cancelled explicitly and has no deadline. */
    public static CancellationToken create() {
        return new CancellationToken(Long.MAX_VALUE);
    }

    /** Token that also trips once {@code timeoutMillis} have elapsed. */
    public static CancellationToken withTimeout(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            return create();
        }
        return new CancellationToken(System.nanoTime() + timeoutMillis * 1_000_000L);
    }

    /** Shared token that ignores {@link #cancel()}. */
    public static CancellationToken never() {
        return NEVER;
    }

    public void cancel() {
        if (this != NEVER) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }
}
