package com.factql.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-call deadline and cancellation signal.
 *
 * <p>Cancelling runs the hook registered by the statement currently executing, if any. A hook
 * registered after cancellation runs immediately.
 */
public final class QueryContext {
    public static final String REASON_DEADLINE = "deadline exceeded";
    public static final String REASON_CALLER = "cancelled by caller";

    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final AtomicReference<Runnable> cancelHook = new AtomicReference<>();

    private QueryContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static QueryContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static QueryContext withTimeout(Duration timeout, Clock clock) {
        return new QueryContext(clock, clock.instant().plus(timeout));
    }

    /**
     * Milliseconds left until the deadline, never negative.
     */
    public long remainingMillis() {
        return Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
    }

    public void cancel() {
        cancel(REASON_CALLER);
    }

    public void cancel(String reason) {
        if (this.reason.compareAndSet(null, reason)) {
            Runnable hook = cancelHook.get();
            if (hook != null) {
                hook.run();
            }
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * @throws QueryCancelledException if the context was cancelled or its deadline has passed
     */
    public void throwIfCancelled() {
        if (!isCancelled() && remainingMillis() == 0) {
            cancel(REASON_DEADLINE);
        }
        if (isCancelled()) {
            throw new QueryCancelledException(reason.get());
        }
    }

    void onCancel(Runnable hook) {
        cancelHook.set(hook);
        if (isCancelled()) {
            hook.run();
        }
    }

    void clearCancelHook() {
        cancelHook.set(null);
    }
}
