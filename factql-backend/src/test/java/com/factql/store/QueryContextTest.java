package com.factql.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class QueryContextTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void remainingTimeCountsDownToZero() {
        QueryContext context = QueryContext.withTimeout(Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(5000, context.remainingMillis());

        QueryContext expired = QueryContext.withTimeout(Duration.ofSeconds(-1), Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(0, expired.remainingMillis());
    }

    @Test
    void expiredDeadlineCancelsOnCheck() {
        QueryContext context = QueryContext.withTimeout(Duration.ZERO, Clock.fixed(NOW, ZoneOffset.UTC));

        QueryCancelledException ex = assertThrows(QueryCancelledException.class, context::throwIfCancelled);

        assertEquals("query cancelled: deadline exceeded", ex.getMessage());
        assertTrue(context.isCancelled());
    }

    @Test
    void firstCancellationReasonWins() {
        QueryContext context = QueryContext.withTimeout(Duration.ofMinutes(1));
        context.cancel(QueryContext.REASON_DEADLINE);
        context.cancel(QueryContext.REASON_CALLER);

        assertEquals(QueryContext.REASON_DEADLINE, context.getReason());
    }

    @Test
    void hookRunsOnCancelAndWhenRegisteredLate() {
        AtomicInteger calls = new AtomicInteger();
        QueryContext context = QueryContext.withTimeout(Duration.ofMinutes(1));
        context.onCancel(calls::incrementAndGet);
        assertFalse(context.isCancelled());

        context.cancel();
        assertEquals(1, calls.get());

        context.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    void clearedHookIsNotRun() {
        AtomicInteger calls = new AtomicInteger();
        QueryContext context = QueryContext.withTimeout(Duration.ofMinutes(1));
        context.onCancel(calls::incrementAndGet);
        context.clearCancelHook();

        context.cancel();

        assertEquals(0, calls.get());
    }
}
