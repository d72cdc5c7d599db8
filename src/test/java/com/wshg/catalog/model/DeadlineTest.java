package com.wshg.catalog.model;

import com.wshg.catalog.error.OperationTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void passedDeadlineFailsCheckAsRetryableTimeout() {
        Deadline d = Deadline.at(NOW.minusMillis(250), CLOCK);
        assertTrue(d.isExpired());
        assertEquals(Duration.ZERO, d.remaining());
        OperationTimeoutException ex = assertThrows(OperationTimeoutException.class, () -> d.check("update"));
        assertTrue(ex.isRetryable());
        assertEquals("update", ex.getDetails().get("operation"));
    }

    @Test
    void remainingSecondsRoundsUpAndIsNeverZero() {
        assertEquals(2, Deadline.at(NOW.plusMillis(1500), CLOCK).remainingSeconds());
        assertEquals(1, Deadline.at(NOW.minusSeconds(5), CLOCK).remainingSeconds());
        assertDoesNotThrow(() -> Deadline.at(NOW.plusSeconds(1), CLOCK).check("create"));
    }

    @Test
    void remainingSecondsSaturatesForFarDeadlines() {
        assertEquals(Integer.MAX_VALUE, Deadline.at(NOW.plusMillis(3_000_000_000_000L), CLOCK).remainingSeconds());
        assertEquals(Integer.MAX_VALUE, Deadline.at(NOW.plusMillis(Long.MAX_VALUE), CLOCK).remainingSeconds());
        assertEquals(Integer.MAX_VALUE, Deadline.after(Duration.ofMillis(Long.MAX_VALUE)).remainingSeconds());
    }
}
