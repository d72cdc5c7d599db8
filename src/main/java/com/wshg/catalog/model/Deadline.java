package com.wshg.catalog.model;

import com.wshg.catalog.error.OperationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caller-supplied point in time after which an operation must give up and roll back.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public static Deadline at(Instant expiresAt, Clock clock) {
        return new Deadline(expiresAt, clock);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws OperationTimeoutException if the deadline has passed
     */
    public void check(String operation) {
        Instant now = clock.instant();
        if (!now.isBefore(expiresAt)) {
            throw new OperationTimeoutException(operation, Duration.between(expiresAt, now));
        }
    }

    /**
     * Remaining time as whole seconds for transaction timeouts, rounded up, between 1 and
     * {@link Integer#MAX_VALUE}.
     */
    public int remainingSeconds() {
        long millis = remaining().toMillis();
        long seconds = millis / 1000 + (millis % 1000 == 0 ? 0 : 1);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    @Override
    public String toString() {
        return "Deadline[" + expiresAt + "]";
    }
}
