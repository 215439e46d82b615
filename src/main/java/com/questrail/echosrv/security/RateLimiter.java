package com.questrail.echosrv.security;

import com.questrail.echosrv.internal.time.MonotonicClock;
import com.questrail.echosrv.internal.time.SystemMonotonicClock;

import java.util.Objects;

/**
 * Per-second token bucket.
 *
 * <p>The bucket holds at most {@code requestsPerSecond} tokens. Once at least a whole
 * second has passed since the last refill, {@code elapsedSeconds * requestsPerSecond}
 * tokens are added, capped at capacity.</p>
 */
public final class RateLimiter
{
    private static final long ONE_SECOND_NANOS = 1_000_000_000L;

    private final int requestsPerSecond;
    private final MonotonicClock clock;

    private int available;
    private long lastRefillNanos;

    public RateLimiter(int requestsPerSecond) {
        this(requestsPerSecond, SystemMonotonicClock.INSTANCE);
    }

    public RateLimiter(int requestsPerSecond, MonotonicClock clock) {
        if (requestsPerSecond < 1) {
            throw new IllegalArgumentException("requestsPerSecond must be at least 1");
        }
        this.requestsPerSecond = requestsPerSecond;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.available = requestsPerSecond;
        this.lastRefillNanos = clock.nowNanos();
    }

    /** Takes one token if there is one. */
    public synchronized boolean tryAcquire() {
        refill();
        if (available == 0) {
            return false;
        }
        available--;
        return true;
    }

    public synchronized int availablePermits() {
        refill();
        return available;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed < ONE_SECOND_NANOS) {
            return;
        }
        long tokens = (elapsed / ONE_SECOND_NANOS) * requestsPerSecond;
        available = (int) Math.min(requestsPerSecond, available + tokens);
        lastRefillNanos = now;
    }
}
