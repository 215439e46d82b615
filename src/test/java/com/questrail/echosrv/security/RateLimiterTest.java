package com.questrail.echosrv.security;

import com.questrail.echosrv.internal.time.ManualMonotonicClock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class RateLimiterTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();

    @Test
    void allowsABurstUpToTheRate() {
        RateLimiter limiter = new RateLimiter(3, clock);

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void refillsOnlyAfterAWholeSecond() {
        RateLimiter limiter = new RateLimiter(2, clock);
        limiter.tryAcquire();
        limiter.tryAcquire();

        clock.advanceMillis(999);
        assertFalse(limiter.tryAcquire());

        clock.advanceMillis(1);
        assertEquals(2, limiter.availablePermits());
    }

    @Test
    void refillIsCappedAtCapacity() {
        RateLimiter limiter = new RateLimiter(5, clock);
        limiter.tryAcquire();

        clock.advance(Duration.ofSeconds(10));

        assertEquals(5, limiter.availablePermits());
    }

    @Test
    void rateMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, clock));
    }
}
