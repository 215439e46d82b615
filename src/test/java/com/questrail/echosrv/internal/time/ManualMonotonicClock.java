package com.questrail.echosrv.internal.time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when a test moves it. Starts at zero, never goes back.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    public void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("clock cannot move backwards: " + step);
        }
        nanos.addAndGet(step.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
