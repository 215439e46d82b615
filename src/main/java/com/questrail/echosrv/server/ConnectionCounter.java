package com.questrail.echosrv.server;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live connection count with atomic admission.
 */
final class ConnectionCounter
{
    private final AtomicInteger active = new AtomicInteger();

    /** Increments unless the count is already at {@code max}; the check and the increment are one step. */
    boolean tryIncrement(int max) {
        while (true) {
            int current = active.get();
            if (current >= max) {
                return false;
            }
            if (active.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    int decrement() {
        return active.decrementAndGet();
    }

    int current() {
        return active.get();
    }
}
