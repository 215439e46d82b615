package com.questrail.echosrv.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time decisions (idle detection, rate-limit refill,
 * connection durations).
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time logic MUST use a monotonic source. Wall-clock time is permitted only
 * for event timestamps; see {@link WallClock}.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
