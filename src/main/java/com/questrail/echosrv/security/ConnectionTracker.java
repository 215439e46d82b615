package com.questrail.echosrv.security;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.error.EchoTimeoutException;
import com.questrail.echosrv.internal.time.MonotonicClock;
import com.questrail.echosrv.internal.time.SystemMonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts connection slots against {@link ResourceLimits#maxConcurrentConnections()}.
 *
 * <p>Unlike the servers' admission check, which refuses at once, {@link #acquire}
 * waits up to a deadline for a slot to free up.</p>
 */
public final class ConnectionTracker
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionTracker.class);

    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(1);

    private final ResourceLimits limits;
    private final MonotonicClock clock;
    private final Semaphore slots;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicLong total = new AtomicLong();

    public ConnectionTracker(ResourceLimits limits) {
        this(limits, SystemMonotonicClock.INSTANCE);
    }

    public ConnectionTracker(ResourceLimits limits, MonotonicClock clock) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.slots = new Semaphore(limits.maxConcurrentConnections());
    }

    public Permit acquire() {
        return acquire(DEFAULT_ACQUIRE_TIMEOUT);
    }

    /**
     * @throws EchoTimeoutException if no slot frees up within {@code timeout}
     */
    public Permit acquire(Duration timeout) {
        boolean acquired;
        try {
            acquired = slots.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EchoIoException("Interrupted while waiting for a connection slot", e);
        }
        if (!acquired) {
            throw new EchoTimeoutException("Connection limit reached, timeout waiting for slot", timeout);
        }

        int nowActive = active.incrementAndGet();
        long nowTotal = total.incrementAndGet();
        log.info("Connection acquired (active: {}, total: {})", nowActive, nowTotal);
        return new Permit(clock.nowNanos());
    }

    public ConnectionMetrics metrics() {
        return new ConnectionMetrics(active.get(), total.get(), slots.availablePermits(),
                limits.maxConcurrentConnections());
    }

    /**
     * A held connection slot. Closing it releases the slot; closing twice is harmless.
     */
    public final class Permit implements AutoCloseable {
        private final long acquiredAtNanos;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(long acquiredAtNanos) {
            this.acquiredAtNanos = acquiredAtNanos;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            int nowActive = active.decrementAndGet();
            slots.release();
            long heldMillis = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - acquiredAtNanos);
            log.info("Connection released (active: {}, duration: {} ms)", nowActive, heldMillis);
        }
    }
}
