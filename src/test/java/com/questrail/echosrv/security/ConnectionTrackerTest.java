package com.questrail.echosrv.security;

import com.questrail.echosrv.error.EchoTimeoutException;
import com.questrail.echosrv.internal.time.ManualMonotonicClock;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionTrackerTest {

    private final ResourceLimits limits = ResourceLimits.builder().withMaxConcurrentConnections(2).build();
    private final ConnectionTracker tracker = new ConnectionTracker(limits, new ManualMonotonicClock());

    @Test
    void permitsAreCountedAndReleased() {
        ConnectionTracker.Permit first = tracker.acquire();
        ConnectionTracker.Permit second = tracker.acquire();

        assertEquals(new ConnectionMetrics(2, 2, 0, 2), tracker.metrics());

        first.close();
        first.close();
        assertEquals(new ConnectionMetrics(1, 2, 1, 2), tracker.metrics());
        second.close();
    }

    @Test
    void acquireTimesOutWhenFull() {
        tracker.acquire();
        tracker.acquire();

        EchoTimeoutException e = assertThrows(EchoTimeoutException.class,
                () -> tracker.acquire(Duration.ofMillis(50)));
        assertEquals("Connection limit reached, timeout waiting for slot", e.getMessage());
    }

    @Test
    void waitingAcquireGetsAReleasedSlot() throws Exception {
        ConnectionTracker.Permit held = tracker.acquire();
        tracker.acquire();

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            held.close();
        });
        releaser.start();

        try (ConnectionTracker.Permit late = tracker.acquire(Duration.ofSeconds(5))) {
            assertEquals(2, tracker.metrics().activeConnections());
            assertEquals(3, tracker.metrics().totalConnections());
        }
        releaser.join();
    }
}
