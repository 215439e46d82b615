package com.questrail.echosrv.server;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class ShutdownSignalTest {

    @Test
    void firesOnlyOnce() {
        ShutdownSignal signal = new ShutdownSignal();

        assertFalse(signal.isFired());
        assertTrue(signal.fire());
        assertFalse(signal.fire());
        assertTrue(signal.isFired());
    }

    @Test
    void everySubscriberSeesTheSignal() {
        ShutdownSignal signal = new ShutdownSignal();
        CompletableFuture<Void> early = signal.subscribe();
        CompletableFuture<Void> other = signal.subscribe();

        signal.fire();

        assertTrue(early.isDone());
        assertTrue(other.isDone());
        assertTrue(signal.subscribe().isDone());
    }

    @Test
    void cancellingASubscriptionDoesNotFireTheSignal() {
        ShutdownSignal signal = new ShutdownSignal();

        signal.subscribe().cancel(true);
        signal.subscribe().complete(null);

        assertFalse(signal.isFired());
    }

    @Test
    void processInterruptIsShared() {
        assertSame(ShutdownSignal.processInterrupt(), ShutdownSignal.processInterrupt());
    }
}
