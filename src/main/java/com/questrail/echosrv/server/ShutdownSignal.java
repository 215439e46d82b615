package com.questrail.echosrv.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot broadcast: fired at most once, observed by any number of subscribers.
 *
 * <p>Firing is idempotent. Subscribing after the fact yields an already completed
 * future, so a late observer never misses the signal.</p>
 */
public final class ShutdownSignal
{
    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private static final class ProcessInterrupt {
        static final ShutdownSignal INSTANCE = install();

        private static ShutdownSignal install() {
            ShutdownSignal signal = new ShutdownSignal();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (signal.fire()) {
                    log.info("Process interrupt received, stopping servers");
                }
            }, "echosrv-interrupt"));
            return signal;
        }
    }

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    /**
     * The process-wide interrupt signal, fired when the JVM begins shutting down
     * (SIGINT, SIGTERM). The hook is installed on first use.
     */
    public static ShutdownSignal processInterrupt() {
        return ProcessInterrupt.INSTANCE;
    }

    /** @return true if this call fired the signal, false if it had already fired */
    public boolean fire() {
        return fired.complete(null);
    }

    public boolean isFired() {
        return fired.isDone();
    }

    /** A future that completes when the signal fires. Completing it has no effect on the signal. */
    public CompletableFuture<Void> subscribe() {
        return fired.copy();
    }
}
