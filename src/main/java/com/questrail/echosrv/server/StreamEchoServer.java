package com.questrail.echosrv.server;

import com.questrail.echosrv.EchoServer;
import com.questrail.echosrv.PayloadHandler;
import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.internal.time.SystemWallClock;
import com.questrail.echosrv.internal.time.WallClock;
import com.questrail.echosrv.net.InheritanceConfig;
import com.questrail.echosrv.observability.ConnectionEvent;
import com.questrail.echosrv.observability.EchoErrorEvent;
import com.questrail.echosrv.observability.EchoObservabilitySink;
import com.questrail.echosrv.observability.ServerLifecycleEvent;
import com.questrail.echosrv.observability.Slf4jEchoObservabilitySink;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamListener;
import com.questrail.echosrv.transport.StreamTransport;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StreamEchoServer
 * =============================================================================
 * Connection server for any {@link StreamTransport}.
 *
 * <h2>Accept loop</h2>
 * Runs on one dedicated thread. Each accepted connection is admitted against
 * {@code maxConnections} with a single atomic compare-and-increment; over the limit it
 * is closed at once without a response. Admitted connections run as independent
 * {@link StreamSession}s, and the count is released when the session completes,
 * whatever the outcome.
 *
 * <h2>Shutdown</h2>
 * The internal {@link ShutdownSignal} and the process interrupt signal both close the
 * listener, which ends the loop. Sessions in flight are left to drain.
 *
 * <p>An accept failure is reported and the loop continues while the listener is open.</p>
 */
public final class StreamEchoServer implements EchoServer
{
    private final StreamTransport transport;
    private final StreamServerConfig config;
    private final InheritanceConfig inheritance;
    private final PayloadHandler handler;
    private final EchoObservabilitySink sink;
    private final WallClock wallClock;
    private final ShutdownSignal shutdown;
    private final ShutdownSignal interrupt;

    private final ConnectionCounter counter = new ConnectionCounter();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CompletableFuture<Void> loopDone = new CompletableFuture<>();

    private volatile StreamListener listener;
    private volatile ExecutorService loop;
    private volatile boolean stopping;

    private StreamEchoServer(Builder b) {
        this.transport = b.transport;
        this.config = b.config;
        this.inheritance = b.inheritance != null ? b.inheritance : InheritanceConfig.fromEnvironment();
        this.handler = b.handler;
        this.sink = b.sink;
        this.wallClock = b.wallClock;
        this.shutdown = b.shutdown;
        this.interrupt = b.interrupt;
    }

    public static Builder builder(StreamTransport transport) {
        return new Builder(transport);
    }

    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }

        StreamListener l;
        try {
            l = transport.bind(config, inheritance);
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }
        listener = l;
        loop = ServerLoopExecutor.create(transport.name());
        sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.STARTED,
                transport.name(), l.localAddress()));

        CompletableFuture.anyOf(shutdown.subscribe(), interrupt.subscribe()).thenRun(() -> {
            stopping = true;
            sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.SHUTDOWN_REQUESTED,
                    transport.name(), l.localAddress()));
            l.close();
        });

        loop.execute(this::acceptNext);
        return loopDone.copy();
    }

    private void acceptNext() {
        if (stopping) {
            stopLoop();
            return;
        }
        listener.accept().whenCompleteAsync(this::onAccepted, loop);
    }

    private void onAccepted(StreamConnection connection, Throwable error) {
        if (error != null) {
            if (stopping || !listener.isOpen()) {
                if (!stopping) {
                    sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), null,
                            "Listener closed unexpectedly: " + Failures.describe(error), Failures.unwrap(error)));
                }
                stopLoop();
                return;
            }
            sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), null,
                    "Accept failed: " + Failures.describe(error), Failures.unwrap(error)));
            acceptNext();
            return;
        }

        if (stopping) {
            connection.close();
            stopLoop();
            return;
        }

        admit(connection);
        acceptNext();
    }

    private void admit(StreamConnection connection) {
        SocketAddress peer = connection.remoteAddress();
        if (!counter.tryIncrement(config.maxConnections())) {
            connection.close();
            sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Type.REJECTED,
                    transport.name(), peer, counter.current(), 0, "connection limit " + config.maxConnections()));
            return;
        }

        sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Type.ACCEPTED,
                transport.name(), peer, counter.current(), 0, null));

        CompletableFuture<StreamSession.Outcome> outcome;
        try {
            outcome = new StreamSession(connection, config, handler, sink, wallClock,
                    transport.name(), counter::current).run();
        } catch (RuntimeException e) {
            connection.close();
            outcome = CompletableFuture.failedFuture(e);
        }
        outcome.whenComplete((result, failure) -> {
            int remaining = counter.decrement();
            String detail = result != null ? result.name().toLowerCase().replace('_', ' ') : Failures.describe(failure);
            sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Type.CLOSED,
                    transport.name(), peer, remaining, 0, detail));
        });
    }

    private void stopLoop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            listener.close();
            sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.STOPPED,
                    transport.name(), listener.localAddress()));
        } finally {
            loop.shutdown();
            loopDone.complete(null);
        }
    }

    @Override
    public ShutdownSignal shutdownSignal() {
        return shutdown;
    }

    @Override
    public SocketAddress localAddress() {
        StreamListener l = listener;
        if (l == null) {
            throw new IllegalStateException("server not started");
        }
        return l.localAddress();
    }

    /** Connections currently admitted and not yet closed. */
    public int activeConnections() {
        return counter.current();
    }

    public StreamServerConfig config() {
        return config;
    }

    @Override
    public void close() {
        shutdown.fire();
        if (started.get()) {
            loopDone.join();
        }
    }

    public static final class Builder {
        private final StreamTransport transport;
        private StreamServerConfig config = StreamServerConfig.defaults();
        private InheritanceConfig inheritance;
        private PayloadHandler handler = PayloadHandler.ECHO;
        private EchoObservabilitySink sink = new Slf4jEchoObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ShutdownSignal shutdown = new ShutdownSignal();
        private ShutdownSignal interrupt;

        private Builder(StreamTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder withConfig(StreamServerConfig config) {
            this.config = config;
            return this;
        }

        /** Defaults to {@link InheritanceConfig#fromEnvironment()}. */
        public Builder withInheritance(InheritanceConfig inheritance) {
            this.inheritance = inheritance;
            return this;
        }

        public Builder withPayloadHandler(PayloadHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder withObservabilitySink(EchoObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withShutdownSignal(ShutdownSignal shutdown) {
            this.shutdown = shutdown;
            return this;
        }

        /** Defaults to {@link ShutdownSignal#processInterrupt()}. */
        public Builder withInterruptSignal(ShutdownSignal interrupt) {
            this.interrupt = interrupt;
            return this;
        }

        public StreamEchoServer build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(handler, "handler");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(shutdown, "shutdown");
            if (interrupt == null) {
                interrupt = ShutdownSignal.processInterrupt();
            }
            return new StreamEchoServer(this);
        }
    }
}
