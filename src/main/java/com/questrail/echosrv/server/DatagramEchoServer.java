package com.questrail.echosrv.server;

import com.questrail.echosrv.EchoServer;
import com.questrail.echosrv.PayloadHandler;
import com.questrail.echosrv.config.DatagramServerConfig;
import com.questrail.echosrv.internal.time.SystemWallClock;
import com.questrail.echosrv.internal.time.WallClock;
import com.questrail.echosrv.net.InheritanceConfig;
import com.questrail.echosrv.observability.DatagramEvent;
import com.questrail.echosrv.observability.EchoErrorEvent;
import com.questrail.echosrv.observability.EchoObservabilitySink;
import com.questrail.echosrv.observability.ServerLifecycleEvent;
import com.questrail.echosrv.observability.Slf4jEchoObservabilitySink;
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.DatagramTransport;
import com.questrail.echosrv.transport.ReceivedDatagram;

import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramEchoServer
 * =============================================================================
 * Receive-respond loop for any {@link DatagramTransport}.
 *
 * <p>No per-peer state and no admission gate. Each datagram's response is sent to the
 * address recorded on receipt before the next receive is issued. Receive timeouts,
 * receive failures and send failures are reported and the loop continues.</p>
 */
public final class DatagramEchoServer implements EchoServer
{
    private final DatagramTransport transport;
    private final DatagramServerConfig config;
    private final InheritanceConfig inheritance;
    private final PayloadHandler handler;
    private final EchoObservabilitySink sink;
    private final WallClock wallClock;
    private final ShutdownSignal shutdown;
    private final ShutdownSignal interrupt;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CompletableFuture<Void> loopDone = new CompletableFuture<>();

    private volatile DatagramEndpoint endpoint;
    private volatile ExecutorService loop;
    private volatile boolean stopping;
    private byte[] buffer;

    private DatagramEchoServer(Builder b) {
        this.transport = b.transport;
        this.config = b.config;
        this.inheritance = b.inheritance != null ? b.inheritance : InheritanceConfig.fromEnvironment();
        this.handler = b.handler;
        this.sink = b.sink;
        this.wallClock = b.wallClock;
        this.shutdown = b.shutdown;
        this.interrupt = b.interrupt;
    }

    public static Builder builder(DatagramTransport transport) {
        return new Builder(transport);
    }

    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("server already started");
        }

        DatagramEndpoint e;
        try {
            e = transport.bind(config, inheritance);
        } catch (RuntimeException ex) {
            started.set(false);
            throw ex;
        }
        endpoint = e;
        buffer = new byte[config.bufferSize()];
        loop = ServerLoopExecutor.create(transport.name());
        sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.STARTED,
                transport.name(), e.localAddress()));

        CompletableFuture.anyOf(shutdown.subscribe(), interrupt.subscribe()).thenRun(() -> {
            stopping = true;
            sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.SHUTDOWN_REQUESTED,
                    transport.name(), e.localAddress()));
            e.close();
        });

        loop.execute(this::receiveNext);
        return loopDone.copy();
    }

    private void receiveNext() {
        if (stopping) {
            stopLoop();
            return;
        }
        try {
            endpoint.receive(buffer, config.readTimeout()).whenCompleteAsync(this::onReceived, loop);
        } catch (RuntimeException e) {
            sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), null,
                    "Receive failed, stopping: " + Failures.describe(e), e));
            stopLoop();
        }
    }

    private void onReceived(ReceivedDatagram datagram, Throwable error) {
        if (stopping || !endpoint.isOpen()) {
            stopLoop();
            return;
        }

        if (error != null) {
            if (Failures.isTimeout(error)) {
                sink.onDatagramEvent(new DatagramEvent(wallClock.now(), DatagramEvent.Type.RECEIVE_TIMEOUT,
                        transport.name(), null, 0));
            }
            else {
                sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), null,
                        "Receive failed: " + Failures.describe(error), Failures.unwrap(error)));
            }
            receiveNext();
            return;
        }

        SocketAddress sender = datagram.sender();
        if (sender == null) {
            sink.onDatagramEvent(new DatagramEvent(wallClock.now(), DatagramEvent.Type.UNADDRESSABLE,
                    transport.name(), null, datagram.length()));
            receiveNext();
            return;
        }

        sink.onDatagramEvent(new DatagramEvent(wallClock.now(), DatagramEvent.Type.RECEIVED,
                transport.name(), sender, datagram.length()));

        byte[] response;
        CompletableFuture<Void> sent;
        try {
            response = handler.respond(Arrays.copyOf(buffer, datagram.length()));
            if (response == null) {
                throw new IllegalStateException("payload handler returned null");
            }
            sent = endpoint.send(response, response.length, sender, config.writeTimeout());
        } catch (RuntimeException e) {
            sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), sender,
                    "Reply failed: " + Failures.describe(e), e));
            receiveNext();
            return;
        }

        sent.whenCompleteAsync((v, sendError) -> {
            try {
                if (sendError != null) {
                    sink.onError(new EchoErrorEvent(wallClock.now(), transport.name(), sender,
                            "Send failed: " + Failures.describe(sendError), Failures.unwrap(sendError)));
                }
                else {
                    sink.onDatagramEvent(new DatagramEvent(wallClock.now(), DatagramEvent.Type.ECHOED,
                            transport.name(), sender, response.length));
                }
            } finally {
                receiveNext();
            }
        }, loop);
    }

    private void stopLoop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            endpoint.close();
            sink.onServerEvent(new ServerLifecycleEvent(wallClock.now(), ServerLifecycleEvent.Type.STOPPED,
                    transport.name(), endpoint.localAddress()));
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
        DatagramEndpoint e = endpoint;
        if (e == null) {
            throw new IllegalStateException("server not started");
        }
        return e.localAddress();
    }

    public DatagramServerConfig config() {
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
        private final DatagramTransport transport;
        private DatagramServerConfig config = DatagramServerConfig.defaults();
        private InheritanceConfig inheritance;
        private PayloadHandler handler = PayloadHandler.ECHO;
        private EchoObservabilitySink sink = new Slf4jEchoObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ShutdownSignal shutdown = new ShutdownSignal();
        private ShutdownSignal interrupt;

        private Builder(DatagramTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder withConfig(DatagramServerConfig config) {
            this.config = config;
            return this;
        }

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

        public Builder withInterruptSignal(ShutdownSignal interrupt) {
            this.interrupt = interrupt;
            return this;
        }

        public DatagramEchoServer build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(handler, "handler");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(shutdown, "shutdown");
            if (interrupt == null) {
                interrupt = ShutdownSignal.processInterrupt();
            }
            return new DatagramEchoServer(this);
        }
    }
}
