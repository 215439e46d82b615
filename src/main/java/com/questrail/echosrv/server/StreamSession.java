package com.questrail.echosrv.server;

import com.questrail.echosrv.PayloadHandler;
import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.internal.time.WallClock;
import com.questrail.echosrv.observability.ConnectionEvent;
import com.questrail.echosrv.observability.EchoErrorEvent;
import com.questrail.echosrv.observability.EchoObservabilitySink;
import com.questrail.echosrv.transport.StreamConnection;

import java.net.SocketAddress;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;

/**
 * StreamSession
 * =============================================================================
 * Services one accepted connection: read, hand the bytes to the
 * {@link PayloadHandler}, write and flush the response, repeat.
 *
 * <pre>
 *   READING --n &gt; 0--&gt; ECHOING --written--&gt; READING
 *      |                   |
 *      +--0 / timeout / failure--+--&gt; CLOSED
 * </pre>
 *
 * <p>Each step is chained on the previous step's completion, so a session holds no
 * thread while it waits. The connection is closed on every path into CLOSED.</p>
 */
final class StreamSession
{
    enum State {
        READING,
        ECHOING,
        CLOSED
    }

    enum Outcome {
        PEER_CLOSED,
        READ_TIMEOUT,
        WRITE_TIMEOUT,
        FAILED
    }

    private final StreamConnection connection;
    private final StreamServerConfig config;
    private final PayloadHandler handler;
    private final EchoObservabilitySink sink;
    private final WallClock wallClock;
    private final String transport;
    private final IntSupplier activeConnections;
    private final SocketAddress peer;
    private final byte[] buffer;
    private final CompletableFuture<Outcome> done = new CompletableFuture<>();

    private volatile State state = State.READING;

    StreamSession(StreamConnection connection,
                  StreamServerConfig config,
                  PayloadHandler handler,
                  EchoObservabilitySink sink,
                  WallClock wallClock,
                  String transport,
                  IntSupplier activeConnections) {
        this.connection = connection;
        this.config = config;
        this.handler = handler;
        this.sink = sink;
        this.wallClock = wallClock;
        this.transport = transport;
        this.activeConnections = activeConnections;
        this.peer = connection.remoteAddress();
        this.buffer = new byte[config.bufferSize()];
    }

    /** Starts the session; the future completes once the connection is closed. */
    CompletableFuture<Outcome> run() {
        readNext();
        return done;
    }

    private void readNext() {
        state = State.READING;
        CompletableFuture<Integer> read;
        try {
            read = connection.read(buffer, config.readTimeout());
        } catch (RuntimeException e) {
            finish(Outcome.FAILED, e);
            return;
        }
        read.whenComplete((n, error) -> {
            if (error != null) {
                if (Failures.isTimeout(error)) {
                    finish(Outcome.READ_TIMEOUT, error);
                }
                else {
                    finish(Outcome.FAILED, error);
                }
            }
            else if (n == 0) {
                finish(Outcome.PEER_CLOSED, null);
            }
            else {
                respond(n);
            }
        });
    }

    private void respond(int n) {
        state = State.ECHOING;
        emit(ConnectionEvent.Type.RECEIVED, n, null);

        byte[] response;
        CompletableFuture<Void> written;
        try {
            response = handler.respond(Arrays.copyOf(buffer, n));
            if (response == null) {
                throw new IllegalStateException("payload handler returned null");
            }
            written = connection.write(response, response.length, config.writeTimeout())
                    .thenCompose(v -> connection.flush(config.writeTimeout()));
        } catch (RuntimeException e) {
            finish(Outcome.FAILED, e);
            return;
        }

        written.whenComplete((v, error) -> {
            if (error != null) {
                finish(Failures.isTimeout(error) ? Outcome.WRITE_TIMEOUT : Outcome.FAILED, error);
            }
            else {
                emit(ConnectionEvent.Type.ECHOED, response.length, null);
                readNext();
            }
        });
    }

    private void finish(Outcome outcome, Throwable error) {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        // The session is over even if closing or reporting throws.
        try {
            connection.close();

            switch (outcome) {
                case PEER_CLOSED -> { }
                case READ_TIMEOUT -> emit(ConnectionEvent.Type.TIMED_OUT, 0, "read: " + Failures.describe(error));
                case WRITE_TIMEOUT -> emit(ConnectionEvent.Type.TIMED_OUT, 0, "write: " + Failures.describe(error));
                case FAILED -> sink.onError(new EchoErrorEvent(
                        wallClock.now(), transport, peer, "Connection failed: " + Failures.describe(error),
                        Failures.unwrap(error)));
            }
        } finally {
            done.complete(outcome);
        }
    }

    private void emit(ConnectionEvent.Type type, int bytes, String detail) {
        sink.onConnectionEvent(new ConnectionEvent(
                wallClock.now(), type, transport, peer, activeConnections.getAsInt(), bytes, detail));
    }
}
