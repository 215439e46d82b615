package com.questrail.echosrv.client;

import com.questrail.echosrv.EchoClient;
import com.questrail.echosrv.config.ClientConfig;
import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.error.EchoTimeoutException;
import com.questrail.echosrv.error.PayloadTooLargeException;
import com.questrail.echosrv.internal.time.MonotonicClock;
import com.questrail.echosrv.internal.time.SystemMonotonicClock;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamTransport;

import java.io.ByteArrayOutputStream;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * StreamEchoClient
 * =============================================================================
 * Blocking request/response client over one stream connection.
 *
 * <h2>Response framing</h2>
 * Streams carry no message boundaries, so {@link #echo(byte[])} stops reading when it
 * has as many bytes as it sent, when the server closes the connection, or when a read
 * times out after the full length arrived. A read timeout before that is an
 * {@link EchoTimeoutException}. The response is never silently truncated: a response
 * larger than {@code maxResponseSize} fails with {@link PayloadTooLargeException}.
 *
 * <p>Not thread-safe; one request at a time.</p>
 */
public final class StreamEchoClient implements EchoClient
{
    private final StreamConnection connection;
    private final ClientConfig config;
    private final MonotonicClock clock;
    private volatile long lastActivityNanos;

    private StreamEchoClient(StreamConnection connection, ClientConfig config, MonotonicClock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.lastActivityNanos = clock.nowNanos();
    }

    public static StreamEchoClient connect(StreamTransport transport, BindTarget server, ClientConfig config) {
        return connect(transport, server, config, SystemMonotonicClock.INSTANCE);
    }

    public static StreamEchoClient connect(StreamTransport transport,
                                           BindTarget server,
                                           ClientConfig config,
                                           MonotonicClock clock) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        StreamConnection connection = Await.result(transport.connect(server, config.connectTimeout()));
        return new StreamEchoClient(connection, config, clock);
    }

    @Override
    public byte[] echo(byte[] request) {
        Objects.requireNonNull(request, "request");
        if (request.length == 0) {
            return new byte[0];
        }
        int max = config.maxResponseSize();
        if (request.length > max) {
            throw new EchoConfigException("Request of " + request.length
                    + " bytes exceeds the maximum response size of " + max + " bytes");
        }

        Await.result(connection.write(request, request.length, config.writeTimeout()));
        Await.result(connection.flush(config.writeTimeout()));
        touch();

        ByteArrayOutputStream response = new ByteArrayOutputStream(request.length);
        byte[] chunk = new byte[config.bufferSize()];
        while (response.size() < request.length) {
            int n;
            try {
                n = Await.result(connection.read(chunk, config.readTimeout()));
            } catch (EchoTimeoutException e) {
                throw new EchoTimeoutException("Timed out after receiving " + response.size() + " of "
                        + request.length + " bytes", config.readTimeout());
            }
            if (n == 0) {
                break;
            }
            if ((long) response.size() + n > max) {
                throw new PayloadTooLargeException((long) response.size() + n, max);
            }
            response.write(chunk, 0, n);
            touch();
        }
        return response.toByteArray();
    }

    private void touch() {
        lastActivityNanos = clock.nowNanos();
    }

    /** True when nothing was sent or received for at least {@code threshold}. */
    public boolean isIdle(Duration threshold) {
        return clock.nowNanos() - lastActivityNanos >= threshold.toNanos();
    }

    public ClientConfig config() {
        return config;
    }

    public SocketAddress remoteAddress() {
        return connection.remoteAddress();
    }

    @Override
    public void close() {
        connection.close();
    }
}
