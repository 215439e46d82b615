package com.questrail.echosrv.config;

import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.net.BindStrategy;
import com.questrail.echosrv.net.BindTarget;

import java.time.Duration;

/**
 * Configuration for a connection-oriented server.
 *
 * <p>{@code serviceName} may be {@code null}; it is only consulted by
 * {@link BindStrategy.InheritOrBind} to look up an inherited descriptor by name.</p>
 */
public record StreamServerConfig(
    BindStrategy bindStrategy,
    String serviceName,
    int bufferSize,
    Duration readTimeout,
    Duration writeTimeout,
    int maxConnections
) {
    public static final BindTarget DEFAULT_TARGET = BindTarget.network("127.0.0.1", 0);
    public static final int DEFAULT_BUFFER_SIZE = 1024;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    public StreamServerConfig {
        if (bindStrategy == null) {
            throw new EchoConfigException("bindStrategy must be set");
        }
        ConfigChecks.atLeastOne(bufferSize, "bufferSize");
        ConfigChecks.positive(readTimeout, "readTimeout");
        ConfigChecks.positive(writeTimeout, "writeTimeout");
        ConfigChecks.atLeastOne(maxConnections, "maxConnections");
    }

    public static StreamServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withBindStrategy(bindStrategy)
                .withServiceName(serviceName)
                .withBufferSize(bufferSize)
                .withReadTimeout(readTimeout)
                .withWriteTimeout(writeTimeout)
                .withMaxConnections(maxConnections);
    }

    public static final class Builder {
        private BindStrategy bindStrategy = BindStrategy.bind(DEFAULT_TARGET);
        private String serviceName;
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private Duration readTimeout = DEFAULT_TIMEOUT;
        private Duration writeTimeout = DEFAULT_TIMEOUT;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;

        public Builder withBindStrategy(BindStrategy bindStrategy) {
            this.bindStrategy = bindStrategy;
            return this;
        }

        /** Shorthand for {@code withBindStrategy(BindStrategy.bind(target))}. */
        public Builder withBindTarget(BindTarget target) {
            this.bindStrategy = BindStrategy.bind(target);
            return this;
        }

        public Builder withServiceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder withBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder withMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public StreamServerConfig build() {
            return new StreamServerConfig(bindStrategy, serviceName, bufferSize, readTimeout, writeTimeout, maxConnections);
        }
    }
}
