package com.questrail.echosrv.config;

import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.net.BindStrategy;
import com.questrail.echosrv.net.BindTarget;

import java.time.Duration;

/**
 * Configuration for a connectionless server. {@code bufferSize} is the largest datagram
 * received whole; longer datagrams are truncated by the OS.
 */
public record DatagramServerConfig(
    BindStrategy bindStrategy,
    String serviceName,
    int bufferSize,
    Duration readTimeout,
    Duration writeTimeout
) {
    public DatagramServerConfig {
        if (bindStrategy == null) {
            throw new EchoConfigException("bindStrategy must be set");
        }
        ConfigChecks.atLeastOne(bufferSize, "bufferSize");
        ConfigChecks.positive(readTimeout, "readTimeout");
        ConfigChecks.positive(writeTimeout, "writeTimeout");
    }

    public static DatagramServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BindStrategy bindStrategy = BindStrategy.bind(StreamServerConfig.DEFAULT_TARGET);
        private String serviceName;
        private int bufferSize = StreamServerConfig.DEFAULT_BUFFER_SIZE;
        private Duration readTimeout = StreamServerConfig.DEFAULT_TIMEOUT;
        private Duration writeTimeout = StreamServerConfig.DEFAULT_TIMEOUT;

        public Builder withBindStrategy(BindStrategy bindStrategy) {
            this.bindStrategy = bindStrategy;
            return this;
        }

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

        public DatagramServerConfig build() {
            return new DatagramServerConfig(bindStrategy, serviceName, bufferSize, readTimeout, writeTimeout);
        }
    }
}
