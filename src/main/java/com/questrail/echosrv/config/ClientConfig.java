package com.questrail.echosrv.config;

import java.time.Duration;

/**
 * Client-side timeouts and size limits.
 */
public record ClientConfig(
    Duration readTimeout,
    Duration writeTimeout,
    Duration connectTimeout,
    int bufferSize,
    int maxResponseSize
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_RESPONSE_SIZE = 10 * 1024 * 1024;

    public ClientConfig {
        ConfigChecks.positive(readTimeout, "readTimeout");
        ConfigChecks.positive(writeTimeout, "writeTimeout");
        ConfigChecks.positive(connectTimeout, "connectTimeout");
        ConfigChecks.atLeastOne(bufferSize, "bufferSize");
        ConfigChecks.atLeastOne(maxResponseSize, "maxResponseSize");
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration readTimeout = StreamServerConfig.DEFAULT_TIMEOUT;
        private Duration writeTimeout = StreamServerConfig.DEFAULT_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int bufferSize = StreamServerConfig.DEFAULT_BUFFER_SIZE;
        private int maxResponseSize = DEFAULT_MAX_RESPONSE_SIZE;

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder withMaxResponseSize(int maxResponseSize) {
            this.maxResponseSize = maxResponseSize;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(readTimeout, writeTimeout, connectTimeout, bufferSize, maxResponseSize);
        }
    }
}
