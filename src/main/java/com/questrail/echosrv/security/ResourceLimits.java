package com.questrail.echosrv.security;

import com.questrail.echosrv.error.EchoConfigException;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Resource ceilings for a service.
 *
 * <p>{@code maxRequestsPerSecond} is per client; empty disables rate limiting.</p>
 */
public record ResourceLimits(
    int maxRequestSize,
    int maxConcurrentConnections,
    OptionalInt maxRequestsPerSecond,
    Duration connectionTimeout,
    Duration maxIdleTime
) {
    public ResourceLimits {
        Objects.requireNonNull(maxRequestsPerSecond, "maxRequestsPerSecond");
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(maxIdleTime, "maxIdleTime");
        if (maxRequestSize < 1) {
            throw new EchoConfigException("maxRequestSize must be at least 1");
        }
        if (maxConcurrentConnections < 1) {
            throw new EchoConfigException("maxConcurrentConnections must be at least 1");
        }
        if (maxRequestsPerSecond.isPresent() && maxRequestsPerSecond.getAsInt() < 1) {
            throw new EchoConfigException("maxRequestsPerSecond must be at least 1");
        }
    }

    public static ResourceLimits defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxRequestSize = 1024 * 1024;
        private int maxConcurrentConnections = 100;
        private OptionalInt maxRequestsPerSecond = OptionalInt.of(100);
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration maxIdleTime = Duration.ofMinutes(5);

        public Builder withMaxRequestSize(int maxRequestSize) {
            this.maxRequestSize = maxRequestSize;
            return this;
        }

        public Builder withMaxConcurrentConnections(int maxConcurrentConnections) {
            this.maxConcurrentConnections = maxConcurrentConnections;
            return this;
        }

        public Builder withMaxRequestsPerSecond(int maxRequestsPerSecond) {
            this.maxRequestsPerSecond = OptionalInt.of(maxRequestsPerSecond);
            return this;
        }

        public Builder withoutRateLimit() {
            this.maxRequestsPerSecond = OptionalInt.empty();
            return this;
        }

        public Builder withConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder withMaxIdleTime(Duration maxIdleTime) {
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        public ResourceLimits build() {
            return new ResourceLimits(maxRequestSize, maxConcurrentConnections, maxRequestsPerSecond,
                    connectionTimeout, maxIdleTime);
        }
    }
}
