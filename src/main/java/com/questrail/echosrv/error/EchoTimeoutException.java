package com.questrail.echosrv.error;

import java.time.Duration;

/**
 * No data or no peer arrived within the configured deadline.
 */
public final class EchoTimeoutException extends EchoException
{
    private final Duration deadline;

    public EchoTimeoutException(String message, Duration deadline) {
        super(message);
        this.deadline = deadline;
    }

    /**
     * The deadline that lapsed; {@code null} when the timeout was reported by the OS
     * rather than armed by the engine.
     */
    public Duration deadline() {
        return deadline;
    }
}
