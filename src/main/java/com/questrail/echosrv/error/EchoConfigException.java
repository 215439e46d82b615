package com.questrail.echosrv.error;

/**
 * Internally inconsistent or malformed configuration.
 */
public final class EchoConfigException extends EchoException
{
    public EchoConfigException(String message) {
        super(message);
    }

    public EchoConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
