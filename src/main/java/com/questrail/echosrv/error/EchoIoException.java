package com.questrail.echosrv.error;

/**
 * OS-level read, write, accept or connect failure not otherwise classified.
 */
public final class EchoIoException extends EchoException
{
    public EchoIoException(String message) {
        super(message);
    }

    public EchoIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
