package com.questrail.echosrv.error;

/**
 * A fresh socket could not be created at its bind target.
 *
 * <p>Covers address or path already in use, permission problems, and a bind target
 * whose kind (network vs filesystem path) does not match the transport.</p>
 */
public final class BindFailedException extends EchoException
{
    public BindFailedException(String message) {
        super(message);
    }

    public BindFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
