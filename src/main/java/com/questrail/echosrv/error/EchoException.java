package com.questrail.echosrv.error;

/**
 * Root of the engine's failure taxonomy.
 *
 * <p>Every transport maps its native failures into one of the subclasses so that the
 * server loops never branch on which socket kind produced an error.</p>
 */
public abstract class EchoException extends RuntimeException
{
    protected EchoException(String message) {
        super(message);
    }

    protected EchoException(String message, Throwable cause) {
        super(message, cause);
    }
}
