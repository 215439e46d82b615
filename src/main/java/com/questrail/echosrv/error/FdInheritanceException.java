package com.questrail.echosrv.error;

/**
 * An inherited descriptor failed validation, or the OS query used to validate it failed.
 */
public final class FdInheritanceException extends EchoException
{
    private final int descriptor;

    public FdInheritanceException(int descriptor, String message) {
        super(message);
        this.descriptor = descriptor;
    }

    public FdInheritanceException(int descriptor, String message, Throwable cause) {
        super(message, cause);
        this.descriptor = descriptor;
    }

    public int descriptor() {
        return descriptor;
    }
}
