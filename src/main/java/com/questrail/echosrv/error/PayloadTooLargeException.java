package com.questrail.echosrv.error;

/**
 * A payload exceeded its configured maximum size.
 *
 * <p>Raised instead of truncating; callers never see a partial payload.</p>
 */
public final class PayloadTooLargeException extends EchoException
{
    private final long actual;
    private final long max;

    public PayloadTooLargeException(long actual, long max) {
        super("Payload too large: " + actual + " bytes, max allowed: " + max);
        this.actual = actual;
        this.max = max;
    }

    public long actual() {
        return actual;
    }

    public long max() {
        return max;
    }
}
