package com.questrail.echosrv.security;

import com.questrail.echosrv.error.PayloadTooLargeException;

/**
 * Rejects payloads larger than a fixed maximum.
 */
public final class SizeValidator
{
    private final long maxSize;

    public SizeValidator(long maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0");
        }
        this.maxSize = maxSize;
    }

    public static SizeValidator forRequests(ResourceLimits limits) {
        return new SizeValidator(limits.maxRequestSize());
    }

    /**
     * @throws PayloadTooLargeException if {@code size} exceeds the maximum
     */
    public void validate(long size) {
        if (size > maxSize) {
            throw new PayloadTooLargeException(size, maxSize);
        }
    }

    public long maxSize() {
        return maxSize;
    }
}
