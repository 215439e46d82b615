package com.questrail.echosrv.security;

import com.questrail.echosrv.error.PayloadTooLargeException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SizeValidatorTest {

    @Test
    void acceptsUpToTheLimit() {
        SizeValidator validator = new SizeValidator(100);

        assertDoesNotThrow(() -> validator.validate(0));
        assertDoesNotThrow(() -> validator.validate(100));
    }

    @Test
    void rejectsAboveTheLimit() {
        PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class,
                () -> new SizeValidator(100).validate(101));

        assertEquals("Payload too large: 101 bytes, max allowed: 100", e.getMessage());
    }

    @Test
    void requestLimitComesFromResourceLimits() {
        assertEquals(1024 * 1024, SizeValidator.forRequests(ResourceLimits.defaults()).maxSize());
    }

    @Test
    void resourceLimitsCanDisableRateLimiting() {
        assertTrue(ResourceLimits.defaults().maxRequestsPerSecond().isPresent());
        assertTrue(ResourceLimits.builder().withoutRateLimit().build().maxRequestsPerSecond().isEmpty());
    }
}
