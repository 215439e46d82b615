package com.questrail.echosrv.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>This clock may jump due to NTP adjustments or explicit time setting. It MUST NOT
 * be used for timeouts or any other operational decision.</p>
 */
public interface WallClock
{
    Instant now();
}
