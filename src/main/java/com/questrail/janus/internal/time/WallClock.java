package com.questrail.janus.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for envelope timestamps and observability events.
 *
 * <p>May jump (NTP, manual changes); never used for deadlines.</p>
 */
public interface WallClock
{
    Instant now();
}
