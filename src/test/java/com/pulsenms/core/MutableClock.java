package com.pulsenms.core;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.time.ZoneId;

import java.time.ZoneOffset;

/**
 * Clock that only moves when told to.
 */
public class MutableClock extends Clock
{

    private volatile Instant now;

    public MutableClock(Instant start)
    {
        this.now = start;
    }

    public static MutableClock atEpoch()
    {
        return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public void advance(Duration duration)
    {
        now = now.plus(duration);
    }

    public void advanceSeconds(long seconds)
    {
        advance(Duration.ofSeconds(seconds));
    }

    @Override
    public ZoneId getZone()
    {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone)
    {
        return this;
    }

    @Override
    public Instant instant()
    {
        return now;
    }
}
