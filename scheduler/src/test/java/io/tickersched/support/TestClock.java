package io.tickersched.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Manually advanced UTC clock. */
public class TestClock extends Clock {
    private volatile Instant now;

    public TestClock(Instant start) { this.now = start; }

    public synchronized void advance(Duration d) { now = now.plus(d); }

    public void set(Instant instant) { now = instant; }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }

    @Override public Clock withZone(ZoneId zone) { return this; }

    @Override public Instant instant() { return now; }
}
