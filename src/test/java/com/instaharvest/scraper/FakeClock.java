package com.instaharvest.scraper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Manually advanced clock shared by the fake driver and the code under test.
 */
final class FakeClock extends Clock {
    private Instant now;

    FakeClock() {
        this(Instant.parse("2024-05-01T12:00:00Z"));
    }

    FakeClock(Instant start) {
        this.now = start;
    }

    void advance(Duration duration) {
        now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
