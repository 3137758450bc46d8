package com.openforge.kairn.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** A clock tests can move forward to age experiences. */
public class MutableClock extends Clock {

    public static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private volatile Instant now = EPOCH;

    public void reset() {
        now = EPOCH;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    public void advanceDays(long days) {
        advance(Duration.ofDays(days));
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
