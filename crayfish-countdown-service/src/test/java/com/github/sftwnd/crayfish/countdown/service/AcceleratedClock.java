package com.github.sftwnd.crayfish.countdown.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock starting at the defined instant and running factor times faster than the real time
 */
class AcceleratedClock extends Clock {

    private final Instant base;
    private final long factor;
    private final long startNanos;

    AcceleratedClock(Instant base, long factor) {
        this.base = base;
        this.factor = factor;
        this.startNanos = System.nanoTime();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("AcceleratedClock::withZone");
    }

    @Override
    public Instant instant() {
        return base.plusNanos((System.nanoTime() - startNanos) * factor);
    }

}
