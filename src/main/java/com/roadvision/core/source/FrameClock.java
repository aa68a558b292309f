package com.roadvision.core.source;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Часы, которые двигает вызывающий: по меткам времени записанных кадров при реплее.
 * Таймауты сессии тогда считаются во времени записи, а не во времени прогона.
 */
public final class FrameClock extends Clock {
    private volatile long millis;

    public FrameClock(long startMillis) {
        this.millis = startMillis;
    }

    public FrameClock() {
        this(0L);
    }

    public void set(long millis) {
        this.millis = millis;
    }

    public void advance(long deltaMs) {
        this.millis += deltaMs;
    }

    @Override
    public long millis() {
        return millis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        // зона на миллисекунды не влияет
        return this;
    }
}
