package com.agentexec.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing time-dependent behavior without waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = new TimeController();
 * StepExecutor executor = new StepExecutor(store, mapper, engine, bus, time);
 *
 * time.advance(Duration.ofHours(2));   // checkpoints now look two hours old
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    public TimeController() {
        this(Instant.parse("2024-01-15T10:00:00Z"));
    }

    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }
}
