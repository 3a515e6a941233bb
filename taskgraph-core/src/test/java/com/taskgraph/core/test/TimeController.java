package com.taskgraph.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing time-dependent behavior.
 * Engine components take a {@link Clock}, so tests can pass this in and
 * move time forward without waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
 * RetryTimeoutManager manager = new RetryTimeoutManager(..., time, ...);
 *
 * time.advanceSeconds(6);
 * manager.enforceTimeouts();
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController() {
        this(Instant.now());
    }

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view sharing this controller's time in another zone.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new TimeController(currentTime, zone);
    }

    /**
     * Get the current time.
     */
    public Instant now() {
        return currentTime.get();
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

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    /**
     * Get the duration since an instant.
     */
    public Duration durationSince(Instant since) {
        return Duration.between(since, now());
    }

    /**
     * Create a frozen controller at the current wall-clock time.
     */
    public static TimeController frozen() {
        return new TimeController(Instant.now());
    }

    /**
     * Create a frozen controller at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }
}
