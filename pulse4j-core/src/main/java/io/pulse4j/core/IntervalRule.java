package io.pulse4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Due every {@code interval} after the last run. A job that never ran is due immediately, so the
 * first tick after startup runs it once.
 */
public record IntervalRule(Duration interval) implements RecurrenceRule {

    public IntervalRule {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
    }

    @Override
    public Instant nextDueAt(Instant lastRun, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (lastRun == null) {
            return now;
        }
        return lastRun.plus(interval);
    }

    @Override
    public String toString() {
        return "every " + interval;
    }
}
