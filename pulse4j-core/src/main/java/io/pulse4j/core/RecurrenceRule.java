package io.pulse4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a job is next due.
 *
 * <p>{@link #nextDueAt(Instant, Instant)} must return a value for every input, including a job that
 * never ran ({@code lastRun == null}).
 */
public interface RecurrenceRule {

    /**
     * @param lastRun instant of the previous dispatch, or {@code null} if the job never ran
     * @param now     current instant
     * @return the instant at which the job becomes (or became) due
     */
    Instant nextDueAt(Instant lastRun, Instant now);

    default boolean isDue(Instant lastRun, Instant now) {
        return !nextDueAt(lastRun, now).isAfter(now);
    }

    static RecurrenceRule every(Duration interval) {
        return new IntervalRule(interval);
    }
}
