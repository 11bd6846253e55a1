package io.pulse4j.core;

import io.pulse4j.ReportJob;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered job together with the instant it was last dispatched.
 * Only {@link Scheduler} advances {@code lastRun}.
 */
public final class ScheduleEntry {

    private final ReportJob<?> job;
    private volatile Instant lastRun;

    ScheduleEntry(ReportJob<?> job, Instant lastRun) {
        this.job = Objects.requireNonNull(job, "job must not be null");
        this.lastRun = lastRun;
    }

    public ReportJob<?> job() {
        return job;
    }

    public String name() {
        return job.name();
    }

    /**
     * @return instant of the last dispatch, or {@code null} if the job never ran
     */
    public Instant lastRun() {
        return lastRun;
    }

    public boolean isDue(Instant now) {
        return job.recurrence().isDue(lastRun, now);
    }

    public Instant nextDueAt(Instant now) {
        return job.recurrence().nextDueAt(lastRun, now);
    }

    void markDispatched(Instant now) {
        this.lastRun = now;
    }

    @Override
    public String toString() {
        return "ScheduleEntry{name=" + job.name() + ", recurrence=" + job.recurrence() + ", lastRun=" + lastRun + "}";
    }
}
