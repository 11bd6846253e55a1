package io.pulse4j.core;

import io.pulse4j.ReportJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the schedule registry and dispatches due jobs.
 *
 * <p>A tick walks the entries in registration order and runs each due job synchronously. The entry's
 * last run is advanced to the tick instant whatever the outcome, so a failing or skipped job waits for
 * its next due instant instead of firing again on the following tick. Ticks never overlap, which also
 * keeps a job from running concurrently with itself.
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final JobExecutor executor;
    private final List<ScheduleEntry> entries = new CopyOnWriteArrayList<>();
    private final ReentrantLock tickLock = new ReentrantLock();

    public Scheduler(JobExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public ScheduleEntry register(ReportJob<?> job) {
        return register(job, null);
    }

    /**
     * Register {@code job} as if it last ran at {@code lastRun} ({@code null} for never).
     */
    public synchronized ScheduleEntry register(ReportJob<?> job, Instant lastRun) {
        Objects.requireNonNull(job, "job must not be null");
        for (ScheduleEntry existing : entries) {
            if (existing.name().equals(job.name())) {
                throw new IllegalStateException("Duplicate job name: " + job.name());
            }
        }
        ScheduleEntry entry = new ScheduleEntry(job, lastRun);
        entries.add(entry);
        log.info("Registered job name={} recurrence={} window={}", job.name(), job.recurrence(), job.window());
        return entry;
    }

    public List<ScheduleEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Dispatch every job due at {@code now}.
     *
     * <p>Stops early, leaving the remaining jobs for a later tick, when the calling thread is
     * interrupted.
     *
     * @return outcomes of the dispatched jobs in registration order
     */
    public Map<String, JobOutcome> tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Map<String, JobOutcome> dispatched = new LinkedHashMap<>();
        tickLock.lock();
        try {
            for (ScheduleEntry entry : entries) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Tick at {} interrupted; remaining jobs left for a later tick", now);
                    break;
                }
                if (!isDue(entry, now)) {
                    continue;
                }

                JobOutcome outcome;
                try {
                    outcome = executor.execute(entry.job(), now);
                } finally {
                    entry.markDispatched(now);
                }
                dispatched.put(entry.name(), outcome);
                logOutcome(entry, outcome, now);
            }
        } finally {
            tickLock.unlock();
        }
        return dispatched;
    }

    private static boolean isDue(ScheduleEntry entry, Instant now) {
        try {
            return entry.isDue(now);
        } catch (RuntimeException e) {
            log.error("Recurrence evaluation failed name={} msg={}", entry.name(), e.getMessage(), e);
            return false;
        }
    }

    private static void logOutcome(ScheduleEntry entry, JobOutcome outcome, Instant now) {
        switch (outcome.status()) {
            case SUCCEEDED -> log.info("job={} outcome=SUCCEEDED at={}", entry.name(), now);
            case SKIPPED -> log.info("job={} outcome=SKIPPED reason={} at={}", entry.name(), outcome.reason(), now);
            case FAILED -> log.error("job={} outcome=FAILED reason={} at={}",
                    entry.name(), outcome.reason(), now, outcome.error());
        }
    }
}
