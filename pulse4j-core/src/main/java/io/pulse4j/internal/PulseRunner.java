package io.pulse4j.internal;

import io.pulse4j.Pulse;
import io.pulse4j.ReportJob;
import io.pulse4j.core.JobExecutor;
import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.ScheduleEntry;
import io.pulse4j.core.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process loop: ticks the {@link Scheduler} at a fixed cadence on a dedicated thread until stopped.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Pulse pulse = new PulseRunner(scheduler, Duration.ofSeconds(30), Clock.systemUTC());
 * pulse.register(job);
 * pulse.start();
 * ...
 * pulse.stop();
 * }</pre>
 *
 * <p>The runner thread is not a daemon, so a started runner keeps the JVM alive. {@link #stop()}
 * interrupts it, which cancels a connectivity wait in progress; the job being executed is abandoned.
 */
public class PulseRunner implements Pulse {
    private static final Logger log = LoggerFactory.getLogger(PulseRunner.class);

    public static final Duration DEFAULT_TICK_EVERY = Duration.ofSeconds(30);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final Scheduler scheduler;
    private final Duration tickEvery;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private Thread runnerThread;

    public PulseRunner(Scheduler scheduler, Duration tickEvery, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.tickEvery = Objects.requireNonNull(tickEvery, "tickEvery must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (tickEvery.isZero() || tickEvery.isNegative()) {
            throw new IllegalArgumentException("tickEvery must be a positive duration");
        }
    }

    public PulseRunner(Scheduler scheduler) {
        this(scheduler, DEFAULT_TICK_EVERY, Clock.systemUTC());
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            log.info("Pulse starting with tickEvery={}, jobs={}", tickEvery, scheduler.entries().size());
            runnerThread = new Thread(this::runLoop);
            runnerThread.setName("pulse.runner");
            runnerThread.setDaemon(false);
            runnerThread.start();
        }
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(true, false)) {
                return;
            }
            log.info("Pulse stopping...");
            thread = runnerThread;
            runnerThread = null;
        }

        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(STOP_TIMEOUT.toMillis());
                if (thread.isAlive()) {
                    log.warn("Pulse runner did not stop within {}", STOP_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Pulse stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public ScheduleEntry register(ReportJob<?> job) {
        return scheduler.register(job);
    }

    @Override
    public List<ScheduleEntry> entries() {
        return scheduler.entries();
    }

    @Override
    public Map<String, JobOutcome> tickNow() {
        return scheduler.tick(clock.instant());
    }

    private void runLoop() {
        while (started.get() && !Thread.currentThread().isInterrupted()) {
            Instant now = clock.instant();
            try {
                Map<String, JobOutcome> dispatched = scheduler.tick(now);
                log.debug("Tick at {} dispatched {} jobs", now, dispatched.size());
            } catch (RuntimeException | Error e) {
                if (JobExecutor.isFatal(e)) {
                    log.error("pulse runner stopping on fatal error at={}", now, e);
                    started.set(false);
                    throw e;
                }
                // A job is expected to report its own failures; keep ticking regardless.
                log.error("pulse tick failed at={} msg={}", now, e.getMessage(), e);
            }

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                Thread.sleep(tickEvery.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Pulse runner loop exited");
    }
}
