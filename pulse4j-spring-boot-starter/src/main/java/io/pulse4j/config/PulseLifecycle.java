package io.pulse4j.config;

import io.pulse4j.Pulse;
import io.pulse4j.core.ScheduleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Starts the report runner once the context is refreshed and stops it first on shutdown.
 *
 * <p>A runner that fails to start leaves the lifecycle stopped and fails the context refresh.
 */
public class PulseLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(PulseLifecycle.class);

    private final Pulse pulse;
    private volatile boolean running = false;

    public PulseLifecycle(Pulse pulse) {
        this.pulse = Objects.requireNonNull(pulse, "pulse must not be null");
    }

    @Override
    public void start() {
        List<ScheduleEntry> entries = pulse.entries();
        if (entries.isEmpty()) {
            log.warn("pulse starting with no report jobs registered");
        }
        try {
            pulse.start();
        } catch (RuntimeException e) {
            log.error("pulse failed to start jobs={} msg={}", names(entries), e.getMessage(), e);
            running = false;
            throw e;
        }
        running = true;
        log.info("pulse started jobs={}", names(entries));
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            pulse.stop();
        } finally {
            running = false;
            log.info("pulse stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // stop last started, first stopped: the runner must not tick against closing beans
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    private static String names(List<ScheduleEntry> entries) {
        return entries.stream().map(ScheduleEntry::name).collect(Collectors.joining(",", "[", "]"));
    }
}
