package io.pulse4j;

import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.ScheduleEntry;

import java.util.List;
import java.util.Map;

/**
 * Main runner API: holds registered report jobs and drives them on a fixed tick.
 */
public interface Pulse {

    /**
     * Start ticking in the background. Idempotent.
     */
    void start();

    /**
     * Stop ticking, cancelling any in-progress connectivity wait. Idempotent.
     */
    void stop();

    boolean isRunning();

    ScheduleEntry register(ReportJob<?> job);

    List<ScheduleEntry> entries();

    /**
     * Run one evaluation pass at the current instant on the calling thread.
     *
     * @return outcomes of the jobs dispatched by this pass, in registration order
     */
    Map<String, JobOutcome> tickNow();
}
