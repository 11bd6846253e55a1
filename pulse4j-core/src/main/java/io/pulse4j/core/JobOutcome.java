package io.pulse4j.core;

import java.util.Objects;

/**
 * Result of one job execution attempt. Produced per job per tick and only logged.
 */
public record JobOutcome(
        Status status,
        String reason,
        Throwable error
) {

    public enum Status {
        SKIPPED,
        SUCCEEDED,
        FAILED
    }

    public JobOutcome {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static JobOutcome skipped(String reason) {
        return new JobOutcome(Status.SKIPPED, reason, null);
    }

    public static JobOutcome succeeded() {
        return new JobOutcome(Status.SUCCEEDED, null, null);
    }

    public static JobOutcome failed(String reason, Throwable error) {
        return new JobOutcome(Status.FAILED, reason, error);
    }

    public static JobOutcome failed(String reason) {
        return failed(reason, null);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
