package io.pulse4j.core;

import java.time.Instant;

/**
 * Decides whether a job may execute at a given instant, independently of whether it is due.
 * Implementations must be pure: wall-clock time is the only input.
 */
@FunctionalInterface
public interface WindowPolicy {

    boolean allowed(Instant now);

    /**
     * Policy for jobs whose recurrence already pins the exact run times.
     */
    static WindowPolicy always() {
        return AlwaysAllowed.INSTANCE;
    }

    enum AlwaysAllowed implements WindowPolicy {
        INSTANCE;

        @Override
        public boolean allowed(Instant now) {
            return true;
        }

        @Override
        public String toString() {
            return "always";
        }
    }
}
