package io.pulse4j;

import io.pulse4j.core.ConnectivityTarget;

/**
 * Capability that produces the raw result a report is built from.
 *
 * <p>Implementations acquire their connections inside {@link #fetch()} and release them before
 * returning, on every exit path. Nothing is held between calls.
 */
public interface DataSource<R> {

    /**
     * Endpoint that must be reachable before {@link #fetch()} is attempted, or {@code null} when the
     * source has no network dependency worth waiting for.
     */
    ConnectivityTarget target();

    R fetch() throws Exception;
}
