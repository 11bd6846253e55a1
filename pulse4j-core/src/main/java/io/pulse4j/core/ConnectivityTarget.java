package io.pulse4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Network endpoint a job's data source depends on, probed by {@link ConnectivityGate}
 * before every fetch.
 */
public record ConnectivityTarget(String host, int port, Duration pollInterval) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMinutes(15);

    public ConnectivityTarget {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (pollInterval == null) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
    }

    public static ConnectivityTarget of(String host, int port) {
        return new ConnectivityTarget(host, port, DEFAULT_POLL_INTERVAL);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
