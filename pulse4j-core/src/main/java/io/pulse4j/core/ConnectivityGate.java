package io.pulse4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocks until a {@link ConnectivityTarget} accepts a TCP connection.
 *
 * <p>Each attempt connects with a short timeout; on failure the gate logs and sleeps for the
 * target's poll interval before trying again. There is no attempt limit: the wait ends only when the
 * target is reachable or the calling thread is interrupted.
 */
public class ConnectivityGate {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityGate.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Single reachability attempt; throws when the endpoint cannot be reached.
     */
    @FunctionalInterface
    public interface Probe {
        void connect(String host, int port, Duration timeout) throws IOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Probe probe;
    private final Sleeper sleeper;
    private final Duration connectTimeout;

    public ConnectivityGate() {
        this(ConnectivityGate::socketConnect, ConnectivityGate::threadSleep, DEFAULT_CONNECT_TIMEOUT);
    }

    public ConnectivityGate(Duration connectTimeout) {
        this(ConnectivityGate::socketConnect, ConnectivityGate::threadSleep, connectTimeout);
    }

    public ConnectivityGate(Probe probe, Sleeper sleeper, Duration connectTimeout) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be a positive duration");
        }
    }

    /**
     * Wait until {@code target} is reachable.
     *
     * @return number of attempts it took
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public int awaitReachable(ConnectivityTarget target) throws InterruptedException {
        Objects.requireNonNull(target, "target must not be null");

        log.debug("Checking access to {}", target);
        int attempt = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Connectivity wait for " + target + " cancelled");
            }
            attempt++;
            try {
                probe.connect(target.host(), target.port(), connectTimeout);
                if (attempt > 1) {
                    log.info("{} reachable again after {} attempts", target, attempt);
                } else {
                    log.debug("{} reachable", target);
                }
                return attempt;
            } catch (IOException e) {
                log.warn("{} unreachable (attempt {}, {}); retrying in {}",
                        target, attempt, e.getMessage(), target.pollInterval());
                sleeper.sleep(target.pollInterval());
            }
        }
    }

    static void socketConnect(String host, int port, Duration timeout) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), Math.toIntExact(timeout.toMillis()));
        }
    }

    private static void threadSleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
