package io.pulse4j.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectivityGateTest {

    @Test
    void retriesAtPollIntervalUntilTargetBecomesReachable() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        List<Duration> sleeps = new ArrayList<>();
        ConnectivityGate gate = new ConnectivityGate(
                (host, port, timeout) -> {
                    if (attempts.incrementAndGet() < 4) {
                        throw new ConnectException("Connection refused");
                    }
                },
                sleeps::add,
                Duration.ofSeconds(5)
        );

        ConnectivityTarget target = new ConnectivityTarget("db.internal", 5432, Duration.ofMinutes(15));
        int taken = gate.awaitReachable(target);

        assertEquals(4, taken);
        assertEquals(List.of(Duration.ofMinutes(15), Duration.ofMinutes(15), Duration.ofMinutes(15)), sleeps);
    }

    @Test
    void passesHostPortAndConnectTimeoutToProbe() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        ConnectivityGate gate = new ConnectivityGate(
                (host, port, timeout) -> seen.set(host + ":" + port + "/" + timeout.toSeconds()),
                d -> {
                    throw new AssertionError("should not sleep");
                },
                Duration.ofSeconds(5)
        );

        assertEquals(1, gate.awaitReachable(ConnectivityTarget.of("db.internal", 6543)));
        assertEquals("db.internal:6543/5", seen.get());
    }

    @Test
    void waitIsCancelledByInterrupt() throws Exception {
        CountDownLatch firstFailure = new CountDownLatch(1);
        ConnectivityGate gate = new ConnectivityGate(
                (host, port, timeout) -> {
                    firstFailure.countDown();
                    throw new ConnectException("Connection refused");
                },
                d -> Thread.sleep(d.toMillis()),
                Duration.ofSeconds(5)
        );

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                gate.awaitReachable(ConnectivityTarget.of("db.internal", 5432));
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        waiter.start();

        assertTrue(firstFailure.await(5, TimeUnit.SECONDS));
        waiter.interrupt();
        waiter.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(waiter.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
    }

    @Test
    void alreadyInterruptedThreadDoesNotProbe() {
        AtomicInteger attempts = new AtomicInteger();
        ConnectivityGate gate = new ConnectivityGate(
                (host, port, timeout) -> attempts.incrementAndGet(),
                d -> {
                },
                Duration.ofSeconds(5)
        );

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> gate.awaitReachable(ConnectivityTarget.of("db.internal", 5432)));
        } finally {
            Thread.interrupted();
        }
        assertEquals(0, attempts.get());
    }

    @Test
    void socketProbeConnectsToListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            ConnectivityGate gate = new ConnectivityGate(Duration.ofSeconds(2));
            assertEquals(1, gate.awaitReachable(ConnectivityTarget.of("127.0.0.1", server.getLocalPort())));
        }
    }

    @Test
    void socketProbeFailsOnClosedPort() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0)) {
            port = server.getLocalPort();
        }
        assertThrows(IOException.class, () -> ConnectivityGate.socketConnect("127.0.0.1", port, Duration.ofSeconds(2)));
    }
}
