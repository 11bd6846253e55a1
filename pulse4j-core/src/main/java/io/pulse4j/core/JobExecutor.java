package io.pulse4j.core;

import io.pulse4j.ReportJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Runs a single {@link ReportJob}: window check, connectivity wait, fetch, format, deliver.
 *
 * <p>Every failure, {@link Error}s included, is converted to a {@link JobOutcome}. Only errors the JVM
 * cannot continue after ({@link #isFatal(Throwable)}) escape {@link #execute(ReportJob, Instant)}.
 * Interruption of the calling thread is reported as a skipped outcome and the interrupt flag is left
 * set for the caller.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ConnectivityGate gate;

    public JobExecutor(ConnectivityGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
    }

    public JobOutcome execute(ReportJob<?> job, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");
        try {
            return run(job, now);
        } catch (RuntimeException e) {
            return JobOutcome.failed("unexpected error: " + describe(e), e);
        } catch (Error e) {
            rethrowIfFatal(e);
            return JobOutcome.failed("unexpected error: " + describe(e), e);
        }
    }

    /**
     * {@code OutOfMemoryError}, {@code InternalError} and other {@link VirtualMachineError}s, except
     * {@link StackOverflowError}, which unwinds cleanly.
     */
    public static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    private static void rethrowIfFatal(Error e) {
        if (isFatal(e)) {
            throw e;
        }
    }

    private <R> JobOutcome run(ReportJob<R> job, Instant now) {
        if (!job.window().allowed(now)) {
            return JobOutcome.skipped("outside window");
        }

        ConnectivityTarget target = job.source().target();
        if (target != null) {
            try {
                gate.awaitReachable(target);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return JobOutcome.skipped("cancelled while waiting for " + target);
            }
        }

        log.debug("Job started name={} at={}", job.name(), now);

        R result;
        try {
            result = job.source().fetch();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobOutcome.skipped("cancelled during fetch");
        } catch (Exception e) {
            return JobOutcome.failed("fetch error: " + describe(e), e);
        } catch (Error e) {
            rethrowIfFatal(e);
            return JobOutcome.failed("fetch error: " + describe(e), e);
        }

        FormattedMessage message;
        try {
            message = job.formatter().format(result, now);
        } catch (RuntimeException e) {
            return JobOutcome.failed("format error: " + describe(e), e);
        } catch (Error e) {
            rethrowIfFatal(e);
            return JobOutcome.failed("format error: " + describe(e), e);
        }
        if (message == null) {
            return JobOutcome.failed("format error: formatter returned no message");
        }

        DeliveryOutcome delivery;
        try {
            delivery = job.sink().deliver(job.channel(), message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobOutcome.failed("delivery error: interrupted", e);
        } catch (Exception e) {
            return JobOutcome.failed("delivery error: " + describe(e), e);
        } catch (Error e) {
            rethrowIfFatal(e);
            return JobOutcome.failed("delivery error: " + describe(e), e);
        }
        if (delivery == null || !delivery.ok()) {
            String detail = delivery == null ? "sink returned no outcome" : delivery.detail();
            return JobOutcome.failed("delivery error: " + detail);
        }

        return JobOutcome.succeeded();
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }
}
