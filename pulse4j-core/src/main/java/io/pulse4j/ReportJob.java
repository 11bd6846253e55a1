package io.pulse4j;

import io.pulse4j.core.RecurrenceRule;
import io.pulse4j.core.WindowPolicy;

import java.util.Objects;

/**
 * Immutable definition of a periodic fetch, format and deliver unit of work.
 * Built once at startup by {@link ReportJobBuilder}; carries no scheduling state.
 */
public record ReportJob<R>(

        // identity
        String name,

        // behavior
        DataSource<R> source,
        MessageFormatter<R> formatter,
        Sink sink,
        String channel,

        // scheduling
        WindowPolicy window,
        RecurrenceRule recurrence
) {

    public ReportJob {
        Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(formatter, "formatter must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        if (window == null) {
            window = WindowPolicy.always();
        }
    }

    public static <R> ReportJobBuilder<R> builder(String name, DataSource<R> source) {
        return new ReportJobBuilder<>(name, source);
    }
}
