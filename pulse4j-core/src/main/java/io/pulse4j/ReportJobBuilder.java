package io.pulse4j;

import io.pulse4j.core.BusinessHoursWindow;
import io.pulse4j.core.IntervalRule;
import io.pulse4j.core.RecurrenceRule;
import io.pulse4j.core.WeeklyRule;
import io.pulse4j.core.WindowPolicy;
import io.pulse4j.utils.ScheduleParser;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Fluent builder for {@link ReportJob}.
 *
 * <pre>{@code
 * ReportJob<TabularResult> job = ReportJob.builder("NOVO", source)
 *         .formatter(template)
 *         .deliverTo(slack, "#monitoring")
 *         .timezone("America/Fortaleza")
 *         .businessHours()
 *         .repeatEvery(Duration.ofMinutes(30))
 *         .build();
 * }</pre>
 */
public class ReportJobBuilder<R> {

    private final String name;
    private final DataSource<R> source;

    private MessageFormatter<R> formatter;
    private Sink sink;
    private String channel;

    private ZoneId zone;
    // zone-dependent parts are resolved in build(), against the final zone
    private Function<ZoneId, WindowPolicy> window;
    private boolean windowNeedsZone;
    private Function<ZoneId, RecurrenceRule> recurrence;
    private boolean recurrenceNeedsZone;

    ReportJobBuilder(String name, DataSource<R> source) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public ReportJobBuilder<R> formatter(MessageFormatter<R> formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        return this;
    }

    public ReportJobBuilder<R> deliverTo(Sink sink, String channel) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
        if (channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        this.channel = channel;
        return this;
    }

    /**
     * Zone used by {@link #businessHours()}, {@link #repeatAt} and weekly or cron schedules, whatever
     * the order of the calls. There is no default: building a job that needs a zone without one fails.
     */
    public ReportJobBuilder<R> timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        this.zone = ZoneId.of(timezone);
        return this;
    }

    public ReportJobBuilder<R> timezone(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        return this;
    }

    public ReportJobBuilder<R> window(WindowPolicy window) {
        Objects.requireNonNull(window, "window must not be null");
        this.window = ignored -> window;
        this.windowNeedsZone = false;
        return this;
    }

    /**
     * Monday to Saturday, 06:00 to 20:00 in the configured zone.
     */
    public ReportJobBuilder<R> businessHours() {
        this.window = BusinessHoursWindow::defaults;
        this.windowNeedsZone = true;
        return this;
    }

    public ReportJobBuilder<R> repeatEvery(Duration interval) {
        IntervalRule rule = new IntervalRule(interval);
        this.recurrence = ignored -> rule;
        this.recurrenceNeedsZone = false;
        return this;
    }

    /**
     * Repeat at the given times ({@code HH:mm} or {@code HH:mm:ss}) on the given weekdays.
     */
    public ReportJobBuilder<R> repeatAt(Set<DayOfWeek> days, String... times) {
        Objects.requireNonNull(days, "days must not be null");
        Objects.requireNonNull(times, "times must not be null");
        List<LocalTime> parsed = Arrays.stream(times)
                .map(ScheduleParser::parseTimeOfDay)
                .toList();
        Set<DayOfWeek> copy = Set.copyOf(days);
        this.recurrence = z -> new WeeklyRule(z, copy, parsed);
        this.recurrenceNeedsZone = true;
        return this;
    }

    /**
     * Accepts every format understood by {@link ScheduleParser#parseRecurrence(String, ZoneId)}.
     * Malformed specs are rejected here, not in {@link #build()}.
     */
    public ReportJobBuilder<R> schedule(String spec) {
        RecurrenceRule parsed = ScheduleParser.parseRecurrence(spec, ZoneOffset.UTC);
        if (parsed instanceof IntervalRule) {
            this.recurrence = ignored -> parsed;
            this.recurrenceNeedsZone = false;
        } else {
            this.recurrence = z -> ScheduleParser.parseRecurrence(spec, z);
            this.recurrenceNeedsZone = true;
        }
        return this;
    }

    public ReportJobBuilder<R> recurrence(RecurrenceRule recurrence) {
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        this.recurrence = ignored -> recurrence;
        this.recurrenceNeedsZone = false;
        return this;
    }

    public ReportJob<R> build() {
        if (formatter == null) {
            throw new IllegalStateException("formatter is required for job " + name);
        }
        if (sink == null) {
            throw new IllegalStateException("sink is required for job " + name);
        }
        if (recurrence == null) {
            throw new IllegalStateException("recurrence is required for job " + name);
        }
        return new ReportJob<>(name, source, formatter, sink, channel, resolve(window, windowNeedsZone), resolve(recurrence, recurrenceNeedsZone));
    }

    private <T> T resolve(Function<ZoneId, T> part, boolean needsZone) {
        if (part == null) {
            return null;
        }
        if (needsZone && zone == null) {
            throw new IllegalStateException("timezone is required for job " + name);
        }
        return part.apply(zone);
    }
}
