package io.pulse4j.core;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Due at the occurrences of a Quartz cron expression evaluated in {@code zone}.
 *
 * <p>A job that never ran is due when an occurrence has already passed today, mirroring
 * {@link WeeklyRule}.
 */
public record CronRule(String expression, ZoneId zone) implements RecurrenceRule {

    public CronRule {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (!CronExpression.isValidExpression(expression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression);
        }
    }

    @Override
    public Instant nextDueAt(Instant lastRun, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Instant base = lastRun != null
                ? lastRun
                : now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant().minusSeconds(1);

        Date next = compile().getNextValidTimeAfter(Date.from(base));
        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + expression);
        }
        return next.toInstant();
    }

    private CronExpression compile() {
        try {
            CronExpression exp = new CronExpression(expression);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, ex);
        }
    }

    @Override
    public String toString() {
        return "cron " + expression + " (" + zone + ")";
    }
}
