package io.pulse4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Due at fixed wall-clock times on selected weekdays, read in {@code zone}.
 *
 * <p>A job is due when today is a scheduled day, at least one slot time of today has passed and the
 * job has not run since the latest passed slot. Slots missed while the process was busy collapse into
 * a single run; on a day that is not scheduled the job is never due.
 */
public final class WeeklyRule implements RecurrenceRule {

    private final ZoneId zone;
    private final Set<DayOfWeek> days;
    private final NavigableSet<LocalTime> times;

    public WeeklyRule(ZoneId zone, Collection<DayOfWeek> days, Collection<LocalTime> times) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(days, "days must not be null");
        Objects.requireNonNull(times, "times must not be null");
        if (days.isEmpty()) {
            throw new IllegalArgumentException("days must not be empty");
        }
        if (times.isEmpty()) {
            throw new IllegalArgumentException("times must not be empty");
        }
        this.days = Collections.unmodifiableSet(EnumSet.copyOf(days));
        this.times = Collections.unmodifiableNavigableSet(new TreeSet<>(times));
    }

    public ZoneId zone() {
        return zone;
    }

    public Set<DayOfWeek> days() {
        return days;
    }

    public NavigableSet<LocalTime> times() {
        return times;
    }

    @Override
    public boolean isDue(Instant lastRun, Instant now) {
        Optional<ZonedDateTime> slot = latestPassedSlotToday(now);
        return slot.isPresent() && (lastRun == null || lastRun.isBefore(slot.get().toInstant()));
    }

    @Override
    public Instant nextDueAt(Instant lastRun, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (isDue(lastRun, now)) {
            return latestPassedSlotToday(now).orElseThrow().toInstant();
        }
        Instant from = (lastRun != null && lastRun.isAfter(now)) ? lastRun : now;
        return firstSlotAfter(from).toInstant();
    }

    private Optional<ZonedDateTime> latestPassedSlotToday(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (!days.contains(local.getDayOfWeek())) {
            return Optional.empty();
        }
        LocalTime slot = times.floor(local.toLocalTime());
        if (slot == null) {
            return Optional.empty();
        }
        return Optional.of(ZonedDateTime.of(local.toLocalDate(), slot, zone));
    }

    private ZonedDateTime firstSlotAfter(Instant instant) {
        LocalDate start = instant.atZone(zone).toLocalDate();
        // 8 days covers a slot earlier today that only recurs next week
        for (int offset = 0; offset <= 7; offset++) {
            LocalDate date = start.plusDays(offset);
            if (!days.contains(date.getDayOfWeek())) {
                continue;
            }
            for (LocalTime time : times) {
                ZonedDateTime candidate = ZonedDateTime.of(date, time, zone);
                if (candidate.toInstant().isAfter(instant)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("No slot found after " + instant + " for " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeeklyRule other)) return false;
        return zone.equals(other.zone) && days.equals(other.days) && times.equals(other.times);
    }

    @Override
    public int hashCode() {
        return Objects.hash(zone, days, times);
    }

    @Override
    public String toString() {
        return days + " AT " + times + " (" + zone + ")";
    }
}
