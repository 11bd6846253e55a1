package io.pulse4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Opens on the given weekdays between {@code opensAt} (inclusive) and {@code closesAt} (exclusive),
 * both read in {@code zone} rather than the host's default zone.
 */
public record BusinessHoursWindow(
        ZoneId zone,
        Set<DayOfWeek> openDays,
        LocalTime opensAt,
        LocalTime closesAt
) implements WindowPolicy {

    public static final LocalTime DEFAULT_OPENS_AT = LocalTime.of(6, 0);
    public static final LocalTime DEFAULT_CLOSES_AT = LocalTime.of(20, 0);

    public BusinessHoursWindow {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(openDays, "openDays must not be null");
        Objects.requireNonNull(opensAt, "opensAt must not be null");
        Objects.requireNonNull(closesAt, "closesAt must not be null");
        if (openDays.isEmpty()) {
            throw new IllegalArgumentException("openDays must not be empty");
        }
        if (!opensAt.isBefore(closesAt)) {
            throw new IllegalArgumentException("opensAt must be before closesAt: " + opensAt + "-" + closesAt);
        }
        openDays = Set.copyOf(EnumSet.copyOf(openDays));
    }

    /**
     * Monday to Saturday, 06:00 to 20:00.
     */
    public static BusinessHoursWindow defaults(ZoneId zone) {
        return new BusinessHoursWindow(
                zone,
                EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.SATURDAY),
                DEFAULT_OPENS_AT,
                DEFAULT_CLOSES_AT
        );
    }

    @Override
    public boolean allowed(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (!openDays.contains(local.getDayOfWeek())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(opensAt) && time.isBefore(closesAt);
    }
}
