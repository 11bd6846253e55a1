package io.pulse4j.utils;

import io.pulse4j.core.BusinessHoursWindow;
import io.pulse4j.core.CronRule;
import io.pulse4j.core.IntervalRule;
import io.pulse4j.core.RecurrenceRule;
import io.pulse4j.core.WeeklyRule;
import io.pulse4j.core.WindowPolicy;
import org.quartz.CronExpression;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses textual schedules from configuration.
 * <p>
 * Recurrence formats:
 * <ul>
 *   <li>Intervals: "30 minutes", "1 hour 30 minutes", "30m", "1800" (seconds), optionally prefixed by "every"</li>
 *   <li>Weekly slots: "MON-SAT AT 11:30,17:30", "MON,TUE AT 09:00", "DAILY AT 08:00"</li>
 *   <li>Cron expressions (5 or 6 fields), e.g. "0 30 11 ? * MON-SAT"</li>
 * </ul>
 * Window formats: "always", "default" (Monday to Saturday 06:00-20:00) and "MON-FRI 08:00-18:00".
 */
public final class ScheduleParser {

    private static final Pattern WEEKLY = Pattern.compile("^(.+?)\\s+AT\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW = Pattern.compile(
            "^(.+?)\\s+(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})$", Pattern.CASE_INSENSITIVE);

    private ScheduleParser() {
    }

    /**
     * Parse a recurrence spec. Weekly and cron schedules are read in {@code zone}.
     */
    public static RecurrenceRule parseRecurrence(String spec, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        String s = requireText(spec);

        Matcher weekly = WEEKLY.matcher(s);
        if (weekly.matches()) {
            Set<DayOfWeek> days = parseDays(weekly.group(1));
            List<LocalTime> times = new ArrayList<>();
            for (String t : weekly.group(2).split("\\s*,\\s*")) {
                times.add(parseTimeOfDay(t));
            }
            return new WeeklyRule(zone, days, times);
        }

        if (looksLikeCron(s)) {
            return new CronRule(normalizeCron(s), zone);
        }

        String interval = s.toLowerCase(Locale.ROOT);
        if (interval.startsWith("every ")) {
            interval = interval.substring("every ".length()).trim();
        }
        Duration d = parseHumanDuration(interval);
        if (d.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + spec);
        }
        return new IntervalRule(d);
    }

    /**
     * Parse a window spec. Hours are read in {@code zone}.
     */
    public static WindowPolicy parseWindow(String spec, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        String s = requireText(spec);

        if ("always".equalsIgnoreCase(s)) {
            return WindowPolicy.always();
        }
        if ("default".equalsIgnoreCase(s) || "business-hours".equalsIgnoreCase(s)) {
            return BusinessHoursWindow.defaults(zone);
        }

        Matcher m = WINDOW.matcher(s);
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Invalid window. Expected 'always', 'default' or '<days> HH:mm-HH:mm': " + spec);
        }
        return new BusinessHoursWindow(
                zone,
                parseDays(m.group(1)),
                parseTimeOfDay(m.group(2)),
                parseTimeOfDay(m.group(3))
        );
    }

    /**
     * Parse a day list such as "MON-SAT", "MON,WED,FRI", "monday,tuesday" or "DAILY".
     */
    public static Set<DayOfWeek> parseDays(String spec) {
        String s = requireText(spec).toUpperCase(Locale.ROOT);
        if ("DAILY".equals(s) || "*".equals(s)) {
            return EnumSet.allOf(DayOfWeek.class);
        }

        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String part : s.split("\\s*,\\s*")) {
            int dash = part.indexOf('-');
            if (dash > 0) {
                DayOfWeek from = parseDay(part.substring(0, dash));
                DayOfWeek to = parseDay(part.substring(dash + 1));
                DayOfWeek d = from;
                while (true) {
                    days.add(d);
                    if (d == to) {
                        break;
                    }
                    d = d.plus(1);
                }
            } else {
                days.add(parseDay(part));
            }
        }
        return days;
    }

    public static LocalTime parseTimeOfDay(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        String t = timeOfDay.trim();
        // LocalTime.parse wants two-digit hours
        if (t.matches("^\\d:\\d{2}(:\\d{2})?$")) {
            t = "0" + t;
        }
        try {
            return LocalTime.parse(t);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid timeOfDay. Expected HH:mm or HH:mm:ss: " + timeOfDay);
        }
    }

    private static DayOfWeek parseDay(String token) {
        String t = token.trim();
        for (DayOfWeek d : DayOfWeek.values()) {
            if (d.name().equals(t) || d.name().startsWith(t) && t.length() >= 3) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown day of week: " + token);
    }

    /**
     * Normalize cron expressions:
     * - Accepts 6-field cron.
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String spec) {
        String s = requireText(spec);
        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        // Quartz needs '?' in exactly one of day-of-month / day-of-week
        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom) && !"?".equals(dow)) {
            dom = "?";
        } else if ("*".equals(dow) && !"?".equals(dom)) {
            dow = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '30 minutes': " + input);
        }

        Set<ChronoUnit> seen = EnumSet.noneOf(ChronoUnit.class);
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            ChronoUnit cu = switch (unit) {
                case "week" -> ChronoUnit.WEEKS;
                case "day" -> ChronoUnit.DAYS;
                case "hour" -> ChronoUnit.HOURS;
                case "minute", "min" -> ChronoUnit.MINUTES;
                case "second", "sec" -> ChronoUnit.SECONDS;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            };
            if (!seen.add(cu)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            totalSeconds += cu.getDuration().toSeconds() * n;
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static String requireText(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        return s;
    }
}
