package io.pulse4j.internal.format;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Number and date rendering shared by the message templates. Missing or unparseable values render
 * as {@code "-"}.
 */
public final class ReportFormats {

    public static final String MISSING = "-";

    private static final Locale PT_BR = new Locale("pt", "BR");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private ReportFormats() {
    }

    /**
     * {@code 1234.5 -> "R$ 1.234,50"}
     */
    public static String brl(Object value) {
        BigDecimal v = toDecimal(value);
        if (v == null) {
            return MISSING;
        }
        // DecimalFormat is not thread-safe
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(PT_BR));
        return "R$ " + format.format(v);
    }

    /**
     * {@code 12.345 -> "12.35%"}
     */
    public static String pct(Object value) {
        BigDecimal v = toDecimal(value);
        if (v == null) {
            return MISSING;
        }
        return String.format(Locale.ROOT, "%.2f%%", v);
    }

    /**
     * Missing counts read as zero, for totals where "nothing" and "zero" mean the same.
     */
    public static long count(Object value) {
        BigDecimal v = toDecimal(value);
        return v == null ? 0L : v.longValue();
    }

    /**
     * {@code 12.0 -> "12"}, missing stays {@code "-"}.
     */
    public static String integer(Object value) {
        BigDecimal v = toDecimal(value);
        return v == null ? MISSING : Long.toString(v.longValue());
    }

    public static String header(String title, Instant generatedAt, ZoneId zone) {
        return "*" + title + "*\n"
                + "📅 " + STAMP.format(generatedAt.atZone(zone)) + " (" + zone.getId() + ")\n\n";
    }

    static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            Number n = (Number) value;
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return value instanceof Long || value instanceof Integer
                    ? BigDecimal.valueOf(n.longValue())
                    : BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
