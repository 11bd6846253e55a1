package io.pulse4j.internal.format;

import io.pulse4j.MessageFormatter;
import io.pulse4j.core.FormattedMessage;
import io.pulse4j.internal.TabularResult;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One line per pipeline step: step name, contract count and gross value.
 *
 * <p>Expects the columns {@code last_steptype}, {@code qtd} and {@code sum_gross}.
 */
public class StepBreakdownFormatter implements MessageFormatter<TabularResult> {

    static final String STEP = "last_steptype";
    static final String COUNT = "qtd";
    static final String GROSS = "sum_gross";

    private final String title;
    private final ZoneId zone;

    public StepBreakdownFormatter(String title, ZoneId zone) {
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public FormattedMessage format(TabularResult result, Instant generatedAt) {
        String header = ReportFormats.header(title, generatedAt, zone);
        if (result.isEmpty()) {
            return FormattedMessage.markdown(header + MessageTemplate.NO_RECORDS);
        }
        requireColumns(result);

        String lines = result.rows().stream()
                .map(StepBreakdownFormatter::line)
                .collect(Collectors.joining("\n"));
        return FormattedMessage.markdown(header + lines);
    }

    private static String line(Map<String, Object> row) {
        Object step = row.get(STEP);
        return "• `" + (step == null ? ReportFormats.MISSING : step) + "` — "
                + ReportFormats.integer(row.get(COUNT)) + " contratos — "
                + ReportFormats.brl(row.get(GROSS));
    }

    private static void requireColumns(TabularResult result) {
        for (String column : new String[]{STEP, COUNT, GROSS}) {
            if (!result.columns().contains(column)) {
                throw new IllegalStateException("missing column " + column + " in " + result.columns());
            }
        }
    }
}
