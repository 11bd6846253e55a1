package io.pulse4j.internal.format;

import io.pulse4j.MessageFormatter;
import io.pulse4j.core.FormattedMessage;
import io.pulse4j.internal.TabularResult;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

public class RowCountFormatter implements MessageFormatter<TabularResult> {

    private final String title;
    private final ZoneId zone;

    public RowCountFormatter(String title, ZoneId zone) {
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public FormattedMessage format(TabularResult result, Instant generatedAt) {
        String header = ReportFormats.header(title, generatedAt, zone);
        // no columns at all means the source returned no result set
        if (result.columns().isEmpty() && result.isEmpty()) {
            return FormattedMessage.markdown(header + "⚠ Nenhum dado retornado.");
        }
        return FormattedMessage.markdown(header + "- Total de registros retornados: *" + result.size() + "*");
    }
}
