package io.pulse4j.internal.format;

import io.pulse4j.MessageFormatter;
import io.pulse4j.internal.TabularResult;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.Locale;

/**
 * Bundled report layouts, selectable by name from configuration.
 */
public enum MessageTemplate {

    STEP_BREAKDOWN {
        @Override
        public MessageFormatter<TabularResult> create(String title, ZoneId zone) {
            return new StepBreakdownFormatter(title, zone);
        }
    },

    PRODUCT_SUMMARY {
        @Override
        public MessageFormatter<TabularResult> create(String title, ZoneId zone) {
            return new ProductSummaryFormatter(title, zone);
        }
    },

    ROW_COUNT {
        @Override
        public MessageFormatter<TabularResult> create(String title, ZoneId zone) {
            return new RowCountFormatter(title, zone);
        }
    };

    static final String NO_RECORDS = "_Sem registros para o dia atual._";

    public abstract MessageFormatter<TabularResult> create(String title, ZoneId zone);

    public static MessageTemplate parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("template name must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (MessageTemplate t : values()) {
            if (t.name().equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown template: " + name + ", expected one of " + Arrays.toString(values()));
    }
}
