package io.pulse4j.internal.format;

import io.pulse4j.MessageFormatter;
import io.pulse4j.core.FormattedMessage;
import io.pulse4j.internal.TabularResult;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Daily paid summary, one block per product. REFIN blocks add the deposit value and PORTABILITY
 * blocks the paid balances.
 */
public class ProductSummaryFormatter implements MessageFormatter<TabularResult> {

    private final String title;
    private final ZoneId zone;

    public ProductSummaryFormatter(String title, ZoneId zone) {
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public FormattedMessage format(TabularResult result, Instant generatedAt) {
        String header = ReportFormats.header(title, generatedAt, zone);
        if (result.isEmpty()) {
            return FormattedMessage.markdown(header + MessageTemplate.NO_RECORDS);
        }
        if (!result.columns().contains("produto")) {
            throw new IllegalStateException("missing column produto in " + result.columns());
        }

        String blocks = result.rows().stream()
                .map(ProductSummaryFormatter::block)
                .collect(Collectors.joining("\n\n"));
        return FormattedMessage.markdown(header + blocks);
    }

    private static String block(Map<String, Object> row) {
        Object rawProduct = row.get("produto");
        String product = rawProduct == null ? "" : rawProduct.toString().toUpperCase(Locale.ROOT);

        List<String> lines = new ArrayList<>();
        lines.add("*" + product + "*");
        lines.add("  • Quantidade: *" + ReportFormats.count(row.get("quantidade")) + "*");
        lines.add("  • Grossvalue: " + ReportFormats.brl(row.get("grossvalue")));
        if ("REFIN".equals(product)) {
            lines.add("  • Valor Depósito: " + ReportFormats.brl(row.get("valor_de_deposito")));
        }
        if ("PORTABILITY".equals(product)) {
            lines.add("  • Saldos Pagos: " + ReportFormats.brl(row.get("saldos_pagos")));
        }
        lines.add("  • Aproveitamento (dia): " + ReportFormats.pct(row.get("perc_aproveitamento_dia")));
        lines.add("  • Aproveitamento (mês): " + ReportFormats.pct(row.get("perc_aproveitamento_mes")));
        return String.join("\n", lines);
    }
}
