package io.pulse4j.internal.format;

import io.pulse4j.core.FormattedMessage;
import io.pulse4j.internal.TabularResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTemplateTest {

    private static final ZoneId ZONE = ZoneId.of("America/Fortaleza");
    private static final Instant AT = Instant.parse("2026-03-03T13:00:00Z");

    @Test
    void stepBreakdownListsEachStep() {
        TabularResult result = new TabularResult(
                List.of("last_steptype", "qtd", "sum_gross"),
                List.of(
                        row("last_steptype", "PAID", "qtd", 12L, "sum_gross", new BigDecimal("154320.5")),
                        row("last_steptype", "ANALYSIS", "qtd", 3L, "sum_gross", new BigDecimal("999.999"))
                )
        );

        FormattedMessage message = MessageTemplate.STEP_BREAKDOWN
                .create("Monitoramento de Esteiras — Produto NOVO", ZONE)
                .format(result, AT);

        assertThat(message.markdown()).isTrue();
        assertThat(message.text()).isEqualTo(
                "*Monitoramento de Esteiras — Produto NOVO*\n"
                        + "📅 03/03/2026 10:00 (America/Fortaleza)\n\n"
                        + "• `PAID` — 12 contratos — R$ 154.320,50\n"
                        + "• `ANALYSIS` — 3 contratos — R$ 1.000,00");
    }

    @Test
    void stepWithoutCountShowsDash() {
        TabularResult result = new TabularResult(
                List.of("last_steptype", "qtd", "sum_gross"),
                List.of(row("last_steptype", "PAID", "qtd", null, "sum_gross", 10))
        );

        FormattedMessage message = MessageTemplate.STEP_BREAKDOWN.create("Produto NOVO", ZONE).format(result, AT);

        assertThat(message.text()).endsWith("\n\n• `PAID` — - contratos — R$ 10,00");
    }

    @Test
    void emptyResultSaysNoRecords() {
        FormattedMessage message = MessageTemplate.STEP_BREAKDOWN
                .create("Produto REFIN", ZONE)
                .format(new TabularResult(List.of("last_steptype", "qtd", "sum_gross"), List.of()), AT);

        assertThat(message.text()).endsWith("\n\n_Sem registros para o dia atual._");
    }

    @Test
    void stepBreakdownRejectsUnexpectedColumns() {
        TabularResult result = new TabularResult(List.of("step"), List.of(row("step", "PAID")));

        assertThatThrownBy(() -> MessageTemplate.STEP_BREAKDOWN.create("x", ZONE).format(result, AT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("last_steptype");
    }

    @Test
    void productSummaryAddsProductSpecificLines() {
        Map<String, Object> refin = row(
                "produto", "refin", "quantidade", 4, "grossvalue", 20000.0,
                "valor_de_deposito", 8500.25, "saldos_pagos", null,
                "perc_aproveitamento_dia", 33.333, "perc_aproveitamento_mes", null);
        Map<String, Object> portability = row(
                "produto", "PORTABILITY", "quantidade", null, "grossvalue", null,
                "valor_de_deposito", null, "saldos_pagos", 1234.5,
                "perc_aproveitamento_dia", 50, "perc_aproveitamento_mes", 12.5);
        TabularResult result = new TabularResult(List.copyOf(refin.keySet()), List.of(refin, portability));

        FormattedMessage message = MessageTemplate.PRODUCT_SUMMARY
                .create("Resumo Diário Privado — Consignado Privado", ZONE)
                .format(result, AT);

        assertThat(message.text()).isEqualTo(
                "*Resumo Diário Privado — Consignado Privado*\n"
                        + "📅 03/03/2026 10:00 (America/Fortaleza)\n\n"
                        + "*REFIN*\n"
                        + "  • Quantidade: *4*\n"
                        + "  • Grossvalue: R$ 20.000,00\n"
                        + "  • Valor Depósito: R$ 8.500,25\n"
                        + "  • Aproveitamento (dia): 33.33%\n"
                        + "  • Aproveitamento (mês): -\n\n"
                        + "*PORTABILITY*\n"
                        + "  • Quantidade: *0*\n"
                        + "  • Grossvalue: -\n"
                        + "  • Saldos Pagos: R$ 1.234,50\n"
                        + "  • Aproveitamento (dia): 50.00%\n"
                        + "  • Aproveitamento (mês): 12.50%");
    }

    @Test
    void rowCountDistinguishesMissingResultFromEmptyOne() {
        RowCountFormatter formatter = new RowCountFormatter("Monitoramento automático via Superset", ZONE);

        assertThat(formatter.format(TabularResult.empty(), AT).text()).endsWith("⚠ Nenhum dado retornado.");
        assertThat(formatter.format(new TabularResult(List.of("id"), List.of()), AT).text())
                .endsWith("- Total de registros retornados: *0*");
        assertThat(formatter.format(new TabularResult(List.of("id"), List.of(row("id", 1), row("id", 2))), AT).text())
                .endsWith("- Total de registros retornados: *2*");
    }

    @Test
    void parseAcceptsConfigurationSpellings() {
        assertThat(MessageTemplate.parse("step-breakdown")).isEqualTo(MessageTemplate.STEP_BREAKDOWN);
        assertThat(MessageTemplate.parse(" product_summary ")).isEqualTo(MessageTemplate.PRODUCT_SUMMARY);
        assertThatThrownBy(() -> MessageTemplate.parse("pie-chart"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ROW_COUNT");
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
