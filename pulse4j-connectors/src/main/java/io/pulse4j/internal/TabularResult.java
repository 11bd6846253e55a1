package io.pulse4j.internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column names plus ordered rows, each row keyed by column name. Returned by every bundled
 * {@link io.pulse4j.DataSource}.
 */
public record TabularResult(List<String> columns, List<Map<String, Object>> rows) {

    public TabularResult {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        columns = List.copyOf(columns);
        // rows may hold SQL NULLs, so no Map.copyOf here
        rows = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
    }

    public static TabularResult empty() {
        return new TabularResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
