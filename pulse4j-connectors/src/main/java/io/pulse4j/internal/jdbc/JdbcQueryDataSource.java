package io.pulse4j.internal.jdbc;

import io.pulse4j.DataSource;
import io.pulse4j.core.ConnectivityTarget;
import io.pulse4j.internal.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSetMetaData;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one named-parameter SQL query per fetch.
 *
 * <p>Connections come from the supplied {@link javax.sql.DataSource} and are returned to it by
 * Spring JDBC before {@link #fetch()} returns, whether the query succeeds or not. With a
 * {@code DriverManagerDataSource} that means a fresh physical connection per fetch.
 */
public class JdbcQueryDataSource implements DataSource<TabularResult> {
    private static final Logger log = LoggerFactory.getLogger(JdbcQueryDataSource.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ConnectivityTarget target;
    private final String sql;
    private final Map<String, Object> parameters;

    public JdbcQueryDataSource(
            javax.sql.DataSource dataSource,
            ConnectivityTarget target,
            String sql,
            Map<String, Object> parameters,
            Duration queryTimeout
    ) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        Objects.requireNonNull(queryTimeout, "queryTimeout must not be null");
        this.target = target;
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.parameters = parameters == null ? Map.of() : new LinkedHashMap<>(parameters);
        if (sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be blank");
        }

        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.jdbcTemplate.getJdbcTemplate().setQueryTimeout(Math.toIntExact(queryTimeout.toSeconds()));
    }

    @Override
    public ConnectivityTarget target() {
        return target;
    }

    public String sql() {
        return sql;
    }

    @Override
    public TabularResult fetch() {
        long started = System.nanoTime();
        TabularResult result = jdbcTemplate.query(
                sql,
                new MapSqlParameterSource(parameters),
                (ResultSetExtractor<TabularResult>) rs -> {
                    ResultSetMetaData meta = rs.getMetaData();
                    List<String> columns = new ArrayList<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        columns.add(meta.getColumnLabel(i));
                    }
                    List<Map<String, Object>> rows = new ArrayList<>();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int i = 1; i <= columns.size(); i++) {
                            row.put(columns.get(i - 1), rs.getObject(i));
                        }
                        rows.add(row);
                    }
                    return new TabularResult(columns, rows);
                }
        );
        log.debug("Query returned {} rows in {} ms", result == null ? 0 : result.size(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        return result == null ? TabularResult.empty() : result;
    }
}
