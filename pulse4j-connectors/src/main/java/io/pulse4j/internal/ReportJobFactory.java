package io.pulse4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.DataSource;
import io.pulse4j.ReportJob;
import io.pulse4j.Sink;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.ConnectivityTarget;
import io.pulse4j.internal.format.MessageTemplate;
import io.pulse4j.internal.jdbc.JdbcQueryDataSource;
import io.pulse4j.internal.superset.SupersetChartDataSource;
import io.pulse4j.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns {@link PulseProperties.Job} definitions into {@link ReportJob}s.
 *
 * <p>All jobs share one {@link Sink}, one HTTP client and, for SQL jobs, one
 * {@code DriverManagerDataSource} (which opens a new connection per query and pools nothing).
 */
public class ReportJobFactory {
    private static final Logger log = LoggerFactory.getLogger(ReportJobFactory.class);

    private final PulseProperties properties;
    private final Sink sink;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    private javax.sql.DataSource jdbcDataSource;

    public ReportJobFactory(
            PulseProperties properties,
            Sink sink,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader
    ) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader must not be null");
    }

    public List<ReportJob<TabularResult>> createAll() {
        List<ReportJob<TabularResult>> jobs = new ArrayList<>();
        for (PulseProperties.Job definition : properties.getJobs()) {
            jobs.add(create(definition));
        }
        return jobs;
    }

    /**
     * @throws IllegalStateException when the definition cannot be turned into a job
     */
    public ReportJob<TabularResult> create(PulseProperties.Job definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        String name = definition.getName();
        try {
            ZoneId zone = properties.zoneId();
            MessageTemplate template = MessageTemplate.parse(definition.getFormat());
            String title = definition.getTitle() == null || definition.getTitle().isBlank()
                    ? name
                    : definition.getTitle();

            ReportJob<TabularResult> job = ReportJob.builder(name, source(definition))
                    .formatter(template.create(title, zone))
                    .deliverTo(sink, definition.getChannel())
                    .timezone(zone)
                    .window(ScheduleParser.parseWindow(definition.getWindow(), zone))
                    .schedule(definition.getSchedule())
                    .build();
            log.debug("Built job name={} source={} template={}", name, definition.getSource(), template);
            return job;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid job '" + name + "': " + e.getMessage(), e);
        }
    }

    private DataSource<TabularResult> source(PulseProperties.Job definition) {
        if (definition.getSource() == null) {
            throw new IllegalArgumentException("source is required");
        }
        return switch (definition.getSource()) {
            case SQL -> jdbcSource(definition);
            case SUPERSET -> supersetSource(definition);
        };
    }

    private JdbcQueryDataSource jdbcSource(PulseProperties.Job definition) {
        PulseProperties.Database db = properties.getDatabase();
        return new JdbcQueryDataSource(
                jdbcDataSource(),
                new ConnectivityTarget(db.getHost(), db.getPort(), db.getPollInterval()),
                sql(definition),
                definition.getParameters(),
                db.getQueryTimeout()
        );
    }

    private SupersetChartDataSource supersetSource(PulseProperties.Job definition) {
        if (definition.getChartId() == null) {
            throw new IllegalArgumentException("chart-id is required for SUPERSET jobs");
        }
        PulseProperties.Superset superset = properties.getSuperset();
        return new SupersetChartDataSource(
                httpClient,
                objectMapper,
                superset.getUrl(),
                superset.getUsername(),
                superset.getPassword(),
                definition.getChartId(),
                superset.getTimeout()
        );
    }

    private synchronized javax.sql.DataSource jdbcDataSource() {
        if (jdbcDataSource == null) {
            PulseProperties.Database db = properties.getDatabase();
            jdbcDataSource = new DriverManagerDataSource(db.jdbcUrl(), db.getUser(), db.getPassword());
        }
        return jdbcDataSource;
    }

    private String sql(PulseProperties.Job definition) {
        if (definition.getQuery() != null && !definition.getQuery().isBlank()) {
            return definition.getQuery();
        }
        String location = definition.getQueryResource();
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("query or query-resource is required for SQL jobs");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalArgumentException("query resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read query resource " + location, e);
        }
    }
}
