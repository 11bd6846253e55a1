package io.pulse4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.ReportJob;
import io.pulse4j.Sink;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.BusinessHoursWindow;
import io.pulse4j.core.ConnectivityTarget;
import io.pulse4j.core.IntervalRule;
import io.pulse4j.core.WeeklyRule;
import io.pulse4j.core.WindowPolicy;
import io.pulse4j.internal.jdbc.JdbcQueryDataSource;
import io.pulse4j.internal.superset.SupersetChartDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ReportJobFactoryTest {

    private final Sink sink = mock(Sink.class);
    private PulseProperties properties;
    private ReportJobFactory factory;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        properties.getDatabase().setHost("db.internal");
        properties.getDatabase().setName("tudoprod");
        properties.getSuperset().setUrl("https://superset.internal");
        properties.getSlack().setToken("xoxb");
        factory = new ReportJobFactory(properties, sink, HttpClient.newHttpClient(), new ObjectMapper(),
                new DefaultResourceLoader());
    }

    @Test
    void sqlJobWaitsForDatabaseAndUsesBusinessHours() {
        PulseProperties.Job definition = new PulseProperties.Job();
        definition.setName("NOVO");
        definition.setQueryResource("classpath:sql/steps.sql");
        definition.setParameters(Map.of("loantype", "NEW"));
        definition.setTitle("Monitoramento de Esteiras — Produto NOVO");
        definition.setChannel("#monitoramento-privado");
        definition.setSchedule("every 30 minutes");
        definition.setWindow("default");

        ReportJob<TabularResult> job = factory.create(definition);

        assertThat(job.name()).isEqualTo("NOVO");
        assertThat(job.channel()).isEqualTo("#monitoramento-privado");
        assertThat(job.sink()).isSameAs(sink);
        assertThat(job.recurrence()).isEqualTo(new IntervalRule(Duration.ofMinutes(30)));
        assertThat(job.window()).isEqualTo(BusinessHoursWindow.defaults(ZoneId.of("America/Fortaleza")));
        assertThat(job.source()).isInstanceOf(JdbcQueryDataSource.class);
        assertThat(job.source().target())
                .isEqualTo(new ConnectivityTarget("db.internal", 5432, Duration.ofMinutes(15)));
    }

    @Test
    void supersetJobHasNoConnectivityTarget() {
        PulseProperties.Job definition = new PulseProperties.Job();
        definition.setName("CHART_5840");
        definition.setSource(PulseProperties.SourceType.SUPERSET);
        definition.setChartId(5840);
        definition.setFormat("row-count");
        definition.setChannel("C0123");
        definition.setSchedule("MON-SAT AT 11:30,17:30");

        ReportJob<TabularResult> job = factory.create(definition);

        assertThat(job.source()).isInstanceOf(SupersetChartDataSource.class);
        assertThat(((SupersetChartDataSource) job.source()).chartId()).isEqualTo(5840);
        assertThat(job.source().target()).isNull();
        assertThat(job.recurrence()).isInstanceOf(WeeklyRule.class);
        assertThat(job.window()).isSameAs(WindowPolicy.always());
    }

    @Test
    void createAllKeepsDefinitionOrder() {
        properties.getJobs().add(inlineJob("PORTABILITY"));
        properties.getJobs().add(inlineJob("NOVO"));

        List<ReportJob<TabularResult>> jobs = factory.createAll();

        assertThat(jobs).extracting(ReportJob::name).containsExactly("PORTABILITY", "NOVO");
    }

    @Test
    void invalidScheduleNamesTheJob() {
        PulseProperties.Job definition = inlineJob("REFIN");
        definition.setSchedule("now and then");

        assertThatThrownBy(() -> factory.create(definition))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Invalid job 'REFIN'");
    }

    @Test
    void missingQueryResourceIsRejected() {
        PulseProperties.Job definition = inlineJob("REFIN");
        definition.setQuery(null);
        definition.setQueryResource("classpath:sql/nope.sql");

        assertThatThrownBy(() -> factory.create(definition))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("query resource not found");
    }

    @Test
    void queryResourceIsReadAndClosed() {
        AtomicBoolean closed = new AtomicBoolean();
        ResourceLoader loader = new DefaultResourceLoader() {
            @Override
            public Resource getResource(String location) {
                return new ByteArrayResource("select count(*) from loans".getBytes(StandardCharsets.UTF_8)) {
                    @Override
                    public InputStream getInputStream() {
                        return new FilterInputStream(new ByteArrayInputStream(getByteArray())) {
                            @Override
                            public void close() throws IOException {
                                closed.set(true);
                                super.close();
                            }
                        };
                    }
                };
            }
        };
        factory = new ReportJobFactory(properties, sink, HttpClient.newHttpClient(), new ObjectMapper(), loader);
        PulseProperties.Job definition = inlineJob("RESUMO");
        definition.setQuery(null);
        definition.setQueryResource("classpath:sql/resumo.sql");

        ReportJob<TabularResult> job = factory.create(definition);

        assertThat(((JdbcQueryDataSource) job.source()).sql()).isEqualTo("select count(*) from loans");
        assertThat(closed).isTrue();
    }

    private static PulseProperties.Job inlineJob(String name) {
        PulseProperties.Job job = new PulseProperties.Job();
        job.setName(name);
        job.setQuery("select 1");
        job.setChannel("#esteiras");
        job.setSchedule("40m");
        return job;
    }
}
