package io.pulse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.Pulse;
import io.pulse4j.ReportJob;
import io.pulse4j.Sink;
import io.pulse4j.core.ConnectivityGate;
import io.pulse4j.core.JobExecutor;
import io.pulse4j.core.Scheduler;
import io.pulse4j.internal.PulseRunner;
import io.pulse4j.internal.ReportJobFactory;
import io.pulse4j.internal.slack.SlackSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Spring Boot auto-configuration entrypoint for the report runner.
 *
 * <p>Jobs come from {@code pulse.jobs} plus any {@link ReportJob} beans in the context, registered
 * in that order. The configuration is validated before anything is registered; an invalid one fails
 * the context.
 */
@AutoConfiguration
@ConditionalOnClass(Pulse.class)
@EnableConfigurationProperties(PulseProperties.class)
@ConditionalOnProperty(prefix = "pulse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PulseConfig {
    private static final Logger log = LoggerFactory.getLogger(PulseConfig.class);

    @Bean
    @ConditionalOnMissingBean(name = "pulseHttpClient")
    public HttpClient pulseHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sink pulseSink(PulseProperties props, HttpClient pulseHttpClient, ObjectProvider<ObjectMapper> objectMapper) {
        PulseProperties.Slack slack = props.getSlack();
        return new SlackSink(
                pulseHttpClient,
                objectMapper.getIfAvailable(ObjectMapper::new),
                slack.getBaseUrl(),
                Objects.requireNonNullElse(slack.getToken(), ""),
                slack.getTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectivityGate connectivityGate(PulseProperties props) {
        return new ConnectivityGate(props.getDatabase().getConnectTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(ConnectivityGate gate) {
        return new JobExecutor(gate);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler pulseScheduler(JobExecutor executor) {
        return new Scheduler(executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportJobFactory reportJobFactory(
            PulseProperties props,
            Sink sink,
            HttpClient pulseHttpClient,
            ObjectProvider<ObjectMapper> objectMapper,
            ResourceLoader resourceLoader
    ) {
        return new ReportJobFactory(props, sink, pulseHttpClient, objectMapper.getIfAvailable(ObjectMapper::new), resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean
    public Pulse pulse(
            PulseProperties props,
            Scheduler scheduler,
            ReportJobFactory factory,
            ObjectProvider<ReportJob<?>> jobBeans,
            ObjectProvider<Clock> clock
    ) {
        props.validate();

        Pulse pulse = new PulseRunner(scheduler, props.getTickEvery(), clock.getIfAvailable(Clock::systemUTC));
        factory.createAll().forEach(pulse::register);
        jobBeans.orderedStream().forEach(pulse::register);
        log.info("Pulse configured with {} jobs in zone {}", pulse.entries().size(), props.getTimezone());
        return pulse;
    }

    @Bean
    @ConditionalOnMissingBean
    public PulseLifecycle pulseLifecycle(Pulse pulse) {
        return new PulseLifecycle(pulse);
    }
}
