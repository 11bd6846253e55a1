package io.pulse4j.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the report bot: shared connections plus the job definitions.
 */
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {
    private boolean enabled = true;
    private Duration tickEvery = Duration.ofSeconds(30);
    private String timezone = "America/Fortaleza";
    private Database database = new Database();
    private Slack slack = new Slack();
    private Superset superset = new Superset();
    private List<Job> jobs = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickEvery() {
        return tickEvery;
    }

    public void setTickEvery(Duration tickEvery) {
        this.tickEvery = tickEvery;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public Database getDatabase() {
        return database;
    }

    public void setDatabase(Database database) {
        this.database = database;
    }

    public Slack getSlack() {
        return slack;
    }

    public void setSlack(Slack slack) {
        this.slack = slack;
    }

    public Superset getSuperset() {
        return superset;
    }

    public void setSuperset(Superset superset) {
        this.superset = superset;
    }

    public List<Job> getJobs() {
        return jobs;
    }

    public void setJobs(List<Job> jobs) {
        this.jobs = jobs;
    }

    /**
     * Check everything that can be checked without touching the network.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (tickEvery == null || tickEvery.isZero() || tickEvery.isNegative()) {
            problems.add("pulse.tick-every must be a positive duration");
        }
        try {
            zoneId();
        } catch (DateTimeException | NullPointerException e) {
            problems.add("pulse.timezone is not a valid zone id: " + timezone);
        }

        boolean needsDatabase = false;
        boolean needsSuperset = false;
        Set<String> names = new HashSet<>();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            String at = "pulse.jobs[" + i + "]";
            if (isBlank(job.getName())) {
                problems.add(at + ".name is required");
            } else if (!names.add(job.getName())) {
                problems.add(at + ".name is duplicated: " + job.getName());
            }
            if (isBlank(job.getChannel())) {
                problems.add(at + ".channel is required");
            }
            if (isBlank(job.getSchedule())) {
                problems.add(at + ".schedule is required");
            }
            if (job.getSource() == null) {
                problems.add(at + ".source is required");
            } else if (job.getSource() == SourceType.SQL) {
                needsDatabase = true;
                if (isBlank(job.getQuery()) == isBlank(job.getQueryResource())) {
                    problems.add(at + " needs exactly one of query or query-resource");
                }
            } else if (job.getSource() == SourceType.SUPERSET) {
                needsSuperset = true;
                if (job.getChartId() == null) {
                    problems.add(at + ".chart-id is required for SUPERSET jobs");
                }
            }
        }

        if (!jobs.isEmpty() && isBlank(slack.getToken())) {
            problems.add("pulse.slack.token is required");
        }
        if (needsDatabase) {
            if (isBlank(database.getHost())) {
                problems.add("pulse.database.host is required");
            }
            if (isBlank(database.getName())) {
                problems.add("pulse.database.name is required");
            }
            if (database.getPort() < 1 || database.getPort() > 65535) {
                problems.add("pulse.database.port is out of range: " + database.getPort());
            }
        }
        if (needsSuperset && isBlank(superset.getUrl())) {
            problems.add("pulse.superset.url is required");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid pulse configuration: " + String.join("; ", problems));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public enum SourceType {
        SQL,
        SUPERSET
    }

    public static class Database {
        private String host;
        private int port = 5432;
        private String name;
        private String user;
        private String password;
        private Duration queryTimeout = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofMinutes(15);
        private Duration connectTimeout = Duration.ofSeconds(5);

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public String jdbcUrl() {
            return "jdbc:postgresql://" + host + ":" + port + "/" + name;
        }
    }

    public static class Slack {
        private String token;
        private String baseUrl = "https://slack.com/api";
        private Duration timeout = Duration.ofSeconds(20);

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Superset {
        private String url;
        private String username;
        private String password;
        private Duration timeout = Duration.ofSeconds(60);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    /**
     * One report job. {@code schedule} and {@code window} use the textual forms of
     * {@link io.pulse4j.utils.ScheduleParser}.
     */
    public static class Job {
        private String name;
        private SourceType source = SourceType.SQL;
        private String query;
        private String queryResource;
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private Integer chartId;
        private String format = "STEP_BREAKDOWN";
        private String title;
        private String channel;
        private String schedule;
        private String window = "always";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public SourceType getSource() {
            return source;
        }

        public void setSource(SourceType source) {
            this.source = source;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getQueryResource() {
            return queryResource;
        }

        public void setQueryResource(String queryResource) {
            this.queryResource = queryResource;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Object> parameters) {
            this.parameters = parameters;
        }

        public Integer getChartId() {
            return chartId;
        }

        public void setChartId(Integer chartId) {
            this.chartId = chartId;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getWindow() {
            return window;
        }

        public void setWindow(String window) {
            this.window = window;
        }
    }
}
