package io.pulse4j.internal.superset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.DataSource;
import io.pulse4j.core.ConnectivityTarget;
import io.pulse4j.internal.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the data of one Superset chart through the REST API.
 *
 * <p>Each fetch logs in again ({@code /api/v1/security/login}); no token is kept between fetches.
 */
public class SupersetChartDataSource implements DataSource<TabularResult> {
    private static final Logger log = LoggerFactory.getLogger(SupersetChartDataSource.class);

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String username;
    private final String password;
    private final int chartId;
    private final Duration timeout;

    public SupersetChartDataSource(
            HttpClient client,
            ObjectMapper objectMapper,
            String baseUrl,
            String username,
            String password,
            int chartId,
            Duration timeout
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.username = username;
        this.password = password;
        this.chartId = chartId;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public int chartId() {
        return chartId;
    }

    @Override
    public ConnectivityTarget target() {
        return null;
    }

    @Override
    public TabularResult fetch() throws IOException, InterruptedException {
        String token = login();
        JsonNode body = get("/api/v1/chart/" + chartId + "/data", token);

        JsonNode results = body.path("result");
        if (!results.isArray() || results.isEmpty()) {
            log.debug("Chart {} returned no result sets", chartId);
            return TabularResult.empty();
        }
        JsonNode first = results.get(0);
        JsonNode data = first.path("data");
        List<Map<String, Object>> rows = data.isArray() ? objectMapper.convertValue(data, ROWS) : List.of();

        List<String> columns = new ArrayList<>();
        JsonNode colnames = first.path("colnames");
        if (colnames.isArray()) {
            colnames.forEach(c -> columns.add(c.asText()));
        } else if (!rows.isEmpty()) {
            columns.addAll(new LinkedHashMap<>(rows.get(0)).keySet());
        }
        return new TabularResult(columns, rows);
    }

    private String login() throws IOException, InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider", "db");
        payload.put("username", username);
        payload.put("password", password);
        payload.put("refresh", true);

        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/security/login"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                .build();
        JsonNode body = send(request, "login");

        String token = body.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new IOException("Superset login response carried no access_token");
        }
        return token;
    }

    private JsonNode get(String path, String token) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, "chart " + chartId + " data");
    }

    private JsonNode send(HttpRequest request, String what) throws IOException, InterruptedException {
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Superset " + what + " failed: HTTP " + response.statusCode());
        }
        return objectMapper.readTree(response.body());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
