package io.pulse4j.internal.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.Sink;
import io.pulse4j.core.DeliveryOutcome;
import io.pulse4j.core.FormattedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Posts messages through Slack's {@code chat.postMessage} Web API method.
 *
 * <p>Slack answers most API errors with HTTP 200 and {@code "ok": false}; both that and a non-2xx
 * status are reported as a rejected delivery. Transport failures are thrown.
 */
public class SlackSink implements Sink {
    private static final Logger log = LoggerFactory.getLogger(SlackSink.class);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final URI postMessageUri;
    private final String token;
    private final Duration timeout;

    public SlackSink(HttpClient client, ObjectMapper objectMapper, String baseUrl, String token, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.postMessageUri = URI.create((baseUrl.endsWith("/") ? baseUrl : baseUrl + "/") + "chat.postMessage");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public DeliveryOutcome deliver(String channel, FormattedMessage message) throws IOException, InterruptedException {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(message, "message must not be null");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", message.text());
        payload.put("mrkdwn", message.markdown());

        HttpRequest request = HttpRequest.newBuilder(postMessageUri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        String body = response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return DeliveryOutcome.rejected("HTTP " + response.statusCode() + ": " + body);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return DeliveryOutcome.rejected("unreadable Slack response: " + body);
        }
        if (json == null || !json.path("ok").asBoolean(false)) {
            String error = json == null ? null : json.path("error").asText(null);
            return DeliveryOutcome.rejected(error != null ? error : body);
        }

        String ts = json.path("ts").asText(null);
        log.debug("Posted to channel={} ts={}", channel, ts);
        return DeliveryOutcome.delivered(ts);
    }
}
