package com.sysmon.alert.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmon.alert.AlertEvent;
import com.sysmon.config.SysmonProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

@Component
public class WebhookChannel implements NotificationChannel {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String url;
    private final Map<String, String> headers;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Autowired
    public WebhookChannel(SysmonProperties properties, ObjectMapper objectMapper) {
        this(properties.alerts().webhook().url(), properties.alerts().webhook().headers(), objectMapper);
    }

    public WebhookChannel(String url, Map<String, String> headers, ObjectMapper objectMapper) {
        this.url = url;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .build();
    }

    @Override
    public String id() {
        return "webhook";
    }

    @Override
    public void validateConfiguration() {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Webhook channel enabled but sysmon.alerts.webhook.url is not set");
        }
    }

    @Override
    public void send(AlertEvent event) throws ChannelException {
        String body;
        try {
            body = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new ChannelException("Failed to encode alert event", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        headers.forEach((name, value) -> {
            if (!name.equalsIgnoreCase("Content-Type")) {
                builder.header(name, value);
            }
        });
        HttpChannelSupport.send(httpClient, builder.build(), "Webhook");
    }
}
