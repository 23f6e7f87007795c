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
public class SlackChannel implements NotificationChannel {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String webhookUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Autowired
    public SlackChannel(SysmonProperties properties, ObjectMapper objectMapper) {
        this(properties.alerts().slack().webhookUrl(), objectMapper);
    }

    public SlackChannel(String webhookUrl, ObjectMapper objectMapper) {
        this.webhookUrl = webhookUrl;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .build();
    }

    @Override
    public String id() {
        return "slack";
    }

    @Override
    public void validateConfiguration() {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalStateException("Slack channel enabled but sysmon.alerts.slack.webhook_url is not set");
        }
    }

    @Override
    public void send(AlertEvent event) throws ChannelException {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("text", format(event)));
        } catch (JsonProcessingException e) {
            throw new ChannelException("Failed to encode Slack message", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(webhookUrl))
            .timeout(TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpChannelSupport.send(httpClient, request, "Slack");
    }

    static String format(AlertEvent event) {
        String prefix = event.isRecovery() ? ":white_check_mark: RECOVERED" : ":rotating_light: ALERT [" + event.severity() + "]";
        return prefix + ": " + event.message();
    }
}
