package com.sysmon.collector.transmission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmon.dto.IngestRequest;
import com.sysmon.dto.MetricSnapshot;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class HttpIngestTransport implements IngestTransport {

    private final URI endpoint;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpIngestTransport(URI endpoint, Duration timeout, ObjectMapper objectMapper) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public void send(MetricSnapshot snapshot) throws DeliveryException {
        String body;
        try {
            body = objectMapper.writeValueAsString(new IngestRequest(snapshot.hostname(), snapshot));
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Cannot encode snapshot: " + e.getMessage(), false, -1);
        }
        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while sending", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw DeliveryException.forStatus(response.statusCode(), response.body());
        }
    }
}
