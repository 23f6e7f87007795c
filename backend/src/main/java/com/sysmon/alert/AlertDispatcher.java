package com.sysmon.alert;

import com.sysmon.alert.channel.ChannelException;
import com.sysmon.alert.channel.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);
    static final String ALERTS_TOPIC = "/topic/alerts";

    private final List<NotificationChannel> channels;
    private final int channelRetries;
    private final Duration retryDelay;
    private final Executor executor;
    private final AlertHistoryService history;
    private final SimpMessagingTemplate messaging;

    public AlertDispatcher(List<NotificationChannel> available,
                           List<String> enabledIds,
                           int channelRetries,
                           Duration retryDelay,
                           Executor executor,
                           AlertHistoryService history,
                           SimpMessagingTemplate messaging) {
        Map<String, NotificationChannel> byId = new LinkedHashMap<>();
        available.forEach(c -> byId.put(c.id(), c));
        List<NotificationChannel> enabled = new ArrayList<>();
        for (String id : enabledIds) {
            NotificationChannel channel = byId.get(id);
            if (channel == null) {
                throw new IllegalStateException("Unknown alert channel '" + id + "', expected one of " + byId.keySet());
            }
            channel.validateConfiguration();
            enabled.add(channel);
        }
        this.channels = List.copyOf(enabled);
        this.channelRetries = Math.max(0, channelRetries);
        this.retryDelay = retryDelay;
        this.executor = executor;
        this.history = history;
        this.messaging = messaging;
        log.info("Alert channels enabled: {}", enabledIds);
    }

    public List<String> enabledChannels() {
        return channels.stream().map(NotificationChannel::id).toList();
    }

    public CompletableFuture<Void> dispatch(List<AlertEvent> events) {
        List<CompletableFuture<Void>> sends = new ArrayList<>();
        for (AlertEvent event : events) {
            recordAndBroadcast(event);
            for (NotificationChannel channel : channels) {
                try {
                    sends.add(CompletableFuture.runAsync(() -> deliver(channel, event), executor));
                } catch (RejectedExecutionException e) {
                    log.warn("Channel queue full, dropping {} alert for {}", channel.id(), event.key());
                }
            }
        }
        return CompletableFuture.allOf(sends.toArray(CompletableFuture[]::new));
    }

    private void recordAndBroadcast(AlertEvent event) {
        if (history != null) {
            try {
                history.record(event);
            } catch (RuntimeException e) {
                log.warn("Failed to record alert {} in history: {}", event.key(), e.getMessage());
            }
        }
        if (messaging != null) {
            try {
                messaging.convertAndSend(ALERTS_TOPIC, event);
            } catch (RuntimeException e) {
                log.debug("Failed to broadcast alert {}: {}", event.key(), e.getMessage());
            }
        }
    }

    void deliver(NotificationChannel channel, AlertEvent event) {
        int attempts = 1 + channelRetries;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                channel.send(event);
                return;
            } catch (ChannelException | RuntimeException e) {
                if (attempt == attempts) {
                    log.error("Channel {} failed to deliver alert {} after {} attempt(s): {}",
                        channel.id(), event.key(), attempts, e.getMessage());
                    return;
                }
                log.warn("Channel {} attempt {}/{} failed for {}: {}", channel.id(), attempt, attempts, event.key(), e.getMessage());
                try {
                    Thread.sleep(retryDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Channel {} retry interrupted, dropping alert {}", channel.id(), event.key());
                    return;
                }
            }
        }
    }
}
