package com.sysmon.alert.channel;

import com.sysmon.alert.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

@Component
public class LogChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger("sysmon.alerts");

    @Override
    public String id() {
        return "log";
    }

    @Override
    public void send(AlertEvent event) {
        Level level = switch (event.severity()) {
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR, CRITICAL -> Level.ERROR;
        };
        log.atLevel(level)
            .addKeyValue("hostname", event.key().hostname())
            .addKeyValue("metric", event.key().metric())
            .addKeyValue("sub_resource", event.key().subResource())
            .addKeyValue("severity", event.severity())
            .addKeyValue("value", event.value())
            .addKeyValue("threshold", event.threshold())
            .log("ALERT [{}] {}", event.severity(), event.message());
    }
}
