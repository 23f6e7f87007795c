package com.sysmon.alert.channel;

import com.sysmon.alert.AlertEvent;

public interface NotificationChannel {

    String id();

    void send(AlertEvent event) throws ChannelException;

    default void validateConfiguration() {
    }
}
