package com.sysmon.alert.channel;

public class ChannelException extends Exception {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
