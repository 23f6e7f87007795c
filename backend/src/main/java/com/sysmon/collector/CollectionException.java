package com.sysmon.collector;

public class CollectionException extends Exception {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
