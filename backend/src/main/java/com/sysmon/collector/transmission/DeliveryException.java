package com.sysmon.collector.transmission;

/**
 * A failed ingest call. Retryable failures (connection problems, timeouts, server errors)
 * are attempted again; the others end the delivery as rejected.
 */
public class DeliveryException extends Exception {

    private final boolean retryable;
    private final int statusCode;

    public DeliveryException(String message, boolean retryable, int statusCode) {
        super(message);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
        this.statusCode = -1;
    }

    public static DeliveryException forStatus(int statusCode, String body) {
        boolean retryable = statusCode >= 500 || statusCode == 408 || statusCode == 429;
        String detail = body == null || body.isBlank() ? "" : ": " + abbreviate(body);
        return new DeliveryException("HTTP " + statusCode + detail, retryable, statusCode);
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String abbreviate(String body) {
        String trimmed = body.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
