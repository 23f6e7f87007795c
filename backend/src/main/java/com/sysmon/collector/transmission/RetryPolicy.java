package com.sysmon.collector.transmission;

import com.sysmon.config.SysmonProperties;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * spread by {@code ±jitter}. {@code maxAttempts} counts every attempt including the first.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

    public static final double DEFAULT_JITTER = 0.2;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }

    public static RetryPolicy from(SysmonProperties.Endpoint endpoint) {
        return new RetryPolicy(endpoint.maxRetries(), endpoint.baseDelay(), endpoint.maxDelay(), DEFAULT_JITTER);
    }

    public Duration backoffFor(int attempt, Random random) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = base > (cap >> shift) ? cap : Math.min(base << shift, cap);
        double factor = 1.0 + jitter * (random.nextDouble() * 2.0 - 1.0);
        return Duration.ofMillis(Math.round(delay * factor));
    }
}
