package com.sysmon.alert;

import com.sysmon.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Threshold evaluation with per-key cooldown.
 * <p>
 * Each {@link AlertKey} moves through NORMAL, FIRING and COOLDOWN. A breach in NORMAL (or
 * after the cooldown has elapsed) fires one event and restarts the cooldown window;
 * breaches inside the window are suppressed. Dropping below the recovery threshold clears
 * {@code active} and is logged as a recovery; the key returns to NORMAL once the window has
 * elapsed. The snapshot timestamp is the evaluation clock. Evaluations of the same key are
 * serialized on that key's state; unrelated keys never contend.
 */
public class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final ThresholdConfig config;
    private final AlertDispatcher dispatcher;
    private final Executor executor;
    private final ConcurrentHashMap<AlertKey, AlertState> states = new ConcurrentHashMap<>();

    public AlertEngine(ThresholdConfig config, AlertDispatcher dispatcher, Executor executor) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.executor = executor;
    }

    public void submit(MetricSnapshot snapshot) {
        try {
            executor.execute(() -> {
                try {
                    List<AlertEvent> events = evaluate(snapshot);
                    if (!events.isEmpty()) {
                        dispatcher.dispatch(events);
                    }
                } catch (RuntimeException e) {
                    log.error("Alert evaluation failed for {} at {}", snapshot.hostname(), snapshot.timestamp(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Alert evaluation queue full, skipping snapshot from {} at {}", snapshot.hostname(), snapshot.timestamp());
        }
    }

    public List<AlertEvent> evaluate(MetricSnapshot snapshot) {
        Instant now = snapshot.timestamp();
        List<AlertEvent> events = new ArrayList<>();
        for (MetricThreshold threshold : config.thresholds().values()) {
            for (AlertMetric.Reading reading : threshold.metric().readings(snapshot)) {
                AlertKey key = new AlertKey(snapshot.hostname(), threshold.metric().key(), reading.subResource());
                evaluateKey(key, reading.value(), threshold, now).ifPresent(events::add);
            }
        }
        return events;
    }

    public Optional<AlertState> stateOf(AlertKey key) {
        AlertState state = states.get(key);
        if (state == null) return Optional.empty();
        synchronized (state) {
            return Optional.of(state.copy());
        }
    }

    public int trackedKeys() {
        return states.size();
    }

    Optional<AlertEvent> evaluateKey(AlertKey key, double value, MetricThreshold threshold, Instant now) {
        boolean breached = breached(value, threshold.threshold());
        AlertState state = states.get(key);
        if (state == null) {
            if (!breached) return Optional.empty();
            state = states.computeIfAbsent(key, k -> new AlertState());
        }

        synchronized (state) {
            boolean cooldownElapsed = state.cooldownElapsed(now, threshold.cooldown());
            state.observe(value, now);

            if (breached) {
                if (state.getPhase() == AlertPhase.NORMAL || cooldownElapsed) {
                    state.fire(now);
                    AlertEvent event = new AlertEvent(key, Severity.forBreach(value, threshold.threshold()),
                        value, threshold.threshold(), now, breachMessage(key, threshold.metric(), value, threshold.threshold()));
                    state.enterCooldown();
                    log.warn("Alert fired for {}: value={} threshold={} severity={}",
                        key, value, threshold.threshold(), event.severity());
                    return Optional.of(event);
                }
                state.markActive();
                log.debug("Alert for {} suppressed, cooldown until {}", key, state.getLastFiredAt().plus(threshold.cooldown()));
                return Optional.empty();
            }

            if (value >= threshold.recoveryThreshold()) {
                return Optional.empty();
            }

            AlertEvent recovery = null;
            if (state.isActive()) {
                state.recover();
                log.info("Alert recovered for {}: value={} below {}", key, value, threshold.recoveryThreshold());
                if (config.notifyRecovery()) {
                    recovery = new AlertEvent(key, Severity.INFO, value, threshold.threshold(), now,
                        recoveryMessage(key, threshold.metric(), value));
                }
            }
            if (state.getPhase() == AlertPhase.COOLDOWN && cooldownElapsed) {
                state.reset();
                log.debug("Alert state for {} back to NORMAL", key);
            }
            return Optional.ofNullable(recovery);
        }
    }

    boolean breached(double value, double threshold) {
        return value >= threshold;
    }

    private static String breachMessage(AlertKey key, AlertMetric metric, double value, double threshold) {
        return String.format(Locale.ROOT, "%s usage on %s is %.1f%% (threshold %.1f%%)",
            metric.label(), target(key), value, threshold);
    }

    private static String recoveryMessage(AlertKey key, AlertMetric metric, double value) {
        return String.format(Locale.ROOT, "%s usage on %s recovered to %.1f%%", metric.label(), target(key), value);
    }

    private static String target(AlertKey key) {
        return key.subResource() == null ? key.hostname() : key.hostname() + ":" + key.subResource();
    }
}
