package com.sysmon.alert;

import com.sysmon.TestSnapshots;
import com.sysmon.dto.CpuMetrics;
import com.sysmon.dto.MetricSnapshot;
import com.sysmon.dto.SwapMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.sysmon.TestSnapshots.fs;
import static com.sysmon.TestSnapshots.snapshot;
import static com.sysmon.TestSnapshots.withDisks;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration COOLDOWN = Duration.ofMinutes(5);

    @Mock
    private AlertDispatcher dispatcher;

    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AlertEngine(config(0.0, false), dispatcher, Runnable::run);
    }

    private static ThresholdConfig config(double hysteresis, boolean notifyRecovery) {
        return new ThresholdConfig(Map.of(
            AlertMetric.CPU, new MetricThreshold(AlertMetric.CPU, 80, 80 - hysteresis, COOLDOWN),
            AlertMetric.MEMORY, new MetricThreshold(AlertMetric.MEMORY, 85, 85 - hysteresis, COOLDOWN),
            AlertMetric.DISK, new MetricThreshold(AlertMetric.DISK, 90, 90 - hysteresis, COOLDOWN),
            AlertMetric.SWAP, new MetricThreshold(AlertMetric.SWAP, 50, 50 - hysteresis, COOLDOWN)
        ), List.of("log"), notifyRecovery);
    }

    private static Instant minutes(long m) {
        return T0.plus(Duration.ofMinutes(m));
    }

    @Test
    void evaluate_belowThreshold_noEventAndNoState() {
        List<AlertEvent> events = engine.evaluate(snapshot("h1", T0, 50, 40));

        assertThat(events).isEmpty();
        assertThat(engine.trackedKeys()).isZero();
    }

    @Test
    void evaluate_endToEndCpuScenario() {
        AlertKey key = AlertKey.of("h1", "cpu");

        List<AlertEvent> first = engine.evaluate(snapshot("h1", T0, 92, 40));
        assertThat(first).singleElement().satisfies(e -> {
            assertThat(e.key()).isEqualTo(key);
            assertThat(e.severity()).isGreaterThanOrEqualTo(Severity.WARNING);
            assertThat(e.value()).isEqualTo(92.0);
            assertThat(e.threshold()).isEqualTo(80.0);
            assertThat(e.firedAt()).isEqualTo(T0);
            assertThat(e.message()).contains("h1").contains("92.0");
        });

        assertThat(engine.evaluate(snapshot("h1", minutes(1), 95, 40))).isEmpty();
        assertThat(engine.stateOf(key)).get().extracting(AlertState::isActive).isEqualTo(true);

        assertThat(engine.evaluate(snapshot("h1", minutes(6), 30, 40))).isEmpty();
        AlertState state = engine.stateOf(key).orElseThrow();
        assertThat(state.getPhase()).isEqualTo(AlertPhase.NORMAL);
        assertThat(state.isActive()).isFalse();
        assertThat(state.getLastValue()).isEqualTo(30.0);
    }

    @Test
    void evaluate_notifyRecovery_emitsInfoEvent() {
        engine = new AlertEngine(config(0.0, true), dispatcher, Runnable::run);
        engine.evaluate(snapshot("h1", T0, 92, 40));

        List<AlertEvent> events = engine.evaluate(snapshot("h1", minutes(6), 30, 40));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.severity()).isEqualTo(Severity.INFO);
            assertThat(e.isRecovery()).isTrue();
            assertThat(e.key()).isEqualTo(AlertKey.of("h1", "cpu"));
        });
    }

    @Test
    void evaluate_continuousBreach_firesOncePerCooldownWindow() {
        List<AlertEvent> all = new ArrayList<>();
        // one sample every 30 s for 20 minutes
        for (int i = 0; i <= 40; i++) {
            all.addAll(engine.evaluate(snapshot("h1", T0.plusSeconds(30L * i), 90, 40)));
        }

        assertThat(all).extracting(AlertEvent::firedAt)
            .containsExactly(T0, minutes(5), minutes(10), minutes(15), minutes(20));
    }

    @Test
    void evaluate_recoveryInsideCooldownThenBreachAfter_firesTwice() {
        AlertKey key = AlertKey.of("h1", "cpu");
        List<AlertEvent> all = new ArrayList<>();

        all.addAll(engine.evaluate(snapshot("h1", T0, 90, 40)));
        all.addAll(engine.evaluate(snapshot("h1", minutes(2), 50, 40)));
        AlertState between = engine.stateOf(key).orElseThrow();
        assertThat(between.isActive()).isFalse();
        assertThat(between.getPhase()).isEqualTo(AlertPhase.COOLDOWN);

        all.addAll(engine.evaluate(snapshot("h1", minutes(6), 90, 40)));

        assertThat(all).hasSize(2);
        assertThat(all).extracting(AlertEvent::firedAt).containsExactly(T0, minutes(6));
    }

    @Test
    void evaluate_breachAgainInsideCooldownAfterRecovery_isSuppressed() {
        engine.evaluate(snapshot("h1", T0, 90, 40));
        engine.evaluate(snapshot("h1", minutes(1), 50, 40));

        assertThat(engine.evaluate(snapshot("h1", minutes(2), 91, 40))).isEmpty();
        assertThat(engine.stateOf(AlertKey.of("h1", "cpu"))).get()
            .extracting(AlertState::isActive).isEqualTo(true);
    }

    @Test
    void evaluate_valueEqualToThreshold_fires() {
        assertThat(engine.evaluate(snapshot("h1", T0, 80, 40))).hasSize(1);
    }

    @Test
    void evaluate_hysteresis_valueBetweenRecoveryAndThresholdStaysActive() {
        engine = new AlertEngine(config(5.0, false), dispatcher, Runnable::run);
        AlertKey key = AlertKey.of("h1", "cpu");
        engine.evaluate(snapshot("h1", T0, 85, 40));

        engine.evaluate(snapshot("h1", minutes(6), 77, 40));
        assertThat(engine.stateOf(key).orElseThrow().isActive()).isTrue();

        engine.evaluate(snapshot("h1", minutes(7), 74, 40));
        AlertState state = engine.stateOf(key).orElseThrow();
        assertThat(state.isActive()).isFalse();
        assertThat(state.getPhase()).isEqualTo(AlertPhase.NORMAL);
    }

    @Test
    void evaluate_diskThresholdTrackedPerMountPoint() {
        MetricSnapshot s = withDisks("h1", T0, fs("/", 95), fs("/data", 50), fs("/var", 91));

        List<AlertEvent> events = engine.evaluate(s);

        assertThat(events).extracting(e -> e.key().subResource()).containsExactlyInAnyOrder("/", "/var");
        assertThat(engine.stateOf(new AlertKey("h1", "disk", "/data"))).isEmpty();
        assertThat(engine.evaluate(withDisks("h1", minutes(1), fs("/", 96), fs("/data", 93))))
            .extracting(e -> e.key().subResource()).containsExactly("/data");
    }

    @Test
    void evaluate_hostsAreIndependent() {
        assertThat(engine.evaluate(snapshot("h1", T0, 90, 40))).hasSize(1);
        assertThat(engine.evaluate(snapshot("h2", T0, 90, 40))).hasSize(1);
    }

    @Test
    void evaluate_absentGroupsLeaveStateUntouched() {
        engine.evaluate(snapshot("h1", T0, 90, 40));
        MetricSnapshot noCpu = new MetricSnapshot("h1", minutes(6), null, null, null, null, null, null);

        assertThat(engine.evaluate(noCpu)).isEmpty();
        AlertState state = engine.stateOf(AlertKey.of("h1", "cpu")).orElseThrow();
        assertThat(state.getPhase()).isEqualTo(AlertPhase.COOLDOWN);
        assertThat(state.getLastEvaluatedAt()).isEqualTo(T0);
    }

    @Test
    void evaluate_swapWithoutSwapSpace_isSkipped() {
        MetricSnapshot s = new MetricSnapshot("h1", T0, null,
            new CpuMetrics(10.0, List.of(), List.of()), TestSnapshots.memory(10),
            new SwapMetrics(0L, 0L, 0L, 0.0), null, null);

        engine.evaluate(s);

        assertThat(engine.stateOf(AlertKey.of("h1", "swap"))).isEmpty();
    }

    @Test
    void evaluate_severityFollowsBreachSize() {
        assertThat(engine.evaluate(snapshot("a", T0, 82, 40))).extracting(AlertEvent::severity).containsExactly(Severity.WARNING);
        assertThat(engine.evaluate(snapshot("b", T0, 90, 40))).extracting(AlertEvent::severity).containsExactly(Severity.ERROR);
        assertThat(engine.evaluate(snapshot("c", T0, 97, 40))).extracting(AlertEvent::severity).containsExactly(Severity.CRITICAL);
    }

    @Test
    void evaluate_concurrentSnapshotsForSameKey_fireOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<AlertEvent> events = Collections.synchronizedList(new ArrayList<>());
        try {
            for (int i = 0; i < threads; i++) {
                int offset = i;
                pool.submit(() -> {
                    start.await();
                    events.addAll(engine.evaluate(snapshot("h1", T0.plusSeconds(offset), 90, 40)));
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(events).hasSize(1);
    }

    @Test
    void submit_dispatchesEventsOnExecutor() {
        engine.submit(snapshot("h1", T0, 90, 40));

        verify(dispatcher).dispatch(argThat(events -> events.size() == 1));
    }

    @Test
    void submit_noEvents_doesNotDispatch() {
        engine.submit(snapshot("h1", T0, 10, 40));

        verify(dispatcher, never()).dispatch(anyList());
    }

    @Test
    void submit_dispatcherFailure_isContained() {
        when(dispatcher.dispatch(anyList())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> engine.submit(snapshot("h1", T0, 90, 40))).doesNotThrowAnyException();
    }

    @Test
    void submit_rejectedByExecutor_isContained() {
        engine = new AlertEngine(config(0.0, false), dispatcher, r -> {
            throw new java.util.concurrent.RejectedExecutionException("full");
        });

        assertThatCode(() -> engine.submit(snapshot("h1", T0, 90, 40))).doesNotThrowAnyException();
        verifyNoInteractions(dispatcher);
    }
}
