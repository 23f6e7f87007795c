package com.sysmon.alert;

import com.sysmon.alert.channel.ChannelException;
import com.sysmon.alert.channel.NotificationChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertDispatcherTest {

    private static final AlertEvent EVENT = new AlertEvent(AlertKey.of("h1", "cpu"), Severity.WARNING,
        85.0, 80.0, Instant.parse("2024-03-01T10:00:00Z"), "CPU usage on h1 is 85.0% (threshold 80.0%)");

    @Mock
    private NotificationChannel logChannel;
    @Mock
    private NotificationChannel slackChannel;
    @Mock
    private AlertHistoryService history;
    @Mock
    private SimpMessagingTemplate messaging;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AlertDispatcher dispatcher(List<String> enabled, int retries) {
        lenient().when(logChannel.id()).thenReturn("log");
        lenient().when(slackChannel.id()).thenReturn("slack");
        return new AlertDispatcher(List.of(logChannel, slackChannel), enabled, retries, Duration.ofMillis(1),
            executor, history, messaging);
    }

    @Test
    void dispatch_sendsToEveryEnabledChannel() throws Exception {
        AlertDispatcher dispatcher = dispatcher(List.of("log", "slack"), 0);

        dispatcher.dispatch(List.of(EVENT)).get(5, TimeUnit.SECONDS);

        verify(logChannel).send(EVENT);
        verify(slackChannel).send(EVENT);
        verify(history).record(EVENT);
        verify(messaging).convertAndSend(eq("/topic/alerts"), eq(EVENT));
    }

    @Test
    void dispatch_onlyEnabledChannelsReceiveEvents() throws Exception {
        AlertDispatcher dispatcher = dispatcher(List.of("slack"), 0);

        dispatcher.dispatch(List.of(EVENT)).get(5, TimeUnit.SECONDS);

        verify(slackChannel).send(EVENT);
        verify(logChannel, never()).send(any());
        assertThat(dispatcher.enabledChannels()).containsExactly("slack");
    }

    @Test
    void dispatch_failingChannelIsRetriedThenDropped_otherChannelUnaffected() throws Exception {
        doThrow(new ChannelException("unreachable")).when(slackChannel).send(any());
        AlertDispatcher dispatcher = dispatcher(List.of("log", "slack"), 2);

        assertThatCode(() -> dispatcher.dispatch(List.of(EVENT)).get(5, TimeUnit.SECONDS))
            .doesNotThrowAnyException();

        verify(slackChannel, times(3)).send(EVENT);
        verify(logChannel, times(1)).send(EVENT);
    }

    @Test
    void dispatch_channelRecoversOnRetry_stopsRetrying() throws Exception {
        doThrow(new ChannelException("timeout")).doNothing().when(slackChannel).send(any());
        AlertDispatcher dispatcher = dispatcher(List.of("slack"), 2);

        dispatcher.dispatch(List.of(EVENT)).get(5, TimeUnit.SECONDS);

        verify(slackChannel, times(2)).send(EVENT);
    }

    @Test
    void dispatch_slowChannelDoesNotBlockOthers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(slackChannel).send(any());
        CountDownLatch logged = new CountDownLatch(1);
        doAnswer(inv -> {
            logged.countDown();
            return null;
        }).when(logChannel).send(any());
        AlertDispatcher dispatcher = dispatcher(List.of("slack", "log"), 0);

        var done = dispatcher.dispatch(List.of(EVENT));

        assertThat(logged.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(done).isNotDone();
        release.countDown();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void dispatch_historyFailure_stillDelivers() throws Exception {
        doThrow(new IllegalStateException("db down")).when(history).record(any());
        AlertDispatcher dispatcher = dispatcher(List.of("log"), 0);

        dispatcher.dispatch(List.of(EVENT)).get(5, TimeUnit.SECONDS);

        verify(logChannel).send(EVENT);
    }

    @Test
    void constructor_unknownChannel_failsWithValidIds() {
        assertThatThrownBy(() -> dispatcher(List.of("pager"), 0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("pager")
            .hasMessageContaining("log")
            .hasMessageContaining("slack");
    }

    @Test
    void constructor_enabledChannelMisconfigured_fails() {
        doThrow(new IllegalStateException("webhook_url is not set")).when(slackChannel).validateConfiguration();

        assertThatThrownBy(() -> dispatcher(List.of("slack"), 0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("webhook_url");
    }

    @Test
    void constructor_disabledChannelIsNotValidated() {
        dispatcher(List.of("log"), 0);

        verify(slackChannel, never()).validateConfiguration();
        verify(logChannel).validateConfiguration();
    }
}
