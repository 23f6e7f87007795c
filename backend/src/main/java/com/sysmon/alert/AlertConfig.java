package com.sysmon.alert;

import com.sysmon.alert.channel.NotificationChannel;
import com.sysmon.config.SysmonProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

@Configuration
public class AlertConfig {

    @Bean
    public ThresholdConfig thresholdConfig(SysmonProperties properties) {
        return ThresholdConfig.from(properties);
    }

    @Bean
    public AlertDispatcher alertDispatcher(List<NotificationChannel> channels,
                                           ThresholdConfig thresholdConfig,
                                           SysmonProperties properties,
                                           @Qualifier("channelExecutor") ThreadPoolTaskExecutor channelExecutor,
                                           AlertHistoryService history,
                                           SimpMessagingTemplate messaging) {
        SysmonProperties.Alerts alerts = properties.alerts();
        return new AlertDispatcher(channels, thresholdConfig.channels(), alerts.channelRetries(),
            alerts.channelRetryDelay(), channelExecutor, history, messaging);
    }

    @Bean
    public AlertEngine alertEngine(ThresholdConfig thresholdConfig,
                                   AlertDispatcher dispatcher,
                                   @Qualifier("alertExecutor") ThreadPoolTaskExecutor alertExecutor) {
        return new AlertEngine(thresholdConfig, dispatcher, alertExecutor);
    }
}
