package com.sysmon.alert.channel;

import com.sysmon.alert.AlertEvent;
import com.sysmon.config.SysmonProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EmailChannel implements NotificationChannel {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final String from;
    private final List<String> to;

    public EmailChannel(SysmonProperties properties, ObjectProvider<JavaMailSender> mailSender) {
        this.mailSender = mailSender;
        this.from = properties.alerts().email().from();
        this.to = properties.alerts().email().to();
    }

    @Override
    public String id() {
        return "email";
    }

    @Override
    public void validateConfiguration() {
        if (mailSender.getIfAvailable() == null) {
            throw new IllegalStateException("Email channel enabled but no mail server is configured (spring.mail.host)");
        }
        if (to.isEmpty()) {
            throw new IllegalStateException("Email channel enabled but sysmon.alerts.email.to is empty");
        }
    }

    @Override
    public void send(AlertEvent event) throws ChannelException {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new ChannelException("No mail sender configured");
        }
        SimpleMailMessage message = new SimpleMailMessage();
        if (from != null && !from.isBlank()) {
            message.setFrom(from);
        }
        message.setTo(to.toArray(String[]::new));
        message.setSubject(subject(event));
        message.setText(body(event));
        try {
            sender.send(message);
        } catch (MailException e) {
            throw new ChannelException("Mail delivery failed: " + e.getMessage(), e);
        }
    }

    static String subject(AlertEvent event) {
        String state = event.isRecovery() ? "RECOVERED" : event.severity().name();
        return "[sysmon] " + state + " " + event.key().metric() + " on " + event.key().hostname();
    }

    static String body(AlertEvent event) {
        return event.message() + "\n\n"
            + "Host:      " + event.key().hostname() + "\n"
            + "Metric:    " + event.key().metric()
            + (event.key().subResource() != null ? " (" + event.key().subResource() + ")" : "") + "\n"
            + "Value:     " + event.value() + "\n"
            + "Threshold: " + event.threshold() + "\n"
            + "Time:      " + event.firedAt() + "\n";
    }
}
