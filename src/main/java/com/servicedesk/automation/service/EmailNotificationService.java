package com.servicedesk.automation.service;

import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.config.NotificationConfig;
import com.servicedesk.automation.model.OutboundMessage;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

@Service
public class EmailNotificationService {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationService.class);

    static final String CHANNEL = "email";

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final NotificationConfig config;
    private final MetricsConfig metricsConfig;

    public EmailNotificationService(ObjectProvider<JavaMailSender> mailSenderProvider,
                                    NotificationConfig config,
                                    MetricsConfig metricsConfig) {
        this.mailSenderProvider = mailSenderProvider;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Send one HTML email. Never throws: failures are logged and counted.
     *
     * @return true when the mail server accepted the message
     */
    public boolean send(OutboundMessage message) {
        if (!config.isEmailEnabled()) {
            log.debug("Email notifications disabled, skipping '{}' to {}", message.getSubject(), message.getRecipient());
            return false;
        }
        if (message.getRecipient() == null || message.getRecipient().isBlank()) {
            log.warn("No recipient for '{}', not sent", message.getSubject());
            metricsConfig.recordNotification(CHANNEL, "skipped");
            return false;
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.warn("Email enabled but no mail server configured (spring.mail.host), skipping '{}'",
                    message.getSubject());
            metricsConfig.recordNotification(CHANNEL, "skipped");
            return false;
        }

        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, "UTF-8");
            helper.setFrom(config.getFromAddress());
            helper.setTo(message.getRecipient());
            helper.setSubject(message.getSubject());
            helper.setText(message.getBody(), true);
            mailSender.send(mime);

            metricsConfig.recordNotification(CHANNEL, "success");
            log.info("Email '{}' sent to {}", message.getSubject(), message.getRecipient());
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            log.error("Failed to send email '{}' to {}: {}",
                    message.getSubject(), message.getRecipient(), e.getMessage(), e);
            return false;
        }
    }
}
