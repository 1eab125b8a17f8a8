package com.servicedesk.automation.service;

import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.config.TwilioNotificationConfig;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pages the on-call engineer by SMS or WhatsApp.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio on-call paging initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio on-call paging is DISABLED.");
        }
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Observed(name = "notification.page", contextualName = "page-on-call")
    public boolean page(long ticketId, String text) {
        if (!config.isEnabled()) {
            return false;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getOnCallNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    text
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("On-call page sent for ticket={}, sid={}", ticketId, message.getSid());
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to page on-call for ticket={}: {}", ticketId, e.getMessage(), e);
            return false;
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
