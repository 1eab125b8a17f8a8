package com.servicedesk.automation.service;

import com.servicedesk.automation.model.OutboundMessage;
import com.servicedesk.automation.model.TicketEvent;
import com.servicedesk.automation.model.TicketEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Turns ticket events into outbound email and on-call pages. Runs off the caller's
 * thread; a failed delivery never affects ticket state.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final Set<TicketEventType> PAGED_EVENTS =
            EnumSet.of(TicketEventType.TICKET_ESCALATED, TicketEventType.RESOLUTION_BREACH);

    private final NotificationTemplates templates;
    private final EmailNotificationService emailService;
    private final TwilioNotificationService twilioService;

    public NotificationDispatcher(NotificationTemplates templates,
                                  EmailNotificationService emailService,
                                  TwilioNotificationService twilioService) {
        this.templates = templates;
        this.emailService = emailService;
        this.twilioService = twilioService;
    }

    @Async
    @EventListener
    public void onTicketEvent(TicketEvent event) {
        try {
            Optional<OutboundMessage> message = templates.render(event);
            message.ifPresent(emailService::send);

            if (PAGED_EVENTS.contains(event.getType()) && twilioService.isEnabled()) {
                twilioService.page(event.getTicketId(), templates.shortAlert(event));
            }
        } catch (Exception e) {
            log.error("Notification for {} on ticket {} failed: {}",
                    event.getType(), event.getTicketId(), e.getMessage(), e);
        }
    }
}
