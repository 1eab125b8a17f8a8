package com.servicedesk.automation.service;

import com.servicedesk.automation.config.NotificationConfig;
import com.servicedesk.automation.model.OutboundMessage;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Optional;

/**
 * HTML email bodies for ticket events. Returns empty for events that notify nobody.
 */
@Component
public class NotificationTemplates {

    private static final String STYLE = "font-family: Arial, sans-serif;";

    private final NotificationConfig config;

    public NotificationTemplates(NotificationConfig config) {
        this.config = config;
    }

    public Optional<OutboundMessage> render(TicketEvent event) {
        Ticket t = event.getTicket();
        if (t == null) {
            return Optional.empty();
        }
        return switch (event.getType()) {
            case TICKET_CREATED -> Optional.of(created(t));
            case TICKET_AUTO_RESOLVED, TICKET_RESOLVED -> Optional.of(resolved(t));
            case TICKET_ESCALATED -> toTeam(escalated(t));
            case RESOLUTION_BREACH -> toTeam(resolutionBreach(t));
            case RESPONSE_BREACH -> toTeam(responseBreach(t));
            case SLA_WARNING -> toTeam(warning(t));
            case TICKET_ASSIGNED -> Optional.empty();
        };
    }

    /**
     * One-line text for SMS and WhatsApp alerts.
     */
    public String shortAlert(TicketEvent event) {
        Ticket t = event.getTicket();
        return String.format("[%s] Ticket #%d %s/%s: %s (team %s, due %s)",
                event.getType(), t.getId(), t.getCategory(), t.getPriority(),
                t.getSubject(), t.getAssignedTeam(), t.getResolutionDueAt());
    }

    private OutboundMessage created(Ticket t) {
        String body = "<h2>Your Service Desk Ticket Has Been Created</h2>"
                + "<table style=\"border-collapse: collapse;\">"
                + row("Ticket ID", "#" + t.getId())
                + row("Issue", t.getSubject())
                + row("Category", String.valueOf(t.getCategory()))
                + row("Priority", String.valueOf(t.getPriority()))
                + row("Status", String.valueOf(t.getStatus()))
                + "</table>"
                + "<p>We will respond within the SLA timeframe for " + t.getPriority() + " priority tickets.</p>";
        return message(t.getSender(), String.format("Ticket #%d Created: %s", t.getId(), t.getSubject()), body);
    }

    private OutboundMessage resolved(Ticket t) {
        String how = TicketLifecycleService.ACTOR_SYSTEM.equals(t.getResolvedBy()) ? "automatically resolved" : "resolved";
        String body = "<h2>Your Ticket Has Been Resolved</h2>"
                + "<p>Ticket <strong>#" + t.getId() + "</strong> regarding \"<em>" + escape(t.getSubject())
                + "</em>\" has been " + how + ".</p>"
                + (t.getResolutionNote() != null ? "<p>" + escape(t.getResolutionNote()) + "</p>" : "")
                + "<p>If you still need assistance, please reply to this email or submit a new request.</p>";
        return message(t.getSender(), String.format("Ticket #%d Resolved", t.getId()), body);
    }

    private OutboundMessage escalated(Ticket t) {
        String body = "<h2 style=\"color: #d32f2f;\">High Priority Ticket Escalated</h2>"
                + details(t)
                + "<p><strong>Action Required:</strong> Please respond within SLA.</p>";
        return message(t.getAssignedTeam(),
                String.format("[ESCALATED] Ticket #%d: %s", t.getId(), t.getSubject()), body);
    }

    private OutboundMessage resolutionBreach(Ticket t) {
        String body = "<h2 style=\"color: #d32f2f;\">Resolution SLA Breached</h2>"
                + details(t)
                + "<p>The resolution deadline " + t.getResolutionDueAt()
                + " has passed. The ticket has been escalated to HIGH priority.</p>";
        return message(t.getAssignedTeam(),
                String.format("[SLA BREACH] Ticket #%d: %s", t.getId(), t.getSubject()), body);
    }

    private OutboundMessage responseBreach(Ticket t) {
        String body = "<h2 style=\"color: #ff9800;\">Response SLA Breached</h2>"
                + details(t)
                + "<p>No team picked up this ticket before " + t.getResponseDueAt() + ".</p>";
        return message(t.getAssignedTeam(),
                String.format("[SLA BREACH] Ticket #%d awaiting first response", t.getId()), body);
    }

    private OutboundMessage warning(Ticket t) {
        String body = "<h2 style=\"color: #ff9800;\">SLA Breach Warning</h2>"
                + "<p>Ticket <strong>#" + t.getId() + "</strong> is approaching SLA breach"
                + " (resolution due " + t.getResolutionDueAt() + ").</p>"
                + "<p>Please take immediate action.</p>";
        return message(t.getAssignedTeam(),
                String.format("[SLA WARNING] Ticket #%d approaching breach", t.getId()), body);
    }

    // Tickets stranded in NEW have no team yet
    private Optional<OutboundMessage> toTeam(OutboundMessage message) {
        if (message.getRecipient() == null) {
            message.setRecipient(config.getFallbackRecipient());
        }
        return Optional.of(message);
    }

    private String details(Ticket t) {
        return "<table style=\"border-collapse: collapse;\">"
                + row("Ticket ID", "#" + t.getId())
                + row("From", t.getSender())
                + row("Issue", t.getSubject())
                + row("Category", String.valueOf(t.getCategory()))
                + row("Priority", String.valueOf(t.getPriority()))
                + "</table>";
    }

    private OutboundMessage message(String recipient, String subject, String content) {
        String html = "<html><body style=\"" + STYLE + "\">" + content
                + "<p>Thank you,<br>" + escape(config.getDeskName()) + "</p></body></html>";
        return OutboundMessage.builder()
                .recipient(recipient)
                .subject(subject)
                .body(html)
                .build();
    }

    private static String row(String label, String value) {
        return "<tr><td><strong>" + label + ":</strong></td><td>" + escape(value) + "</td></tr>";
    }

    private static String escape(String value) {
        return value != null ? HtmlUtils.htmlEscape(value) : "";
    }
}
