package com.servicedesk.automation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Service desk ticket raised from a support email.
 *
 * <p>Source message fields, category, id and creation time are fixed at creation.
 * SLA breach flags and the warning marker only ever go from false to true.
 * Once the status is terminal the record is frozen.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Service desk ticket with lifecycle state and SLA deadlines")
public class Ticket {

    @Schema(description = "Store-assigned ticket id, increasing in creation order", example = "42")
    private long id;

    @Schema(description = "Fingerprint of the source email used for duplicate detection")
    private String fingerprint;

    @Schema(description = "Sender address of the source email", example = "jane.doe@example.com")
    private String sender;

    @Schema(description = "Subject of the source email", example = "VPN cannot connect")
    private String subject;

    @Schema(description = "Body of the source email")
    private String body;

    @Schema(description = "When the source email was received, if known")
    private Instant receivedAt;

    @Schema(description = "Category assigned by the classifier", example = "NETWORK")
    private Category category;

    @Schema(description = "Current priority; only ever raised by SLA escalation", example = "MEDIUM")
    private Priority priority;

    @Schema(description = "Lifecycle status", example = "ASSIGNED")
    private TicketStatus status;

    @Schema(description = "Team mailbox handling the ticket", example = "network-team@example.com")
    private String assignedTeam;

    @Schema(description = "Creation time")
    private Instant createdAt;

    @Schema(description = "When a team was first assigned (counts as first response)")
    private Instant assignedAt;

    @Schema(description = "When the ticket was escalated")
    private Instant escalatedAt;

    @Schema(description = "First-response deadline")
    private Instant responseDueAt;

    @Schema(description = "Resolution deadline")
    private Instant resolutionDueAt;

    @Schema(description = "Instant from which the ticket counts as approaching breach")
    private Instant slaWarningAt;

    @Schema(description = "Set once, on transition into AUTO_RESOLVED or RESOLVED")
    private Instant resolvedAt;

    @Schema(description = "Note recorded on resolution")
    private String resolutionNote;

    @Schema(description = "Agent id, or SYSTEM for auto-resolution")
    private String resolvedBy;

    @Schema(description = "Response SLA breached")
    private boolean responseBreached;

    @Schema(description = "Resolution SLA breached")
    private boolean resolutionBreached;

    @Schema(description = "Approaching-breach warning already sent")
    private boolean slaWarningSent;

    @Schema(description = "Last modification time")
    private Instant updatedAt;

    @Schema(description = "Transition audit trail, oldest first")
    @Builder.Default
    private List<TicketHistoryEntry> history = new ArrayList<>();

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Earliest instant at which the SLA monitor has something left to evaluate,
     * or null when nothing is pending (terminal, or every flag already set).
     */
    public Instant nextSlaCheckAt() {
        if (isTerminal()) return null;

        Instant next = null;
        if (!responseBreached && assignedAt == null) {
            next = earliest(next, responseDueAt);
        }
        if (!resolutionBreached) {
            if (!slaWarningSent) {
                next = earliest(next, slaWarningAt);
            }
            next = earliest(next, resolutionDueAt);
        }
        return next;
    }

    public void addHistory(TicketHistoryEntry entry) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(entry);
    }

    /**
     * Copy that shares no mutable state with this ticket.
     */
    public Ticket copy() {
        return toBuilder()
                .history(history != null ? new ArrayList<>(history) : new ArrayList<>())
                .build();
    }

    private static Instant earliest(Instant current, Instant candidate) {
        if (candidate == null) return current;
        if (current == null || candidate.isBefore(current)) return candidate;
        return current;
    }
}
