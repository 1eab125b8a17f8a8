package com.servicedesk.automation.engine;

import com.servicedesk.automation.exception.TerminalStateException;
import com.servicedesk.automation.model.Ticket;

import java.time.Instant;
import java.util.Objects;

/**
 * Checks a proposed ticket write against the record it replaces. Stores call this
 * inside their atomic update, so no code path can persist a violating ticket.
 */
public final class TicketInvariants {

    private TicketInvariants() {}

    public static void checkNew(Ticket ticket) {
        checkShape(ticket);
    }

    /**
     * @throws TerminalStateException when {@code current} is terminal
     * @throws IllegalStateException  when an immutable or monotonic field would change
     */
    public static void checkUpdate(Ticket current, Ticket candidate) {
        if (current.isTerminal()) {
            throw new TerminalStateException(current.getId(), current.getStatus(), candidate.getStatus());
        }

        requireUnchanged(current.getId(), candidate.getId(), "id", current);
        requireUnchanged(current.getFingerprint(), candidate.getFingerprint(), "fingerprint", current);
        requireUnchanged(current.getSender(), candidate.getSender(), "sender", current);
        requireUnchanged(current.getSubject(), candidate.getSubject(), "subject", current);
        requireUnchanged(current.getBody(), candidate.getBody(), "body", current);
        requireUnchanged(current.getCategory(), candidate.getCategory(), "category", current);
        requireUnchanged(current.getCreatedAt(), candidate.getCreatedAt(), "createdAt", current);

        if (candidate.getPriority().isBelow(current.getPriority())) {
            throw violation(current, "priority cannot be lowered");
        }
        if (current.isResponseBreached() && !candidate.isResponseBreached()) {
            throw violation(current, "response breach flag cannot be cleared");
        }
        if (current.isResolutionBreached() && !candidate.isResolutionBreached()) {
            throw violation(current, "resolution breach flag cannot be cleared");
        }
        if (current.isSlaWarningSent() && !candidate.isSlaWarningSent()) {
            throw violation(current, "SLA warning marker cannot be cleared");
        }
        if (isLater(candidate.getResponseDueAt(), current.getResponseDueAt())
                || isLater(candidate.getResolutionDueAt(), current.getResolutionDueAt())) {
            throw violation(current, "SLA deadlines cannot be extended");
        }

        checkShape(candidate);
    }

    private static void checkShape(Ticket ticket) {
        boolean resolved = ticket.getResolvedAt() != null;
        if (resolved != ticket.isTerminal()) {
            throw violation(ticket, "resolvedAt must be set exactly when the status is terminal (status "
                    + ticket.getStatus() + ")");
        }
        if (ticket.getResponseDueAt() != null && ticket.getResolutionDueAt() != null
                && !ticket.getResponseDueAt().isBefore(ticket.getResolutionDueAt())) {
            throw violation(ticket, "response deadline must precede resolution deadline");
        }
    }

    private static boolean isLater(Instant candidate, Instant current) {
        if (candidate == null || current == null) return false;
        return candidate.isAfter(current);
    }

    private static void requireUnchanged(Object before, Object after, String field, Ticket ticket) {
        if (!Objects.equals(before, after)) {
            throw violation(ticket, field + " is immutable");
        }
    }

    private static IllegalStateException violation(Ticket ticket, String reason) {
        return new IllegalStateException("Ticket " + ticket.getId() + ": " + reason);
    }
}
