package com.servicedesk.automation.engine;

import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.SlaState;
import com.servicedesk.automation.model.SlaStatus;
import com.servicedesk.automation.model.Ticket;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline arithmetic against the SLA policy. Stateless; callers pass {@code now}.
 */
@Component
public class SlaCalculator {

    private final SlaConfig config;

    public SlaCalculator(SlaConfig config) {
        this.config = config;
    }

    /**
     * Set response, resolution and warning deadlines from the ticket's priority,
     * counted from {@code createdAt}.
     */
    public void applyDeadlines(Ticket ticket, Instant createdAt) {
        SlaConfig.Window window = config.windowFor(ticket.getPriority());
        ticket.setResponseDueAt(createdAt.plus(window.getResponse()));
        ticket.setResolutionDueAt(createdAt.plus(window.getResolution()));
        ticket.setSlaWarningAt(createdAt.plus(warningOffset(window.getResolution())));
    }

    /**
     * Recompute deadlines from the HIGH windows starting at {@code now}. Deadlines
     * only ever move earlier; an already-earlier deadline is kept.
     */
    public void tightenForEscalation(Ticket ticket, Instant now) {
        SlaConfig.Window high = config.windowFor(Priority.HIGH);
        ticket.setResponseDueAt(earlier(ticket.getResponseDueAt(), now.plus(high.getResponse())));
        ticket.setResolutionDueAt(earlier(ticket.getResolutionDueAt(), now.plus(high.getResolution())));
        ticket.setSlaWarningAt(earlier(ticket.getSlaWarningAt(), now.plus(warningOffset(high.getResolution()))));
    }

    /**
     * Which SLA flags the monitor should newly set on an open ticket at {@code now}.
     */
    public Assessment assess(Ticket ticket, Instant now) {
        if (ticket.isTerminal()) {
            return Assessment.NONE;
        }

        boolean responseBreach = !ticket.isResponseBreached()
                && ticket.getAssignedAt() == null
                && ticket.getResponseDueAt() != null
                && now.isAfter(ticket.getResponseDueAt());

        boolean resolutionBreach = !ticket.isResolutionBreached()
                && ticket.getResolutionDueAt() != null
                && now.isAfter(ticket.getResolutionDueAt());

        boolean warning = !resolutionBreach
                && !ticket.isResolutionBreached()
                && !ticket.isSlaWarningSent()
                && ticket.getSlaWarningAt() != null
                && !now.isBefore(ticket.getSlaWarningAt());

        if (!responseBreach && !resolutionBreach && !warning) {
            return Assessment.NONE;
        }
        return new Assessment(responseBreach, resolutionBreach, warning);
    }

    public SlaState state(Ticket ticket, Instant now) {
        boolean flagged = ticket.isResponseBreached() || ticket.isResolutionBreached();
        if (ticket.isTerminal()) {
            return flagged ? SlaState.BREACHED : SlaState.MET;
        }
        if (flagged || isOverdue(ticket.getResolutionDueAt(), now)) {
            return SlaState.BREACHED;
        }
        if (ticket.getSlaWarningAt() != null && !now.isBefore(ticket.getSlaWarningAt())) {
            return SlaState.WARNING;
        }
        return SlaState.ON_TRACK;
    }

    public SlaStatus status(Ticket ticket, Instant now) {
        boolean closed = ticket.isTerminal();

        boolean responseOk = !ticket.isResponseBreached()
                && (closed || ticket.getAssignedAt() != null || !isOverdue(ticket.getResponseDueAt(), now));
        boolean resolutionOk = !ticket.isResolutionBreached()
                && (closed || !isOverdue(ticket.getResolutionDueAt(), now));

        Long millisToBreach = null;
        if (!closed && ticket.getResolutionDueAt() != null) {
            millisToBreach = Duration.between(now, ticket.getResolutionDueAt()).toMillis();
        }

        return SlaStatus.builder()
                .state(state(ticket, now))
                .responseOk(responseOk)
                .resolutionOk(resolutionOk)
                .millisToBreach(millisToBreach)
                .responseDueAt(ticket.getResponseDueAt())
                .resolutionDueAt(ticket.getResolutionDueAt())
                .build();
    }

    private Duration warningOffset(Duration resolutionWindow) {
        long millis = Math.round(resolutionWindow.toMillis() * (config.getWarningThresholdPct() / 100.0));
        return Duration.ofMillis(millis);
    }

    private static boolean isOverdue(Instant deadline, Instant now) {
        return deadline != null && now.isAfter(deadline);
    }

    private static Instant earlier(Instant current, Instant candidate) {
        if (current == null) return candidate;
        return candidate.isBefore(current) ? candidate : current;
    }

    /**
     * Flags to set in one sweep of one ticket.
     */
    public static final class Assessment {

        public static final Assessment NONE = new Assessment(false, false, false);

        private final boolean responseBreach;
        private final boolean resolutionBreach;
        private final boolean warning;

        public Assessment(boolean responseBreach, boolean resolutionBreach, boolean warning) {
            this.responseBreach = responseBreach;
            this.resolutionBreach = resolutionBreach;
            this.warning = warning;
        }

        public boolean isResponseBreach() {
            return responseBreach;
        }

        public boolean isResolutionBreach() {
            return resolutionBreach;
        }

        public boolean isWarning() {
            return warning;
        }

        public boolean isEmpty() {
            return !responseBreach && !resolutionBreach && !warning;
        }
    }
}
