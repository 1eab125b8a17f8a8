package com.servicedesk.automation.engine;

import com.servicedesk.automation.exception.InvalidStateException;
import com.servicedesk.automation.exception.TerminalStateException;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.TicketStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed ticket transitions.
 *
 * <pre>
 *   NEW       -> AUTO_RESOLVED | ASSIGNED | ESCALATED
 *   ASSIGNED  -> RESOLVED | ESCALATED
 *   ESCALATED -> RESOLVED | ESCALATED   (re-escalation on SLA breach)
 * </pre>
 * AUTO_RESOLVED and RESOLVED are terminal. There is no reopening.
 */
public final class TicketStateMachine {

    private static final Map<TicketStatus, Set<TicketStatus>> TRANSITIONS = new EnumMap<>(TicketStatus.class);

    static {
        TRANSITIONS.put(TicketStatus.NEW,
                EnumSet.of(TicketStatus.AUTO_RESOLVED, TicketStatus.ASSIGNED, TicketStatus.ESCALATED));
        TRANSITIONS.put(TicketStatus.ASSIGNED, EnumSet.of(TicketStatus.RESOLVED, TicketStatus.ESCALATED));
        TRANSITIONS.put(TicketStatus.ESCALATED, EnumSet.of(TicketStatus.RESOLVED, TicketStatus.ESCALATED));
        TRANSITIONS.put(TicketStatus.AUTO_RESOLVED, EnumSet.noneOf(TicketStatus.class));
        TRANSITIONS.put(TicketStatus.RESOLVED, EnumSet.noneOf(TicketStatus.class));
    }

    private TicketStateMachine() {}

    public static boolean canTransition(TicketStatus from, TicketStatus to) {
        return TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    /**
     * @throws TerminalStateException when {@code from} is terminal
     * @throws InvalidStateException  when the transition is otherwise not allowed
     */
    public static void checkTransition(long ticketId, TicketStatus from, TicketStatus to) {
        if (from != null && from.isTerminal()) {
            throw new TerminalStateException(ticketId, from, to);
        }
        if (!canTransition(from, to)) {
            throw new InvalidStateException(ticketId, from, to);
        }
    }

    /**
     * Status a freshly created ticket moves to, by priority.
     */
    public static TicketStatus creationTarget(Priority priority) {
        return switch (priority) {
            case LOW -> TicketStatus.AUTO_RESOLVED;
            case MEDIUM -> TicketStatus.ASSIGNED;
            case HIGH -> TicketStatus.ESCALATED;
        };
    }
}
