package com.servicedesk.automation.repository;

import com.servicedesk.automation.model.Ticket;

/**
 * Change applied to a private copy of the current ticket inside {@link TicketStore#update}.
 * The function may run more than once when the store retries a lost race, so it must
 * not have side effects beyond the ticket it is given.
 */
@FunctionalInterface
public interface TicketMutation {

    /**
     * @param current copy of the stored ticket, safe to modify
     * @return the ticket to store; returning a value equal to the stored one writes nothing
     */
    Ticket apply(Ticket current);
}
