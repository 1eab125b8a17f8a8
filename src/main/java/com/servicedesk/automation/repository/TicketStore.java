package com.servicedesk.automation.repository;

import com.servicedesk.automation.exception.DuplicateIngestionException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketStatus;

import java.time.Instant;
import java.util.List;

/**
 * Durable ticket records. The only writer of ticket state; every change goes through
 * {@link #update}, which is atomic per ticket.
 */
public interface TicketStore {

    /**
     * Persist a new ticket and claim its fingerprint in one step. The store assigns the id.
     *
     * @throws DuplicateIngestionException when the fingerprint is already claimed
     */
    Ticket create(Ticket ticket);

    Ticket findById(long id);

    /**
     * Atomic read-modify-write. Concurrent updates to the same ticket are serialized;
     * an exception thrown by the mutation aborts the update and nothing is written.
     *
     * @throws TicketNotFoundException when no ticket has this id
     */
    Ticket update(long id, TicketMutation mutation);

    List<Ticket> listByStatus(TicketStatus status);

    /**
     * Open tickets with SLA work pending at or before {@code instant}.
     */
    List<Ticket> listDueBefore(Instant instant);

    /**
     * All tickets in ascending id order.
     */
    List<Ticket> findAll();
}
