package com.servicedesk.automation.repository;

import com.servicedesk.automation.engine.TicketInvariants;
import com.servicedesk.automation.exception.DuplicateIngestionException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Single-process store for local runs and tests. Per-ticket atomicity comes from
 * {@link ConcurrentHashMap#computeIfPresent}; fingerprints are claimed with computeIfAbsent.
 */
@Repository
@ConditionalOnProperty(name = "desk.store.type", havingValue = "memory")
public class InMemoryTicketStore implements TicketStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTicketStore.class);

    private final ConcurrentHashMap<Long, Ticket> tickets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> fingerprints = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Ticket create(Ticket ticket) {
        TicketInvariants.checkNew(ticket);

        Ticket stored = ticket.copy();
        String fingerprint = ticket.getFingerprint();
        if (fingerprint == null) {
            stored.setId(sequence.incrementAndGet());
        } else {
            // Only the winning claim draws an id, and the claim holds it from the start
            AtomicLong reserved = new AtomicLong();
            long claimed = fingerprints.computeIfAbsent(fingerprint, fp -> {
                reserved.set(sequence.incrementAndGet());
                return reserved.get();
            });
            if (claimed != reserved.get()) {
                throw new DuplicateIngestionException(fingerprint, claimed);
            }
            stored.setId(claimed);
        }
        tickets.put(stored.getId(), stored);
        log.debug("Stored ticket {} ({})", stored.getId(), stored.getStatus());
        return stored.copy();
    }

    @Override
    public Ticket findById(long id) {
        Ticket ticket = tickets.get(id);
        return ticket != null ? ticket.copy() : null;
    }

    @Override
    public Ticket update(long id, TicketMutation mutation) {
        AtomicReference<Ticket> result = new AtomicReference<>();
        Ticket stored = tickets.computeIfPresent(id, (key, current) -> {
            Ticket candidate = mutation.apply(current.copy());
            if (candidate == null || candidate.equals(current)) {
                result.set(current.copy());
                return current;
            }
            TicketInvariants.checkUpdate(current, candidate);
            Ticket next = candidate.copy();
            result.set(next.copy());
            return next;
        });
        if (stored == null) {
            throw new TicketNotFoundException(id);
        }
        return result.get();
    }

    @Override
    public List<Ticket> listByStatus(TicketStatus status) {
        return select(t -> t.getStatus() == status);
    }

    @Override
    public List<Ticket> listDueBefore(Instant instant) {
        return select(t -> {
            Instant next = t.nextSlaCheckAt();
            return next != null && !next.isAfter(instant);
        });
    }

    @Override
    public List<Ticket> findAll() {
        return select(t -> true);
    }

    private List<Ticket> select(Predicate<Ticket> predicate) {
        return tickets.values().stream()
                .filter(predicate)
                .map(Ticket::copy)
                .sorted(Comparator.comparingLong(Ticket::getId))
                .collect(Collectors.toList());
    }
}
