package com.servicedesk.automation.service;

import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.config.RoutingConfig;
import com.servicedesk.automation.engine.MessageFingerprint;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.engine.TicketClassifier;
import com.servicedesk.automation.engine.TicketStateMachine;
import com.servicedesk.automation.exception.DuplicateIngestionException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import com.servicedesk.automation.model.Classification;
import com.servicedesk.automation.model.DuplicateSkip;
import com.servicedesk.automation.model.IngestionResult;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.RawMessage;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketEvent;
import com.servicedesk.automation.model.TicketEventType;
import com.servicedesk.automation.model.TicketHistoryEntry;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.repository.TicketStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Owns ticket state transitions. Every change is applied through
 * {@link TicketStore#update}, and events are published only after the store accepted it.
 */
@Service
public class TicketLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TicketLifecycleService.class);

    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_SLA_MONITOR = "SLA_MONITOR";
    static final String DEFAULT_AGENT = "agent";
    static final String AUTO_RESOLUTION_NOTE = "Low priority request closed automatically";

    private final TicketStore store;
    private final TicketClassifier classifier;
    private final SlaCalculator slaCalculator;
    private final RoutingConfig routingConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TicketLifecycleService(TicketStore store,
                                  TicketClassifier classifier,
                                  SlaCalculator slaCalculator,
                                  RoutingConfig routingConfig,
                                  ApplicationEventPublisher eventPublisher,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.store = store;
        this.classifier = classifier;
        this.slaCalculator = slaCalculator;
        this.routingConfig = routingConfig;
        this.eventPublisher = eventPublisher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Turn a batch of messages into tickets. Messages already ingested are reported as
     * skips; any other store failure propagates and leaves earlier tickets of the batch stored.
     */
    @Observed(name = "ticket.ingest", contextualName = "ingest-messages")
    public IngestionResult ingest(List<RawMessage> messages, Instant now) {
        IngestionResult result = IngestionResult.builder()
                .processedAt(now)
                .received(messages.size())
                .build();

        for (RawMessage message : messages) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Ingestion interrupted after {} of {} messages",
                        result.getCreatedTicketIds().size() + result.getDuplicates().size(), messages.size());
                result.setInterrupted(true);
                break;
            }
            try {
                Ticket ticket = createTicket(message, now);
                result.getCreatedTicketIds().add(ticket.getId());
            } catch (DuplicateIngestionException e) {
                metricsConfig.recordDuplicateSkipped();
                log.debug("Skipping duplicate message from {}: {}", message.getSender(), e.getMessage());
                result.getDuplicates().add(DuplicateSkip.builder()
                        .fingerprint(e.getFingerprint())
                        .sender(message.getSender())
                        .subject(message.getSubject())
                        .existingTicketId(e.getExistingTicketId())
                        .build());
            }
        }

        log.info("Ingestion batch done: received={}, created={}, duplicates={}",
                result.getReceived(), result.getCreatedTicketIds().size(), result.getDuplicates().size());
        return result;
    }

    /**
     * Classify one message and store it as a ticket that has already taken its
     * creation transition. The history records both NEW and the target status.
     *
     * @throws DuplicateIngestionException when the message was ingested before
     */
    public Ticket createTicket(RawMessage message, Instant now) {
        Classification classification = classifier.classify(message);
        TicketStatus target = TicketStateMachine.creationTarget(classification.getPriority());

        Ticket ticket = Ticket.builder()
                .fingerprint(MessageFingerprint.of(message))
                .sender(message.getSender())
                .subject(message.getSubject())
                .body(message.getBody())
                .receivedAt(message.getReceivedAt())
                .category(classification.getCategory())
                .priority(classification.getPriority())
                .status(TicketStatus.NEW)
                .createdAt(now)
                .updatedAt(now)
                .build();
        ticket.addHistory(history(now, null, TicketStatus.NEW, ACTOR_SYSTEM, describe(classification)));
        slaCalculator.applyDeadlines(ticket, now);

        TicketStateMachine.checkTransition(0L, TicketStatus.NEW, target);
        switch (target) {
            case AUTO_RESOLVED -> {
                ticket.setResolvedAt(now);
                ticket.setResolvedBy(ACTOR_SYSTEM);
                ticket.setResolutionNote(AUTO_RESOLUTION_NOTE);
            }
            case ASSIGNED -> assignTeam(ticket, now);
            case ESCALATED -> {
                assignTeam(ticket, now);
                ticket.setEscalatedAt(now);
            }
            default -> throw new IllegalStateException("Unexpected creation target " + target);
        }
        ticket.setStatus(target);
        ticket.addHistory(history(now, TicketStatus.NEW, target, ACTOR_SYSTEM, null));

        Ticket stored = store.create(ticket);

        metricsConfig.recordTicketCreated(stored.getCategory().name(), stored.getPriority().name());
        metricsConfig.recordTransition(target.name());
        log.info("Created ticket {} [{}/{}] -> {} team={}", stored.getId(), stored.getCategory(),
                stored.getPriority(), target, stored.getAssignedTeam());

        publish(TicketEventType.TICKET_CREATED, stored, now);
        publish(creationEvent(target), stored, now);
        return stored;
    }

    /**
     * Resolve an assigned or escalated ticket.
     *
     * @throws IllegalArgumentException when the note is blank
     * @throws com.servicedesk.automation.exception.TerminalStateException when the ticket is already closed
     * @throws com.servicedesk.automation.exception.InvalidStateException  when the ticket is still NEW
     * @throws TicketNotFoundException when there is no such ticket
     */
    public Ticket resolve(long ticketId, String note, String resolvedBy) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("Resolution note is required");
        }
        String agent = resolvedBy != null && !resolvedBy.isBlank() ? resolvedBy.strip() : DEFAULT_AGENT;
        Instant now = clock.instant();

        Ticket resolved = store.update(ticketId, ticket -> {
            TicketStatus from = ticket.getStatus();
            TicketStateMachine.checkTransition(ticketId, from, TicketStatus.RESOLVED);
            ticket.setStatus(TicketStatus.RESOLVED);
            ticket.setResolvedAt(now);
            ticket.setResolvedBy(agent);
            ticket.setResolutionNote(note.strip());
            ticket.setUpdatedAt(now);
            ticket.addHistory(history(now, from, TicketStatus.RESOLVED, agent, note.strip()));
            return ticket;
        });

        metricsConfig.recordTransition(TicketStatus.RESOLVED.name());
        log.info("Ticket {} resolved by {}", ticketId, agent);
        publish(TicketEventType.TICKET_RESOLVED, resolved, now);
        return resolved;
    }

    /**
     * Escalate a ticket whose resolution target was missed.
     */
    public Ticket escalateForBreach(long ticketId, Instant now) {
        Ticket escalated = store.update(ticketId, ticket -> {
            applyEscalation(ticket, now, "Resolution SLA breached");
            return ticket;
        });
        metricsConfig.recordTransition(TicketStatus.ESCALATED.name());
        publish(TicketEventType.TICKET_ESCALATED, escalated, now);
        return escalated;
    }

    /**
     * Mutates {@code ticket} into ESCALATED at HIGH priority, with a team and deadlines
     * no later than the HIGH windows counted from {@code now}. Meant to run inside a
     * store mutation; publishes nothing.
     */
    public void applyEscalation(Ticket ticket, Instant now, String reason) {
        TicketStatus from = ticket.getStatus();
        TicketStateMachine.checkTransition(ticket.getId(), from, TicketStatus.ESCALATED);

        ticket.setPriority(Priority.HIGH);
        if (ticket.getAssignedTeam() == null) {
            assignTeam(ticket, now);
        }
        ticket.setEscalatedAt(now);
        slaCalculator.tightenForEscalation(ticket, now);
        ticket.setStatus(TicketStatus.ESCALATED);
        ticket.setUpdatedAt(now);
        ticket.addHistory(history(now, from, TicketStatus.ESCALATED, ACTOR_SLA_MONITOR, reason));
        log.warn("Ticket {} escalated from {}: {}", ticket.getId(), from, reason);
    }

    public Ticket getTicket(long ticketId) {
        Ticket ticket = store.findById(ticketId);
        if (ticket == null) {
            throw new TicketNotFoundException(ticketId);
        }
        return ticket;
    }

    // Callers publish only after the change is stored
    public void publish(TicketEventType type, Ticket ticket, Instant now) {
        eventPublisher.publishEvent(TicketEvent.builder()
                .type(type)
                .ticketId(ticket.getId())
                .occurredAt(now)
                .ticket(ticket.copy())
                .build());
    }

    private void assignTeam(Ticket ticket, Instant now) {
        ticket.setAssignedTeam(routingConfig.teamFor(ticket.getCategory()));
        if (ticket.getAssignedAt() == null) {
            ticket.setAssignedAt(now);
        }
    }

    private static TicketEventType creationEvent(TicketStatus target) {
        return switch (target) {
            case AUTO_RESOLVED -> TicketEventType.TICKET_AUTO_RESOLVED;
            case ESCALATED -> TicketEventType.TICKET_ESCALATED;
            default -> TicketEventType.TICKET_ASSIGNED;
        };
    }

    private static String describe(Classification classification) {
        String source = classification.isFallback()
                ? "fallback"
                : "rule " + classification.getMatchedRuleId();
        return "Classified " + classification.getCategory() + "/" + classification.getPriority() + " by " + source;
    }

    private static TicketHistoryEntry history(Instant at, TicketStatus from, TicketStatus to,
                                              String actor, String detail) {
        return TicketHistoryEntry.builder()
                .at(at)
                .fromStatus(from)
                .toStatus(to)
                .actor(actor)
                .detail(detail)
                .build();
    }
}
