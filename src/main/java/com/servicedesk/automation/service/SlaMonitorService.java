package com.servicedesk.automation.service;

import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.model.SlaReport;
import com.servicedesk.automation.model.SlaState;
import com.servicedesk.automation.model.SlaSummary;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketEvent;
import com.servicedesk.automation.model.TicketEventType;
import com.servicedesk.automation.repository.TicketStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic SLA evaluation. Breach and warning flags live on the ticket and are only
 * ever set, never cleared, so each event is emitted at most once per ticket no matter
 * how often or how late the sweep runs.
 */
@Service
public class SlaMonitorService {

    private static final Logger log = LoggerFactory.getLogger(SlaMonitorService.class);

    private final TicketStore store;
    private final SlaCalculator slaCalculator;
    private final TicketLifecycleService lifecycleService;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public SlaMonitorService(TicketStore store,
                             SlaCalculator slaCalculator,
                             TicketLifecycleService lifecycleService,
                             MetricsConfig metricsConfig,
                             Tracer tracer) {
        this.store = store;
        this.slaCalculator = slaCalculator;
        this.lifecycleService = lifecycleService;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    /**
     * Evaluate every open ticket with an SLA checkpoint at or before {@code now}.
     * A ticket that fails is counted in the report and the sweep moves on.
     */
    @Observed(name = "sla.sweep", contextualName = "sla-sweep")
    public SlaReport sweep(Instant now) {
        long started = System.nanoTime();
        SlaReport report = SlaReport.builder().sweptAt(now).build();

        List<Ticket> due = store.listDueBefore(now);
        report.setScanned(due.size());

        for (int i = 0; i < due.size(); i++) {
            Ticket candidate = due.get(i);
            if (Thread.currentThread().isInterrupted()) {
                log.warn("SLA sweep interrupted, {} of {} tickets left unevaluated", due.size() - i, due.size());
                report.setInterrupted(true);
                break;
            }

            Span span = tracer.nextSpan()
                    .name("sla.evaluate")
                    .tag("ticket.id", String.valueOf(candidate.getId()))
                    .start();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                evaluate(candidate.getId(), now, report);
            } catch (Exception e) {
                span.error(e);
                report.setFailed(report.getFailed() + 1);
                report.getFailedTicketIds().add(candidate.getId());
                log.error("SLA evaluation failed for ticket {}: {}", candidate.getId(), e.getMessage(), e);
            } finally {
                span.end();
            }
        }

        metricsConfig.recordSweep(Duration.ofNanos(System.nanoTime() - started), report.getFailed());
        log.info("SLA sweep at {}: scanned={}, updated={}, responseBreaches={}, resolutionBreaches={}, "
                        + "warnings={}, failed={}",
                now, report.getScanned(), report.getUpdated(), report.getResponseBreaches(),
                report.getResolutionBreaches(), report.getWarnings(), report.getFailed());
        return report;
    }

    public SlaSummary summarize(Instant now) {
        List<Ticket> tickets = store.findAll();
        int onTrack = 0;
        int warning = 0;
        int breached = 0;
        int met = 0;
        int openBreached = 0;

        for (Ticket ticket : tickets) {
            SlaState state = slaCalculator.state(ticket, now);
            switch (state) {
                case ON_TRACK -> onTrack++;
                case WARNING -> warning++;
                case MET -> met++;
                case BREACHED -> {
                    breached++;
                    if (!ticket.isTerminal()) openBreached++;
                }
            }
        }
        metricsConfig.updateOpenBreachedTickets(openBreached);

        double complianceRate = tickets.isEmpty()
                ? 100.0
                : Math.round((onTrack + met) * 1000.0 / tickets.size()) / 10.0;

        return SlaSummary.builder()
                .total(tickets.size())
                .onTrack(onTrack)
                .warning(warning)
                .breached(breached)
                .met(met)
                .complianceRate(complianceRate)
                .build();
    }

    private void evaluate(long ticketId, Instant now, SlaReport report) {
        // Holds the assessment of the attempt the store actually committed
        AtomicReference<SlaCalculator.Assessment> applied = new AtomicReference<>(SlaCalculator.Assessment.NONE);

        Ticket updated = store.update(ticketId, ticket -> {
            SlaCalculator.Assessment assessment = slaCalculator.assess(ticket, now);
            applied.set(assessment);
            if (assessment.isEmpty()) {
                return ticket;
            }
            if (assessment.isResponseBreach()) {
                ticket.setResponseBreached(true);
            }
            if (assessment.isWarning()) {
                ticket.setSlaWarningSent(true);
            }
            if (assessment.isResolutionBreach()) {
                ticket.setResolutionBreached(true);
                lifecycleService.applyEscalation(ticket, now, "Resolution SLA breached");
            }
            ticket.setUpdatedAt(now);
            return ticket;
        });

        SlaCalculator.Assessment assessment = applied.get();
        if (assessment.isEmpty()) {
            return;
        }
        report.setUpdated(report.getUpdated() + 1);

        if (assessment.isResponseBreach()) {
            report.setResponseBreaches(report.getResponseBreaches() + 1);
            log.warn("Ticket {} breached its response target (due {})", ticketId, updated.getResponseDueAt());
            emit(TicketEventType.RESPONSE_BREACH, updated, now, report);
        }
        if (assessment.isResolutionBreach()) {
            report.setResolutionBreaches(report.getResolutionBreaches() + 1);
            report.setEscalated(report.getEscalated() + 1);
            log.warn("Ticket {} breached its resolution target, escalated to {}", ticketId, updated.getAssignedTeam());
            metricsConfig.recordTransition(updated.getStatus().name());
            // The breach event covers the escalation too, so on-call is paged once
            emit(TicketEventType.RESOLUTION_BREACH, updated, now, report);
        }
        if (assessment.isWarning()) {
            report.setWarnings(report.getWarnings() + 1);
            log.info("Ticket {} is approaching its resolution deadline {}", ticketId, updated.getResolutionDueAt());
            emit(TicketEventType.SLA_WARNING, updated, now, report);
        }
    }

    private void emit(TicketEventType type, Ticket ticket, Instant now, SlaReport report) {
        metricsConfig.recordSlaEvent(type.name());
        lifecycleService.publish(type, ticket, now);
        report.getEvents().add(TicketEvent.builder()
                .type(type)
                .ticketId(ticket.getId())
                .occurredAt(now)
                .ticket(ticket.copy())
                .build());
    }
}
