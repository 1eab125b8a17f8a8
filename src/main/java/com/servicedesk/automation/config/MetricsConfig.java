package com.servicedesk.automation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger openBreachedTickets;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.openBreachedTickets = registry.gauge("sla.breached.open.tickets", new AtomicInteger(0));
    }

    public void recordTicketCreated(String category, String priority) {
        Counter.builder("ticket.created.count")
                .tag("category", category)
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    public void recordTransition(String toStatus) {
        Counter.builder("ticket.transition.count")
                .tag("to_status", toStatus)
                .register(registry)
                .increment();
    }

    public void recordDuplicateSkipped() {
        Counter.builder("ingestion.duplicate.count")
                .register(registry)
                .increment();
    }

    public void recordClassificationFallback() {
        Counter.builder("classification.fallback.count")
                .register(registry)
                .increment();
    }

    public void recordSourceFailure() {
        Counter.builder("ingestion.source.failure.count")
                .register(registry)
                .increment();
    }

    public void recordSlaEvent(String eventType) {
        Counter.builder("sla.event.count")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordSweep(Duration elapsed, int failed) {
        Timer.builder("sla.sweep.duration")
                .register(registry)
                .record(elapsed);
        if (failed > 0) {
            Counter.builder("sla.sweep.ticket.failure.count")
                    .register(registry)
                    .increment(failed);
        }
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateOpenBreachedTickets(int count) {
        openBreachedTickets.set(count);
    }
}
