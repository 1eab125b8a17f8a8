package com.servicedesk.automation.service;

import com.servicedesk.automation.config.AutomationConfig;
import com.servicedesk.automation.model.AutomationStatus;
import com.servicedesk.automation.model.IngestionResult;
import com.servicedesk.automation.model.JobStatus;
import com.servicedesk.automation.model.SlaReport;
import com.servicedesk.automation.source.MessageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Timer-driven ingestion and SLA sweeps. Supplies {@code now} from the clock and
 * never lets two runs of the same job overlap.
 */
@Service
public class AutomationScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutomationScheduler.class);

    static final String INGESTION_JOB = "email-ingestion";
    static final String SLA_JOB = "sla-sweep";

    private final IngestionService ingestionService;
    private final SlaMonitorService slaMonitorService;
    private final MessageSource messageSource;
    private final AutomationConfig config;
    private final Clock clock;

    private final Job ingestionJob;
    private final Job slaJob;

    public AutomationScheduler(IngestionService ingestionService,
                               SlaMonitorService slaMonitorService,
                               MessageSource messageSource,
                               AutomationConfig config,
                               Clock clock) {
        this.ingestionService = ingestionService;
        this.slaMonitorService = slaMonitorService;
        this.messageSource = messageSource;
        this.config = config;
        this.clock = clock;
        this.ingestionJob = new Job(INGESTION_JOB, config.getIngestionIntervalSeconds());
        this.slaJob = new Job(SLA_JOB, config.getSlaSweepIntervalSeconds());
        log.info("Automation {}: ingestion every {}s, SLA sweep every {}s",
                config.isEnabled() ? "enabled" : "disabled (set desk.automation.enabled=true)",
                config.getIngestionIntervalSeconds(), config.getSlaSweepIntervalSeconds());
    }

    @Scheduled(fixedRateString = "${desk.automation.ingestion-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "5")
    public void scheduledIngestion() {
        if (!config.isEnabled()) {
            return;
        }
        runIngestion();
    }

    @Scheduled(fixedRateString = "${desk.automation.sla-sweep-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void scheduledSlaSweep() {
        if (!config.isEnabled()) {
            return;
        }
        runSlaSweep();
    }

    /**
     * @return the result, or null when a run was already in progress
     */
    public IngestionResult runIngestion() {
        return ingestionJob.run(
                () -> ingestionService.runIngestionCycle(clock.instant()),
                r -> r.getSourceError() != null ? "SOURCE_ERROR" : "OK",
                r -> String.format("received=%d created=%d duplicates=%d%s",
                        r.getReceived(), r.getCreatedTicketIds().size(), r.getDuplicates().size(),
                        r.isInterrupted() ? " interrupted" : ""));
    }

    /**
     * @return the report, or null when a sweep was already in progress
     */
    public SlaReport runSlaSweep() {
        return slaJob.run(
                () -> slaMonitorService.sweep(clock.instant()),
                r -> r.getFailed() > 0 ? "PARTIAL" : "OK",
                r -> String.format("scanned=%d updated=%d breaches=%d warnings=%d failed=%d%s",
                        r.getScanned(), r.getUpdated(), r.getResponseBreaches() + r.getResolutionBreaches(),
                        r.getWarnings(), r.getFailed(), r.isInterrupted() ? " interrupted" : ""));
    }

    public AutomationStatus status() {
        return AutomationStatus.builder()
                .enabled(config.isEnabled())
                .source(messageSource.describe())
                .jobs(List.of(ingestionJob.snapshot(), slaJob.snapshot()))
                .build();
    }

    private class Job {

        private final AtomicBoolean running = new AtomicBoolean(false);
        private final AtomicReference<JobStatus> last;

        Job(String name, int intervalSeconds) {
            this.last = new AtomicReference<>(JobStatus.builder()
                    .name(name)
                    .intervalSeconds(intervalSeconds)
                    .build());
        }

        <T> T run(Supplier<T> work, Function<T, String> outcome, Function<T, String> summary) {
            String name = last.get().getName();
            if (!running.compareAndSet(false, true)) {
                log.warn("Job {} still running, skipping this run", name);
                return null;
            }
            Instant started = clock.instant();
            try {
                T result = work.get();
                record(started, outcome.apply(result), summary.apply(result), null);
                return result;
            } catch (RuntimeException e) {
                log.error("Job {} failed: {}", name, e.getMessage(), e);
                record(started, "FAILED", null, e.getMessage());
                throw e;
            } finally {
                running.set(false);
            }
        }

        JobStatus snapshot() {
            return last.get().toBuilder().running(running.get()).build();
        }

        private void record(Instant started, String outcome, String summary, String error) {
            last.updateAndGet(prev -> prev.toBuilder()
                    .lastStartedAt(started)
                    .lastFinishedAt(clock.instant())
                    .lastOutcome(outcome)
                    .lastSummary(summary)
                    .lastError(error)
                    .runCount(prev.getRunCount() + 1)
                    .build());
        }
    }
}
