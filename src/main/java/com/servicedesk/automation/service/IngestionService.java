package com.servicedesk.automation.service;

import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.exception.MessageSourceException;
import com.servicedesk.automation.model.IngestionResult;
import com.servicedesk.automation.model.RawMessage;
import com.servicedesk.automation.source.MessageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final MessageSource messageSource;
    private final TicketLifecycleService lifecycleService;
    private final MetricsConfig metricsConfig;

    public IngestionService(MessageSource messageSource,
                            TicketLifecycleService lifecycleService,
                            MetricsConfig metricsConfig) {
        this.messageSource = messageSource;
        this.lifecycleService = lifecycleService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Fetch whatever the source has and ingest it. Safe to repeat: messages seen in an
     * earlier cycle are skipped as duplicates. A failing source yields an empty result
     * carrying the error instead of an exception.
     */
    public IngestionResult runIngestionCycle(Instant now) {
        List<RawMessage> messages;
        try {
            messages = messageSource.fetch();
        } catch (MessageSourceException e) {
            metricsConfig.recordSourceFailure();
            log.error("Ingestion source {} failed: {}", messageSource.describe(), e.getMessage(), e);
            return IngestionResult.builder()
                    .processedAt(now)
                    .sourceError(e.getMessage())
                    .build();
        }

        if (messages.isEmpty()) {
            log.debug("No messages from {}", messageSource.describe());
        }
        return lifecycleService.ingest(messages, now);
    }

    /**
     * Ingest a single message submitted through the API.
     */
    public IngestionResult submitMessage(RawMessage message, Instant now) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        boolean noSubject = message.getSubject() == null || message.getSubject().isBlank();
        boolean noBody = message.getBody() == null || message.getBody().isBlank();
        if (noSubject && noBody) {
            throw new IllegalArgumentException("Message needs a subject or a body");
        }
        if (message.getSender() == null || message.getSender().isBlank()) {
            message.setSender("unknown");
        }
        return lifecycleService.ingest(List.of(message), now);
    }
}
