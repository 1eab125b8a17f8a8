package com.servicedesk.automation.service;

import com.servicedesk.automation.config.ClassificationConfig;
import com.servicedesk.automation.config.IngestionConfig;
import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.config.RoutingConfig;
import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.engine.TicketClassifier;
import com.servicedesk.automation.exception.MessageSourceException;
import com.servicedesk.automation.model.IngestionResult;
import com.servicedesk.automation.model.RawMessage;
import com.servicedesk.automation.repository.InMemoryTicketStore;
import com.servicedesk.automation.source.FileInboxMessageSource;
import com.servicedesk.automation.source.MessageSource;
import com.servicedesk.automation.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.servicedesk.automation.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock private MessageSource messageSource;
    @Mock private TicketLifecycleService lifecycleService;
    @Mock private MetricsConfig metricsConfig;

    @TempDir Path tempDir;

    @Test
    void runIngestionCycle_passesFetchedMessagesToLifecycle() {
        List<RawMessage> messages = List.of(TestDataFactory.vpnMessage());
        IngestionResult expected = IngestionResult.builder().processedAt(T0).received(1).build();
        when(messageSource.fetch()).thenReturn(messages);
        when(lifecycleService.ingest(messages, T0)).thenReturn(expected);

        IngestionService service = new IngestionService(messageSource, lifecycleService, metricsConfig);

        assertThat(service.runIngestionCycle(T0)).isSameAs(expected);
    }

    @Test
    void runIngestionCycle_sourceFailureIsReportedNotThrown() {
        when(messageSource.fetch()).thenThrow(new MessageSourceException("inbox unreadable", new IOException("denied")));
        when(messageSource.describe()).thenReturn("file:data/emails.txt");

        IngestionService service = new IngestionService(messageSource, lifecycleService, metricsConfig);
        IngestionResult result = service.runIngestionCycle(T0);

        assertThat(result.getSourceError()).isEqualTo("inbox unreadable");
        assertThat(result.getReceived()).isZero();
        assertThat(result.getCreatedTicketIds()).isEmpty();
        verify(metricsConfig).recordSourceFailure();
        verifyNoInteractions(lifecycleService);
    }

    @Test
    void submitMessage_blankSenderBecomesUnknown() {
        IngestionService service = new IngestionService(messageSource, lifecycleService, metricsConfig);
        RawMessage message = TestDataFactory.rawMessage(" ", "Outlook crash", "Outlook closes on start");

        service.submitMessage(message, T0);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RawMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(lifecycleService).ingest(captor.capture(), eq(T0));
        assertThat(captor.getValue()).singleElement()
                .satisfies(m -> assertThat(m.getSender()).isEqualTo("unknown"));
    }

    @Test
    void submitMessage_requiresSubjectOrBody() {
        IngestionService service = new IngestionService(messageSource, lifecycleService, metricsConfig);

        assertThatThrownBy(() -> service.submitMessage(TestDataFactory.rawMessage("a@example.com", "", null), T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submitMessage(null, T0))
                .isInstanceOf(IllegalArgumentException.class);
        verify(lifecycleService, never()).ingest(any(), any());
    }

    @Test
    void runIngestionCycle_repeatedOverSameInboxCreatesTicketsOnce() throws IOException {
        Path inbox = tempDir.resolve("inbox.txt");
        Files.write(inbox, List.of(
                "raj.patel@example.com|VPN issue|The VPN keeps dropping",
                "jane.doe@example.com|Password reset|I forgot my password",
                "ops@example.com|Production server down|Payroll is unreachable"), StandardCharsets.UTF_8);

        IngestionConfig ingestionConfig = new IngestionConfig();
        ingestionConfig.setInboxFile(inbox.toString());
        MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
        InMemoryTicketStore store = new InMemoryTicketStore();
        TicketLifecycleService lifecycle = new TicketLifecycleService(store,
                new TicketClassifier(new ClassificationConfig(), metrics),
                new SlaCalculator(new SlaConfig()),
                new RoutingConfig(),
                mock(ApplicationEventPublisher.class),
                metrics,
                Clock.fixed(T0, ZoneOffset.UTC));
        IngestionService service = new IngestionService(
                new FileInboxMessageSource(ingestionConfig), lifecycle, metrics);

        IngestionResult first = service.runIngestionCycle(T0);
        IngestionResult second = service.runIngestionCycle(T0.plusSeconds(60));

        assertThat(first.getCreatedTicketIds()).hasSize(3);
        assertThat(second.getCreatedTicketIds()).isEmpty();
        assertThat(second.getDuplicates()).hasSize(3);
        assertThat(store.findAll()).hasSize(3);
    }
}
