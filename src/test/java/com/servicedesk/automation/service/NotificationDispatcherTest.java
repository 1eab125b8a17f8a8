package com.servicedesk.automation.service;

import com.servicedesk.automation.config.NotificationConfig;
import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.model.*;
import com.servicedesk.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.servicedesk.automation.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock private EmailNotificationService emailService;
    @Mock private TwilioNotificationService twilioService;

    private NotificationDispatcher dispatcher;
    private Ticket escalated;

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(new NotificationTemplates(new NotificationConfig()),
                emailService, twilioService);
        escalated = TestDataFactory.openTicket(7, TicketStatus.ESCALATED, Priority.HIGH,
                Category.INFRASTRUCTURE, T0, new SlaCalculator(new SlaConfig()));
    }

    @Test
    void escalation_emailsTeamAndPagesOnCall() {
        when(twilioService.isEnabled()).thenReturn(true);

        dispatcher.onTicketEvent(TestDataFactory.event(TicketEventType.TICKET_ESCALATED, escalated));

        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(emailService).send(captor.capture());
        assertThat(captor.getValue().getRecipient()).isEqualTo("infrastructure-team@example.com");
        assertThat(captor.getValue().getSubject()).startsWith("[ESCALATED] Ticket #7");
        verify(twilioService).page(eq(7L), contains("TICKET_ESCALATED"));
    }

    @Test
    void escalation_withPagingDisabledOnlyEmails() {
        when(twilioService.isEnabled()).thenReturn(false);

        dispatcher.onTicketEvent(TestDataFactory.event(TicketEventType.RESOLUTION_BREACH, escalated));

        verify(emailService).send(any());
        verify(twilioService, never()).page(anyLong(), anyString());
    }

    @Test
    void warning_isNotPaged() {
        dispatcher.onTicketEvent(TestDataFactory.event(TicketEventType.SLA_WARNING, escalated));

        verify(emailService).send(any());
        verifyNoMoreInteractions(twilioService);
    }

    @Test
    void assignment_sendsNothing() {
        dispatcher.onTicketEvent(TestDataFactory.event(TicketEventType.TICKET_ASSIGNED, escalated));

        verifyNoInteractions(emailService, twilioService);
    }

    @Test
    void deliveryFailureIsContained() {
        when(emailService.send(any())).thenThrow(new IllegalStateException("smtp down"));

        assertThatCode(() -> dispatcher.onTicketEvent(
                TestDataFactory.event(TicketEventType.TICKET_CREATED, escalated)))
                .doesNotThrowAnyException();
    }
}
