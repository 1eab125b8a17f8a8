package com.servicedesk.automation.engine;

import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.SlaState;
import com.servicedesk.automation.model.SlaStatus;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.servicedesk.automation.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlaCalculatorTest {

    private SlaCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new SlaCalculator(new SlaConfig());
    }

    @Test
    void applyDeadlines_usesPriorityWindows() {
        Ticket ticket = Ticket.builder().priority(Priority.MEDIUM).build();

        calculator.applyDeadlines(ticket, T0);

        assertThat(ticket.getResponseDueAt()).isEqualTo(T0.plus(Duration.ofHours(4)));
        assertThat(ticket.getResolutionDueAt()).isEqualTo(T0.plus(Duration.ofHours(24)));
        // 80% of 24h
        assertThat(ticket.getSlaWarningAt()).isEqualTo(T0.plus(Duration.ofMinutes(1152)));
    }

    @Test
    void applyDeadlines_high() {
        Ticket ticket = Ticket.builder().priority(Priority.HIGH).build();

        calculator.applyDeadlines(ticket, T0);

        assertThat(ticket.getResponseDueAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(ticket.getResolutionDueAt()).isEqualTo(T0.plus(Duration.ofHours(4)));
    }

    @Test
    void tightenForEscalation_onlyMovesDeadlinesEarlier() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.LOW, Category.SOFTWARE, T0, calculator);
        Instant originalResponse = ticket.getResponseDueAt();

        Instant now = T0.plus(Duration.ofHours(30));
        calculator.tightenForEscalation(ticket, now);

        // LOW response (T0+24h) is already earlier than now+1h
        assertThat(ticket.getResponseDueAt()).isEqualTo(originalResponse);
        // LOW resolution (T0+72h) shrinks to now+4h
        assertThat(ticket.getResolutionDueAt()).isEqualTo(now.plus(Duration.ofHours(4)));
        assertThat(ticket.getSlaWarningAt()).isBefore(ticket.getResolutionDueAt());
    }

    @Test
    void assess_nothingDueYet() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);

        assertThat(calculator.assess(ticket, T0.plus(Duration.ofHours(1))).isEmpty()).isTrue();
    }

    @Test
    void assess_responseBreachOnlyForUnassignedTickets() {
        Ticket stranded = TestDataFactory.openTicket(1, TicketStatus.NEW, Priority.MEDIUM, Category.NETWORK, T0, calculator);
        Ticket assigned = TestDataFactory.openTicket(2, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);
        Instant now = T0.plus(Duration.ofHours(5));

        assertThat(calculator.assess(stranded, now).isResponseBreach()).isTrue();
        assertThat(calculator.assess(assigned, now).isEmpty()).isTrue();
    }

    @Test
    void assess_deadlineItselfIsNotABreach() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);

        SlaCalculator.Assessment atDeadline = calculator.assess(ticket, ticket.getResolutionDueAt());

        assertThat(atDeadline.isResolutionBreach()).isFalse();
        assertThat(calculator.assess(ticket, ticket.getResolutionDueAt().plusMillis(1)).isResolutionBreach()).isTrue();
    }

    @Test
    void assess_warningSuppressedByResolutionBreach() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);

        SlaCalculator.Assessment assessment = calculator.assess(ticket, T0.plus(Duration.ofHours(30)));

        assertThat(assessment.isResolutionBreach()).isTrue();
        assertThat(assessment.isWarning()).isFalse();
    }

    @Test
    void assess_flagsAlreadySetAreNotReported() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.NEW, Priority.MEDIUM, Category.NETWORK, T0, calculator);
        ticket.setResponseBreached(true);
        ticket.setSlaWarningSent(true);

        assertThat(calculator.assess(ticket, T0.plus(Duration.ofHours(20))).isEmpty()).isTrue();
    }

    @Test
    void assess_terminalTicketIsIgnored() {
        Ticket ticket = TestDataFactory.resolvedTicket(1, T0, T0.plus(Duration.ofHours(1)), calculator);

        assertThat(calculator.assess(ticket, T0.plus(Duration.ofDays(10)))).isSameAs(SlaCalculator.Assessment.NONE);
    }

    @Test
    void state_progressesWithTime() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);

        assertThat(calculator.state(ticket, T0.plus(Duration.ofHours(1)))).isEqualTo(SlaState.ON_TRACK);
        assertThat(calculator.state(ticket, T0.plus(Duration.ofHours(20)))).isEqualTo(SlaState.WARNING);
        assertThat(calculator.state(ticket, T0.plus(Duration.ofHours(25)))).isEqualTo(SlaState.BREACHED);
    }

    @Test
    void state_closedTicketIsMetUnlessFlagged() {
        Ticket ticket = TestDataFactory.resolvedTicket(1, T0, T0.plus(Duration.ofHours(1)), calculator);
        assertThat(calculator.state(ticket, T0.plus(Duration.ofDays(5)))).isEqualTo(SlaState.MET);

        ticket.setResolutionBreached(true);
        assertThat(calculator.state(ticket, T0.plus(Duration.ofDays(5)))).isEqualTo(SlaState.BREACHED);
    }

    @Test
    void status_reportsTimeToBreach() {
        Ticket ticket = TestDataFactory.openTicket(1, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);

        SlaStatus status = calculator.status(ticket, T0.plus(Duration.ofHours(23)));

        assertThat(status.getState()).isEqualTo(SlaState.WARNING);
        assertThat(status.isResponseOk()).isTrue();
        assertThat(status.isResolutionOk()).isTrue();
        assertThat(status.getMillisToBreach()).isEqualTo(Duration.ofHours(1).toMillis());
    }

    @Test
    void slaConfig_rejectsResponseNotShorterThanResolution() {
        SlaConfig config = TestDataFactory.slaConfig(Duration.ofHours(8), Duration.ofHours(8));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MEDIUM");
    }
}
