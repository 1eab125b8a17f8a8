package com.servicedesk.automation.engine;

import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.exception.TerminalStateException;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.servicedesk.automation.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicketInvariantsTest {

    private final SlaCalculator calculator = new SlaCalculator(new SlaConfig());

    private Ticket assigned() {
        return TestDataFactory.openTicket(3, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);
    }

    @Test
    void ordinaryResolutionPasses() {
        Ticket current = assigned();
        Ticket next = current.copy();
        next.setStatus(TicketStatus.RESOLVED);
        next.setResolvedAt(T0.plus(Duration.ofHours(2)));

        assertThatCode(() -> TicketInvariants.checkUpdate(current, next)).doesNotThrowAnyException();
    }

    @Test
    void terminalTicketIsFrozen() {
        Ticket current = TestDataFactory.resolvedTicket(3, T0, T0.plusSeconds(60), calculator);
        Ticket next = current.copy();
        next.setResolutionNote("rewritten");

        assertThatThrownBy(() -> TicketInvariants.checkUpdate(current, next))
                .isInstanceOf(TerminalStateException.class);
    }

    @Test
    void breachFlagsCannotBeCleared() {
        Ticket current = assigned();
        current.setResolutionBreached(true);
        Ticket next = current.copy();
        next.setResolutionBreached(false);

        assertThatThrownBy(() -> TicketInvariants.checkUpdate(current, next))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("breach");
    }

    @Test
    void priorityCannotBeLowered() {
        Ticket current = assigned();
        Ticket next = current.copy();
        next.setPriority(Priority.LOW);

        assertThatThrownBy(() -> TicketInvariants.checkUpdate(current, next))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deadlinesCannotBeExtended() {
        Ticket current = assigned();
        Ticket next = current.copy();
        next.setResolutionDueAt(current.getResolutionDueAt().plusSeconds(1));

        assertThatThrownBy(() -> TicketInvariants.checkUpdate(current, next))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void categoryIsImmutable() {
        Ticket current = assigned();
        Ticket next = current.copy();
        next.setCategory(Category.EMAIL);

        assertThatThrownBy(() -> TicketInvariants.checkUpdate(current, next))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("category");
    }

    @Test
    void resolvedAtRequiresTerminalStatus() {
        Ticket ticket = assigned();
        ticket.setResolvedAt(T0);

        assertThatThrownBy(() -> TicketInvariants.checkNew(ticket))
                .isInstanceOf(IllegalStateException.class);
    }
}
