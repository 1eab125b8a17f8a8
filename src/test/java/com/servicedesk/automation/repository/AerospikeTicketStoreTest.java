package com.servicedesk.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.IndexType;
import com.servicedesk.automation.config.AerospikeConfig;
import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.exception.ConcurrentUpdateException;
import com.servicedesk.automation.exception.DuplicateIngestionException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketHistoryEntry;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.servicedesk.automation.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

// Puts to the fingerprint and ticket keys share one stubbed method
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AerospikeTicketStoreTest {

    private static final String NS = "test";

    @Mock private AerospikeClient client;

    private final SlaCalculator calculator = new SlaCalculator(new SlaConfig());
    private AerospikeTicketStore store;

    @BeforeEach
    void setUp() {
        store = new AerospikeTicketStore(client, NS, new Policy(), new WritePolicy());
    }

    private Ticket newTicket() {
        Ticket ticket = TestDataFactory.openTicket(0, TicketStatus.ASSIGNED, Priority.MEDIUM, Category.NETWORK, T0, calculator);
        ticket.setFingerprint("fp-vpn");
        ticket.addHistory(TicketHistoryEntry.builder()
                .at(T0).toStatus(TicketStatus.NEW).actor("SYSTEM").detail("Classified NETWORK/MEDIUM").build());
        return ticket;
    }

    private Key fingerprintKey() {
        return new Key(NS, AerospikeConfig.SET_FINGERPRINTS, "fp-vpn");
    }

    private Key ticketKey(long id) {
        return new Key(NS, AerospikeConfig.SET_TICKETS, id);
    }

    private void stubSequence(long next) {
        when(client.operate(any(WritePolicy.class), any(Key.class), any(Operation[].class)))
                .thenReturn(new Record(Map.of("seq", next), 1, 0));
    }

    private static Record toRecord(Bin[] bins, int generation) {
        Map<String, Object> map = new HashMap<>();
        for (Bin bin : bins) {
            map.put(bin.name, bin.value.getObject());
        }
        return new Record(map, generation, 0);
    }

    /** Creates a ticket and returns the bins written for it. */
    private Bin[] createAndCaptureBins(long id) {
        stubSequence(id);
        store.create(newTicket());
        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), eq(ticketKey(id)), bins.capture());
        return bins.getValue();
    }

    @Test
    void create_claimsFingerprintWithReservedIdThenWritesTicket() {
        stubSequence(42);

        Ticket stored = store.create(newTicket());

        assertThat(stored.getId()).isEqualTo(42);
        ArgumentCaptor<Bin[]> claim = ArgumentCaptor.forClass(Bin[].class);
        verify(client, times(1)).put(any(WritePolicy.class), eq(fingerprintKey()), claim.capture());
        assertThat(claim.getValue()[0].value.toLong()).isEqualTo(42L);

        ArgumentCaptor<WritePolicy> policies = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policies.capture(), eq(ticketKey(42)), any(Bin[].class));
        assertThat(policies.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);

        InOrder order = inOrder(client);
        order.verify(client).put(any(WritePolicy.class), eq(fingerprintKey()), any(Bin[].class));
        order.verify(client).put(any(WritePolicy.class), eq(ticketKey(42)), any(Bin[].class));
    }

    @Test
    void create_claimedFingerprintIsADuplicate() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), eq(fingerprintKey()), any(Bin[].class));
        stubSequence(8);
        when(client.get(any(Policy.class), eq(fingerprintKey())))
                .thenReturn(new Record(Map.of("ticketId", 7L), 1, 0));

        assertThatThrownBy(() -> store.create(newTicket()))
                .isInstanceOfSatisfying(DuplicateIngestionException.class,
                        e -> assertThat(e.getExistingTicketId()).isEqualTo(7L));
        verify(client, never()).put(any(WritePolicy.class), eq(ticketKey(8)), any(Bin[].class));
    }

    @Test
    void create_vanishedClaimReportsUnknownExistingTicket() {
        stubSequence(8);
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), eq(fingerprintKey()), any(Bin[].class));
        when(client.get(any(Policy.class), eq(fingerprintKey()))).thenReturn(null);

        assertThatThrownBy(() -> store.create(newTicket()))
                .isInstanceOfSatisfying(DuplicateIngestionException.class,
                        e -> assertThat(e.getExistingTicketId()).isNull());
    }

    @Test
    void create_failedTicketWriteReleasesClaim() {
        stubSequence(5);
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), eq(ticketKey(5)), any(Bin[].class));

        assertThatThrownBy(() -> store.create(newTicket())).isInstanceOf(AerospikeException.class);
        verify(client).delete(any(WritePolicy.class), eq(fingerprintKey()));
    }

    @Test
    void create_failedClaimWriteLeavesNoTicketBehind() {
        stubSequence(5);
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), eq(fingerprintKey()), any(Bin[].class));

        assertThatThrownBy(() -> store.create(newTicket()))
                .isInstanceOfSatisfying(AerospikeException.class,
                        e -> assertThat(e.getResultCode()).isEqualTo(ResultCode.TIMEOUT));
        verify(client, never()).put(any(WritePolicy.class), eq(ticketKey(5)), any(Bin[].class));
        verify(client, never()).delete(any(WritePolicy.class), any(Key.class));
    }

    @Test
    void findById_mapsStoredBinsBack() {
        Bin[] bins = createAndCaptureBins(9);
        when(client.get(any(Policy.class), eq(ticketKey(9)))).thenReturn(toRecord(bins, 1));

        Ticket found = store.findById(9);

        assertThat(found.getId()).isEqualTo(9);
        assertThat(found.getStatus()).isEqualTo(TicketStatus.ASSIGNED);
        assertThat(found.getCategory()).isEqualTo(Category.NETWORK);
        assertThat(found.getResolutionDueAt()).isEqualTo(T0.plusSeconds(24 * 3600));
        assertThat(found.getResolvedAt()).isNull();
        assertThat(found.isResolutionBreached()).isFalse();
        assertThat(found.getHistory()).hasSize(1);
        assertThat(found.getHistory().get(0).getActor()).isEqualTo("SYSTEM");
    }

    @Test
    void findById_missingRecordIsNull() {
        assertThat(store.findById(1)).isNull();
    }

    @Test
    void update_writesWithGenerationCheck() {
        Bin[] bins = createAndCaptureBins(3);
        when(client.get(any(Policy.class), eq(ticketKey(3)))).thenReturn(toRecord(bins, 4));

        Ticket updated = store.update(3, t -> {
            t.setSlaWarningSent(true);
            return t;
        });

        assertThat(updated.isSlaWarningSent()).isTrue();
        ArgumentCaptor<WritePolicy> policies = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client, times(2)).put(policies.capture(), eq(ticketKey(3)), any(Bin[].class));
        WritePolicy cas = policies.getAllValues().get(1);
        assertThat(cas.generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(cas.generation).isEqualTo(4);
        assertThat(cas.recordExistsAction).isEqualTo(RecordExistsAction.REPLACE_ONLY);
    }

    @Test
    void update_retriesWhenGenerationMoved() {
        Bin[] bins = createAndCaptureBins(3);
        when(client.get(any(Policy.class), eq(ticketKey(3))))
                .thenReturn(toRecord(bins, 4), toRecord(bins, 5));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .doNothing()
                .when(client).put(argThat(p -> p != null && p.generation == 4), eq(ticketKey(3)), any(Bin[].class));

        store.update(3, t -> {
            t.setSlaWarningSent(true);
            return t;
        });

        verify(client, times(2)).get(any(Policy.class), eq(ticketKey(3)));
        verify(client).put(argThat(p -> p != null && p.generation == 5), eq(ticketKey(3)), any(Bin[].class));
    }

    @Test
    void update_givesUpAfterRepeatedConflicts() {
        Bin[] bins = createAndCaptureBins(3);
        when(client.get(any(Policy.class), eq(ticketKey(3)))).thenReturn(toRecord(bins, 4));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(argThat(p -> p != null && p.generation == 4), eq(ticketKey(3)), any(Bin[].class));

        assertThatThrownBy(() -> store.update(3, t -> {
            t.setSlaWarningSent(true);
            return t;
        })).isInstanceOf(ConcurrentUpdateException.class);
        verify(client, times(AerospikeTicketStore.MAX_CAS_ATTEMPTS)).get(any(Policy.class), eq(ticketKey(3)));
    }

    @Test
    void update_noChangeSkipsWrite() {
        Bin[] bins = createAndCaptureBins(3);
        when(client.get(any(Policy.class), eq(ticketKey(3)))).thenReturn(toRecord(bins, 4));

        store.update(3, t -> t);

        // Only the original create
        verify(client, times(1)).put(any(WritePolicy.class), eq(ticketKey(3)), any(Bin[].class));
    }

    @Test
    void update_missingTicketThrows() {
        assertThatThrownBy(() -> store.update(77, t -> t)).isInstanceOf(TicketNotFoundException.class);
    }

    @Test
    void ensureIndexes_toleratesExistingIndexes() {
        when(client.createIndex(any(), anyString(), anyString(), anyString(), anyString(), any(IndexType.class)))
                .thenThrow(new AerospikeException(ResultCode.INDEX_ALREADY_EXISTS));

        assertThatCode(() -> store.ensureIndexes()).doesNotThrowAnyException();
    }

    @Test
    void slaCheckBinDroppedOnceNothingIsPending() {
        Ticket resolved = TestDataFactory.resolvedTicket(0, T0, T0.plusSeconds(60), calculator);
        stubSequence(11);

        store.create(resolved);

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), eq(ticketKey(11)), bins.capture());
        assertThat(List.of(bins.getValue())).extracting(b -> b.name).doesNotContain("slaCheckAt");
    }
}
