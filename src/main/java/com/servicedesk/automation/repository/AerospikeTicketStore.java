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
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.IndexType;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.aerospike.client.task.IndexTask;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicedesk.automation.config.AerospikeConfig;
import com.servicedesk.automation.engine.TicketInvariants;
import com.servicedesk.automation.exception.ConcurrentUpdateException;
import com.servicedesk.automation.exception.DuplicateIngestionException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketHistoryEntry;
import com.servicedesk.automation.model.TicketStatus;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Tickets as flat Aerospike records, one per id. Updates are compare-and-swap on the
 * record generation; fingerprints live in their own set and are claimed with CREATE_ONLY.
 */
@Repository
@ConditionalOnProperty(name = "desk.store.type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeTicketStore implements TicketStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeTicketStore.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private static final String SEQUENCE_KEY = "ticketId";
    private static final String BIN_SEQ = "seq";
    private static final String BIN_TICKET_ID = "ticketId";
    private static final String BIN_STATUS = "status";
    private static final String BIN_SLA_CHECK_AT = "slaCheckAt";

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AerospikeTicketStore(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultReadPolicy") Policy readPolicy,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @PostConstruct
    public void ensureIndexes() {
        createIndex("idx_ticket_status", BIN_STATUS, IndexType.STRING);
        createIndex("idx_ticket_sla_check", BIN_SLA_CHECK_AT, IndexType.NUMERIC);
    }

    @Override
    public Ticket create(Ticket ticket) {
        TicketInvariants.checkNew(ticket);

        Ticket stored = ticket.copy();
        stored.setId(nextId());

        // The claim names the reserved id, so the ticket record is the last write
        String fingerprint = stored.getFingerprint();
        Key fingerprintKey = fingerprint != null
                ? new Key(namespace, AerospikeConfig.SET_FINGERPRINTS, fingerprint) : null;
        if (fingerprintKey != null) {
            claimFingerprint(fingerprintKey, fingerprint, stored.getId());
        }

        try {
            client.put(policy(RecordExistsAction.CREATE_ONLY), ticketKey(stored.getId()), toBins(stored));
        } catch (AerospikeException e) {
            if (fingerprintKey != null) {
                releaseClaim(fingerprintKey, e);
            }
            throw e;
        }
        log.debug("Stored ticket {} ({})", stored.getId(), stored.getStatus());
        return stored;
    }

    @Override
    public Ticket findById(long id) {
        Record record = client.get(readPolicy, ticketKey(id));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public Ticket update(long id, TicketMutation mutation) {
        Key key = ticketKey(id);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                throw new TicketNotFoundException(id);
            }
            Ticket current = mapRecord(record);
            Ticket candidate = mutation.apply(current.copy());
            if (candidate == null || candidate.equals(current)) {
                return current;
            }
            TicketInvariants.checkUpdate(current, candidate);

            WritePolicy cas = policy(RecordExistsAction.REPLACE_ONLY);
            cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            cas.generation = record.generation;
            try {
                client.put(cas, key, toBins(candidate));
                return candidate;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) {
                    throw e;
                }
                log.debug("Ticket {} changed under update (attempt {}), retrying", id, attempt);
            }
        }
        throw new ConcurrentUpdateException(id, MAX_CAS_ATTEMPTS);
    }

    @Override
    public List<Ticket> listByStatus(TicketStatus status) {
        Statement stmt = statement();
        stmt.setFilter(Filter.equal(BIN_STATUS, status.name()));
        return query(stmt);
    }

    @Override
    public List<Ticket> listDueBefore(Instant instant) {
        Statement stmt = statement();
        stmt.setFilter(Filter.range(BIN_SLA_CHECK_AT, 0L, instant.toEpochMilli()));
        List<Ticket> due = query(stmt);
        due.removeIf(Ticket::isTerminal);
        return due;
    }

    @Override
    public List<Ticket> findAll() {
        List<Ticket> tickets = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TICKETS,
                (key, record) -> {
                    try {
                        Ticket ticket = mapRecord(record);
                        synchronized (tickets) {
                            tickets.add(ticket);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize ticket record: {}", e.getMessage());
                    }
                });
        tickets.sort(Comparator.comparingLong(Ticket::getId));
        return tickets;
    }

    // --- internals ---

    private void claimFingerprint(Key fingerprintKey, String fingerprint, long ticketId) {
        try {
            client.put(policy(RecordExistsAction.CREATE_ONLY), fingerprintKey, new Bin(BIN_TICKET_ID, ticketId));
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                throw e;
            }
            Record existing = client.get(readPolicy, fingerprintKey);
            Long existingId = existing != null ? existing.getLong(BIN_TICKET_ID) : null;
            throw new DuplicateIngestionException(fingerprint, existingId);
        }
    }

    private void releaseClaim(Key fingerprintKey, AerospikeException cause) {
        try {
            client.delete(writePolicy, fingerprintKey);
        } catch (AerospikeException e) {
            log.error("Failed to release fingerprint claim {}", fingerprintKey.userKey, e);
            cause.addSuppressed(e);
        }
    }

    private long nextId() {
        Key key = new Key(namespace, AerospikeConfig.SET_SEQUENCES, SEQUENCE_KEY);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin(BIN_SEQ, 1)),
                Operation.get(BIN_SEQ));
        return record.getLong(BIN_SEQ);
    }

    private void createIndex(String indexName, String bin, IndexType type) {
        try {
            IndexTask task = client.createIndex(null, namespace, AerospikeConfig.SET_TICKETS, indexName, bin, type);
            if (task != null) {
                task.waitTillComplete();
            }
            log.info("Secondary index {} ready on {}.{}", indexName, AerospikeConfig.SET_TICKETS, bin);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.INDEX_ALREADY_EXISTS) {
                throw e;
            }
            log.debug("Secondary index {} already exists", indexName);
        }
    }

    private Statement statement() {
        Statement stmt = new Statement();
        stmt.setNamespace(namespace);
        stmt.setSetName(AerospikeConfig.SET_TICKETS);
        return stmt;
    }

    private List<Ticket> query(Statement stmt) {
        List<Ticket> results = new ArrayList<>();
        try (RecordSet rs = client.query(new QueryPolicy(), stmt)) {
            while (rs.next()) {
                try {
                    results.add(mapRecord(rs.getRecord()));
                } catch (Exception e) {
                    log.warn("Failed to deserialize ticket record: {}", e.getMessage());
                }
            }
        }
        results.sort(Comparator.comparingLong(Ticket::getId));
        return results;
    }

    private WritePolicy policy(RecordExistsAction action) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = action;
        return policy;
    }

    private Key ticketKey(long id) {
        return new Key(namespace, AerospikeConfig.SET_TICKETS, id);
    }

    // Bin names stay within Aerospike's 15 character limit
    private Bin[] toBins(Ticket t) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", t.getId()),
                new Bin("category", t.getCategory().name()),
                new Bin("priority", t.getPriority().name()),
                new Bin(BIN_STATUS, t.getStatus().name()),
                new Bin("respBreached", t.isResponseBreached()),
                new Bin("resBreached", t.isResolutionBreached()),
                new Bin("warnSent", t.isSlaWarningSent()),
                new Bin("history", serializeHistory(t.getHistory()))));

        addString(bins, "fingerprint", t.getFingerprint());
        addString(bins, "sender", t.getSender());
        addString(bins, "subject", t.getSubject());
        addString(bins, "body", t.getBody());
        addString(bins, "team", t.getAssignedTeam());
        addString(bins, "resNote", t.getResolutionNote());
        addString(bins, "resolvedBy", t.getResolvedBy());

        addInstant(bins, "receivedAt", t.getReceivedAt());
        addInstant(bins, "createdAt", t.getCreatedAt());
        addInstant(bins, "assignedAt", t.getAssignedAt());
        addInstant(bins, "escalatedAt", t.getEscalatedAt());
        addInstant(bins, "respDueAt", t.getResponseDueAt());
        addInstant(bins, "resDueAt", t.getResolutionDueAt());
        addInstant(bins, "warnAt", t.getSlaWarningAt());
        addInstant(bins, "resolvedAt", t.getResolvedAt());
        addInstant(bins, "updatedAt", t.getUpdatedAt());
        // Absent once nothing is pending, which drops the ticket out of the SLA index
        addInstant(bins, BIN_SLA_CHECK_AT, t.nextSlaCheckAt());

        return bins.toArray(new Bin[0]);
    }

    private Ticket mapRecord(Record record) {
        return Ticket.builder()
                .id(record.getLong("id"))
                .fingerprint(record.getString("fingerprint"))
                .sender(record.getString("sender"))
                .subject(record.getString("subject"))
                .body(record.getString("body"))
                .receivedAt(instant(record, "receivedAt"))
                .category(Category.valueOf(record.getString("category")))
                .priority(Priority.valueOf(record.getString("priority")))
                .status(TicketStatus.valueOf(record.getString(BIN_STATUS)))
                .assignedTeam(record.getString("team"))
                .createdAt(instant(record, "createdAt"))
                .assignedAt(instant(record, "assignedAt"))
                .escalatedAt(instant(record, "escalatedAt"))
                .responseDueAt(instant(record, "respDueAt"))
                .resolutionDueAt(instant(record, "resDueAt"))
                .slaWarningAt(instant(record, "warnAt"))
                .resolvedAt(instant(record, "resolvedAt"))
                .resolutionNote(record.getString("resNote"))
                .resolvedBy(record.getString("resolvedBy"))
                .responseBreached(record.getBoolean("respBreached"))
                .resolutionBreached(record.getBoolean("resBreached"))
                .slaWarningSent(record.getBoolean("warnSent"))
                .updatedAt(instant(record, "updatedAt"))
                .history(deserializeHistory(record.getString("history")))
                .build();
    }

    private static void addString(List<Bin> bins, String name, String value) {
        if (value != null) {
            bins.add(new Bin(name, value));
        }
    }

    private static void addInstant(List<Bin> bins, String name, Instant value) {
        if (value != null) {
            bins.add(new Bin(name, value.toEpochMilli()));
        }
    }

    private static Instant instant(Record record, String bin) {
        Object value = record.getValue(bin);
        if (value == null) return null;
        return Instant.ofEpochMilli(((Number) value).longValue());
    }

    private String serializeHistory(List<TicketHistoryEntry> history) {
        try {
            return objectMapper.writeValueAsString(history != null ? history : Collections.emptyList());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize ticket history", e);
        }
    }

    private List<TicketHistoryEntry> deserializeHistory(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<TicketHistoryEntry>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize ticket history", e);
            return new ArrayList<>();
        }
    }
}
