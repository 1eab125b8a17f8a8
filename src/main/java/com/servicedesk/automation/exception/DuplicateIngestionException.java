package com.servicedesk.automation.exception;

import lombok.Getter;

/**
 * Message fingerprint already claimed by an earlier ingestion. Ingestion reports
 * this as a skip rather than an error.
 */
@Getter
public class DuplicateIngestionException extends ServiceDeskException {

    private static final String ERROR_CODE = "DUPLICATE_INGESTION";

    private final String fingerprint;
    // Null when the claim vanished before it could be read back
    private final Long existingTicketId;

    public DuplicateIngestionException(String fingerprint, Long existingTicketId) {
        super(String.format("Message %s already ingested as ticket %s", fingerprint, existingTicketId), ERROR_CODE);
        this.fingerprint = fingerprint;
        this.existingTicketId = existingTicketId;
    }
}
