package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Message skipped because it was already ingested")
public class DuplicateSkip {

    @Schema(description = "Fingerprint of the skipped message")
    private String fingerprint;

    @Schema(description = "Sender of the skipped message", example = "jane.doe@example.com")
    private String sender;

    @Schema(description = "Subject of the skipped message")
    private String subject;

    @Schema(description = "Ticket already raised for this message, null if unknown", example = "17", nullable = true)
    private Long existingTicketId;
}
