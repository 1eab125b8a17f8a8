package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Support email as delivered by an ingestion source")
public class RawMessage {

    @Schema(description = "Provider message id, when the source has one", example = "AAMkAGI2TG93AAA=")
    private String messageId;

    @Schema(description = "Sender address", example = "jane.doe@example.com")
    private String sender;

    @Schema(description = "Subject line", example = "VPN cannot connect from home")
    private String subject;

    @Schema(description = "Plain-text body", example = "Since this morning the VPN client times out.")
    private String body;

    @Schema(description = "When the mailbox received the message", example = "2025-03-04T09:15:00Z")
    private Instant receivedAt;

    /**
     * Subject and body joined, the text classification rules run against.
     */
    public String classificationText() {
        String s = subject != null ? subject : "";
        String b = body != null ? body : "";
        return s + "\n" + b;
    }
}
