package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one ingestion batch")
public class IngestionResult {

    @Schema(description = "Instant the batch was processed at")
    private Instant processedAt;

    @Schema(description = "Number of messages read from the source", example = "5")
    private int received;

    @Schema(description = "Ids of tickets created, in creation order")
    @Builder.Default
    private List<Long> createdTicketIds = new ArrayList<>();

    @Schema(description = "Messages skipped as already ingested")
    @Builder.Default
    private List<DuplicateSkip> duplicates = new ArrayList<>();

    @Schema(description = "Set when the ingestion source failed; no messages were processed")
    private String sourceError;

    @Schema(description = "True when processing stopped early because of shutdown")
    private boolean interrupted;
}
