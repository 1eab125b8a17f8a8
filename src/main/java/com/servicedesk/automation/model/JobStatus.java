package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Last-run state of a scheduled automation job")
public class JobStatus {

    @Schema(example = "email-ingestion")
    private String name;

    @Schema(description = "Fixed rate in seconds", example = "60")
    private int intervalSeconds;

    @Schema(description = "A run is in progress right now")
    private boolean running;

    private Instant lastStartedAt;
    private Instant lastFinishedAt;

    @Schema(description = "OK, FAILED or SOURCE_ERROR; null before the first run", example = "OK")
    private String lastOutcome;

    @Schema(description = "Short summary of the last run", example = "received=3 created=2 duplicates=1")
    private String lastSummary;

    private String lastError;

    @Schema(example = "12")
    private long runCount;
}
