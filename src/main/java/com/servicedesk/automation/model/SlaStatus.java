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
@Schema(description = "SLA standing of a single ticket at a point in time")
public class SlaStatus {

    @Schema(description = "Overall state", example = "ON_TRACK")
    private SlaState state;

    @Schema(description = "Response target met or still achievable")
    private boolean responseOk;

    @Schema(description = "Resolution target met or still achievable")
    private boolean resolutionOk;

    @Schema(description = "Milliseconds until the resolution deadline; negative once overdue, null for closed tickets")
    private Long millisToBreach;

    private Instant responseDueAt;
    private Instant resolutionDueAt;
}
