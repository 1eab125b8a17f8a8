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
@Schema(description = "Aggregate SLA compliance across all tickets")
public class SlaSummary {

    @Schema(example = "40")
    private int total;

    @Schema(description = "Open tickets inside their windows", example = "20")
    private int onTrack;

    @Schema(description = "Open tickets past the warning threshold", example = "3")
    private int warning;

    @Schema(description = "Tickets with a breached target, open or closed", example = "2")
    private int breached;

    @Schema(description = "Closed tickets that never breached", example = "15")
    private int met;

    @Schema(description = "Percentage of on-track and met tickets, one decimal", example = "87.5")
    private double complianceRate;
}
