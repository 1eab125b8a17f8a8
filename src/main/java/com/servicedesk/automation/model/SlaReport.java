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
@Schema(description = "Outcome of one SLA sweep")
public class SlaReport {

    @Schema(description = "Evaluation instant the sweep ran against")
    private Instant sweptAt;

    @Schema(description = "Tickets with a due SLA checkpoint", example = "12")
    private int scanned;

    @Schema(description = "Tickets whose SLA flags changed", example = "3")
    private int updated;

    @Schema(description = "Response breaches newly flagged", example = "1")
    private int responseBreaches;

    @Schema(description = "Resolution breaches newly flagged", example = "1")
    private int resolutionBreaches;

    @Schema(description = "Tickets escalated because of a resolution breach", example = "1")
    private int escalated;

    @Schema(description = "Approaching-breach warnings newly sent", example = "1")
    private int warnings;

    @Schema(description = "Tickets that failed evaluation", example = "0")
    private int failed;

    @Schema(description = "Ids of tickets that failed evaluation")
    @Builder.Default
    private List<Long> failedTicketIds = new ArrayList<>();

    @Schema(description = "Events emitted by this sweep")
    @Builder.Default
    private List<TicketEvent> events = new ArrayList<>();

    @Schema(description = "True when the sweep stopped early because of shutdown")
    private boolean interrupted;
}
