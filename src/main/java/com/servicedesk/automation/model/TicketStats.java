package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ticket counts and distributions")
public class TicketStats {

    @Schema(example = "40")
    private int total;

    @Schema(description = "Tickets not yet resolved", example = "12")
    private int open;

    private Map<TicketStatus, Long> byStatus;
    private Map<Priority, Long> byPriority;
    private Map<Category, Long> byCategory;
}
