package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Background automation state")
public class AutomationStatus {

    @Schema(description = "Scheduled jobs run only when enabled (desk.automation.enabled)")
    private boolean enabled;

    @Schema(description = "Ingestion source in use", example = "file:data/emails.txt")
    private String source;

    private List<JobStatus> jobs;
}
