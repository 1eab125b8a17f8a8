package com.servicedesk.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Classification {
    private Category category;
    private Priority priority;
    private String matchedRuleId;       // null on fallback
    private boolean fallback;
}
