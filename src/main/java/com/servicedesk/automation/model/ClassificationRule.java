package com.servicedesk.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ordered keyword/pattern rule mapping an email to a category and priority")
public class ClassificationRule {

    @Schema(description = "Rule identifier", example = "RULE-NETWORK")
    private String ruleId;

    @Schema(description = "Keywords matched case-insensitively on word boundaries",
            example = "[\"vpn\", \"cannot connect\", \"network\"]")
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Schema(description = "Optional regular expression, matched case-insensitively", example = "wi-?fi")
    private String pattern;

    @Schema(description = "Category assigned on match", example = "NETWORK")
    private Category category;

    @Schema(description = "Priority assigned on match", example = "MEDIUM")
    private Priority priority;
}
