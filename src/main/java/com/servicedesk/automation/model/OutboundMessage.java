package com.servicedesk.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {
    private String recipient;
    private String subject;
    private String body;        // HTML
}
