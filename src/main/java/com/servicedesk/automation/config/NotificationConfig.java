package com.servicedesk.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "desk.notification")
public class NotificationConfig {
    private boolean emailEnabled = false;
    private String fromAddress = "servicedesk@example.com";
    private String deskName = "IT Service Desk";

    // Team-facing alerts for tickets that have no team yet
    private String fallbackRecipient = "helpdesk@example.com";
}
