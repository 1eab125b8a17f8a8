package com.servicedesk.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "desk.ingestion")
public class IngestionConfig {

    // One message per line: sender|subject|body[|receivedAt]
    private String inboxFile = "data/emails.txt";
}
