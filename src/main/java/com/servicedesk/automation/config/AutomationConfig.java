package com.servicedesk.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "desk.automation")
public class AutomationConfig {
    private boolean enabled = false;
    private int ingestionIntervalSeconds = 60;
    private int slaSweepIntervalSeconds = 300;
}
