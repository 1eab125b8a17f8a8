package com.servicedesk.automation.config;

import com.servicedesk.automation.model.Category;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "desk.routing")
public class RoutingConfig {

    private Map<Category, String> teams = defaultTeams();

    // Used for categories missing from the table
    private String defaultTeam = "helpdesk@example.com";

    public String teamFor(Category category) {
        String team = category != null ? teams.get(category) : null;
        return team != null && !team.isBlank() ? team : defaultTeam;
    }

    private static Map<Category, String> defaultTeams() {
        Map<Category, String> defaults = new EnumMap<>(Category.class);
        defaults.put(Category.ACCESS, "identity-team@example.com");
        defaults.put(Category.NETWORK, "network-team@example.com");
        defaults.put(Category.INFRASTRUCTURE, "infra-team@example.com");
        defaults.put(Category.EMAIL, "messaging-team@example.com");
        defaults.put(Category.SOFTWARE, "desktop-team@example.com");
        defaults.put(Category.HARDWARE, "desktop-team@example.com");
        defaults.put(Category.OTHER, "helpdesk@example.com");
        return defaults;
    }
}
