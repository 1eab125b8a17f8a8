package com.servicedesk.automation.config;

import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.ClassificationRule;
import com.servicedesk.automation.model.Priority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered classification rules. Order matters: the first matching rule wins,
 * and a message matching nothing falls back to OTHER / LOW.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "desk.classification")
public class ClassificationConfig {

    private List<ClassificationRule> rules = defaultRules();

    private static List<ClassificationRule> defaultRules() {
        List<ClassificationRule> defaults = new ArrayList<>();
        defaults.add(rule("RULE-ACCESS", Category.ACCESS, Priority.LOW,
                "password", "reset", "unlock", "locked out"));
        defaults.add(rule("RULE-NETWORK", Category.NETWORK, Priority.MEDIUM,
                "vpn", "cannot connect", "connect", "network", "wifi"));
        defaults.add(rule("RULE-INFRA", Category.INFRASTRUCTURE, Priority.HIGH,
                "server down", "down", "outage", "unreachable"));
        defaults.add(rule("RULE-EMAIL", Category.EMAIL, Priority.MEDIUM,
                "email", "outlook", "send", "receive", "mailbox"));
        defaults.add(rule("RULE-SOFTWARE", Category.SOFTWARE, Priority.LOW,
                "install", "software", "upgrade", "license"));
        defaults.add(rule("RULE-HARDWARE", Category.HARDWARE, Priority.MEDIUM,
                "laptop", "monitor", "printer", "keyboard", "hardware"));
        return defaults;
    }

    private static ClassificationRule rule(String ruleId, Category category, Priority priority, String... keywords) {
        return ClassificationRule.builder()
                .ruleId(ruleId)
                .keywords(new ArrayList<>(List.of(keywords)))
                .category(category)
                .priority(priority)
                .build();
    }
}
