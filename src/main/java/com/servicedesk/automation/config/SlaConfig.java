package com.servicedesk.automation.config;

import com.servicedesk.automation.model.Priority;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * SLA policy: response and resolution windows per priority. Static for the life
 * of the process.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "desk.sla")
public class SlaConfig {

    private Map<Priority, Window> windows = defaultWindows();

    // Percentage of the resolution window after which an open ticket is "approaching breach"
    private double warningThresholdPct = 80.0;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private Duration response;
        private Duration resolution;
    }

    public Window windowFor(Priority priority) {
        Window window = windows.get(priority);
        if (window == null) {
            throw new IllegalStateException("No SLA window configured for priority " + priority);
        }
        return window;
    }

    @PostConstruct
    public void validate() {
        for (Priority priority : Priority.values()) {
            Window window = windowFor(priority);
            if (window.getResponse() == null || window.getResolution() == null) {
                throw new IllegalStateException("SLA window for " + priority + " must define response and resolution");
            }
            if (window.getResponse().isNegative() || window.getResponse().isZero()) {
                throw new IllegalStateException("SLA response window for " + priority + " must be positive");
            }
            if (window.getResponse().compareTo(window.getResolution()) >= 0) {
                throw new IllegalStateException("SLA response window for " + priority
                        + " must be shorter than its resolution window");
            }
        }
        if (warningThresholdPct <= 0 || warningThresholdPct >= 100) {
            throw new IllegalStateException("desk.sla.warning-threshold-pct must be in (0, 100)");
        }
    }

    private static Map<Priority, Window> defaultWindows() {
        Map<Priority, Window> defaults = new EnumMap<>(Priority.class);
        defaults.put(Priority.HIGH, new Window(Duration.ofHours(1), Duration.ofHours(4)));
        defaults.put(Priority.MEDIUM, new Window(Duration.ofHours(4), Duration.ofHours(24)));
        defaults.put(Priority.LOW, new Window(Duration.ofHours(24), Duration.ofHours(72)));
        return defaults;
    }
}
