package com.servicedesk.automation.engine;

import com.servicedesk.automation.config.ClassificationConfig;
import com.servicedesk.automation.config.MetricsConfig;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.Classification;
import com.servicedesk.automation.model.ClassificationRule;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.RawMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps a raw email to a category and priority using the ordered rule table.
 * The first matching rule wins; no match falls back to OTHER / LOW.
 * Total: never throws for any message, including one with missing fields.
 */
@Component
public class TicketClassifier {

    private static final Logger log = LoggerFactory.getLogger(TicketClassifier.class);

    public static final Category FALLBACK_CATEGORY = Category.OTHER;
    public static final Priority FALLBACK_PRIORITY = Priority.LOW;

    private final List<CompiledRule> rules;
    private final MetricsConfig metricsConfig;

    public TicketClassifier(ClassificationConfig config, MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
        this.rules = new ArrayList<>();

        for (ClassificationRule rule : config.getRules()) {
            rules.add(compile(rule));
            log.info("Registered classification rule: {} -> {}/{}",
                    rule.getRuleId(), rule.getCategory(), rule.getPriority());
        }
    }

    public Classification classify(RawMessage message) {
        String text = message != null ? message.classificationText().toLowerCase(Locale.ROOT) : "";

        for (CompiledRule rule : rules) {
            if (rule.matches(text)) {
                return Classification.builder()
                        .category(rule.category)
                        .priority(rule.priority)
                        .matchedRuleId(rule.ruleId)
                        .fallback(false)
                        .build();
            }
        }

        log.info("No classification rule matched message from {} (subject '{}'); using {}/{}",
                message != null ? message.getSender() : null,
                message != null ? message.getSubject() : null,
                FALLBACK_CATEGORY, FALLBACK_PRIORITY);
        if (metricsConfig != null) {
            metricsConfig.recordClassificationFallback();
        }

        return Classification.builder()
                .category(FALLBACK_CATEGORY)
                .priority(FALLBACK_PRIORITY)
                .fallback(true)
                .build();
    }

    private static CompiledRule compile(ClassificationRule rule) {
        if (rule.getCategory() == null || rule.getPriority() == null) {
            throw new IllegalStateException("Classification rule " + rule.getRuleId()
                    + " must define category and priority");
        }

        List<Pattern> patterns = new ArrayList<>();
        if (rule.getKeywords() != null) {
            for (String keyword : rule.getKeywords()) {
                if (keyword == null || keyword.isBlank()) continue;
                String quoted = Pattern.quote(keyword.trim().toLowerCase(Locale.ROOT));
                patterns.add(Pattern.compile("\\b" + quoted + "\\b"));
            }
        }
        if (rule.getPattern() != null && !rule.getPattern().isBlank()) {
            try {
                patterns.add(Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Invalid pattern in classification rule " + rule.getRuleId(), e);
            }
        }
        if (patterns.isEmpty()) {
            throw new IllegalStateException("Classification rule " + rule.getRuleId()
                    + " needs at least one keyword or a pattern");
        }

        return new CompiledRule(rule.getRuleId(), patterns, rule.getCategory(), rule.getPriority());
    }

    private static final class CompiledRule {
        private final String ruleId;
        private final List<Pattern> patterns;
        private final Category category;
        private final Priority priority;

        private CompiledRule(String ruleId, List<Pattern> patterns, Category category, Priority priority) {
            this.ruleId = ruleId;
            this.patterns = patterns;
            this.category = category;
            this.priority = priority;
        }

        private boolean matches(String text) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).find()) {
                    return true;
                }
            }
            return false;
        }
    }
}
