package com.servicedesk.automation.source;

import com.servicedesk.automation.config.IngestionConfig;
import com.servicedesk.automation.exception.MessageSourceException;
import com.servicedesk.automation.model.RawMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a plain-text inbox: one message per line, {@code sender|subject|body},
 * optionally followed by {@code |receivedAt} as an ISO-8601 instant. The file is
 * read whole on every fetch and never modified.
 */
@Component
public class FileInboxMessageSource implements MessageSource {

    private static final Logger log = LoggerFactory.getLogger(FileInboxMessageSource.class);

    static final String UNKNOWN_SENDER = "unknown";

    private final IngestionConfig config;

    public FileInboxMessageSource(IngestionConfig config) {
        this.config = config;
    }

    @Override
    public List<RawMessage> fetch() {
        Path inbox = Paths.get(config.getInboxFile());
        if (!Files.exists(inbox)) {
            log.debug("Inbox file {} not found, nothing to ingest", inbox);
            return List.of();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(inbox, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MessageSourceException("Failed to read inbox file " + inbox, e);
        }

        List<RawMessage> messages = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) continue;
            messages.add(parseLine(line.strip()));
        }
        log.debug("Read {} messages from {}", messages.size(), inbox);
        return messages;
    }

    @Override
    public String describe() {
        return "file:" + config.getInboxFile();
    }

    static RawMessage parseLine(String line) {
        String[] parts = line.split("\\|", -1);

        String sender = parts[0].strip();
        String subject = parts.length > 1 ? parts[1].strip() : "";

        Instant receivedAt = null;
        int bodyEnd = parts.length;
        if (parts.length > 3) {
            receivedAt = parseInstant(parts[parts.length - 1].strip());
            if (receivedAt != null) {
                bodyEnd = parts.length - 1;
            }
        }
        // A body containing '|' is rejoined
        String body = parts.length > 2
                ? String.join("|", Arrays.copyOfRange(parts, 2, bodyEnd)).strip()
                : "";

        return RawMessage.builder()
                .sender(sender.isEmpty() ? UNKNOWN_SENDER : sender)
                .subject(subject)
                .body(body)
                .receivedAt(receivedAt)
                .build();
    }

    private static Instant parseInstant(String value) {
        if (value.isEmpty()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
