package com.servicedesk.automation.engine;

import com.servicedesk.automation.model.RawMessage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Duplicate-detection key for a source message: SHA-256 of the provider message id
 * when there is one, otherwise of sender, subject, body and receive time.
 */
public final class MessageFingerprint {

    private MessageFingerprint() {}

    public static String of(RawMessage message) {
        String material;
        if (message.getMessageId() != null && !message.getMessageId().isBlank()) {
            material = "id\n" + message.getMessageId();
        } else {
            material = String.join("\n",
                    nullToEmpty(message.getSender()),
                    nullToEmpty(message.getSubject()),
                    nullToEmpty(message.getBody()),
                    message.getReceivedAt() != null ? String.valueOf(message.getReceivedAt().toEpochMilli()) : "");
        }
        return sha256(material);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
