package org.javai.shuuten;

import java.util.Locale;
import java.util.Optional;

/**
 * Payload layout used for Slack notifications.
 */
public enum SlackFormat {
    /**
     * Block Kit layout with header, fields and code blocks.
     */
    BLOCKS,

    /**
     * A single mrkdwn text message.
     */
    PLAIN;

    public static Optional<SlackFormat> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "blocks" -> Optional.of(BLOCKS);
            case "plain", "text" -> Optional.of(PLAIN);
            default -> Optional.empty();
        };
    }
}
