package io.toolwatch.core;

import java.util.Locale;

/**
 * Notification delivery targets.
 */
public enum AlertChannel {
    CONSOLE("console"),
    EMAIL("email"),
    SLACK("slack"),
    WEBHOOK("webhook"),
    DATABASE("database");

    private final String code;

    AlertChannel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * True for channels that leave the process (everything but the persisted record).
     */
    public boolean isExternal() {
        return this != DATABASE;
    }

    public static AlertChannel fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AlertChannel c : values()) {
            if (c.code.equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown alert channel: " + code);
    }
}
