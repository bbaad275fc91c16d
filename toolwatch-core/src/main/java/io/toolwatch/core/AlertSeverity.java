package io.toolwatch.core;

import java.util.Locale;

/**
 * Ordered alert severity. Declaration order is significance order: {@code INFO < LOW < MEDIUM < HIGH < CRITICAL}.
 */
public enum AlertSeverity {
    INFO("info"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAtLeast(AlertSeverity threshold) {
        return compareTo(threshold) >= 0;
    }

    public static AlertSeverity max(AlertSeverity a, AlertSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static AlertSeverity fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("severity must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AlertSeverity s : values()) {
            if (s.code.equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
