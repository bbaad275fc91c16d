package io.toolwatch.core;

import java.util.Locale;

/**
 * Kind of difference detected between two analysis runs of a tool.
 */
public enum ChangeType {
    ADDED("added"),
    REMOVED("removed"),
    MODIFIED("modified"),
    VERSION_BUMP("version_bump"),
    PRICE_CHANGE("price_change");

    private final String code;

    ChangeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Human readable label, e.g. "Version Bump".
     */
    public String label() {
        String[] words = code.split("_");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }

    public static ChangeType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("change type must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ChangeType t : values()) {
            if (t.code.equals(normalized) || t.name().equalsIgnoreCase(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + code);
    }
}
