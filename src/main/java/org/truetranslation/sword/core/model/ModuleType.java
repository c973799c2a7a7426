package org.truetranslation.sword.core.model;

import java.util.Locale;

/**
 * Kind of content a module holds, derived from its {@code ModDrv} driver tag.
 */
public enum ModuleType {
    BIBLE("Bible"),
    COMMENTARY("Commentary"),
    DICTIONARY("Dictionary"),
    GENBOOK("GenBook"),
    UNKNOWN("Unknown");

    private final String displayName;

    ModuleType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    public static ModuleType fromDriver(String driver) {
        String lower = driver == null ? "" : driver.toLowerCase(Locale.ROOT);
        if (lower.startsWith("ztext") || lower.startsWith("rawtext")) {
            return BIBLE;
        }
        if (lower.startsWith("zcom") || lower.startsWith("rawcom")) {
            return COMMENTARY;
        }
        if (lower.startsWith("zld") || lower.startsWith("rawld")) {
            return DICTIONARY;
        }
        if (lower.contains("genbook")) {
            return GENBOOK;
        }
        return UNKNOWN;
    }

    /** Matches either the enum name or the display name, ignoring case. */
    public static ModuleType parse(String name) {
        for (ModuleType type : values()) {
            if (type.name().equalsIgnoreCase(name) || type.displayName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown module type: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
