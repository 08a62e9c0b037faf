package com.skillgate.agent.skills;

import java.util.Locale;

/**
 * Declared access to external systems. Informational for policy
 * resolution; carried through for auditing and prompts.
 */
public enum SkillExternalAccess {
    NONE, READ, FULL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or blank input falls back to {@link #NONE}. */
    public static SkillExternalAccess fromId(String raw) {
        if (raw == null)
            return NONE;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "read" -> READ;
            case "full" -> FULL;
            default -> NONE;
        };
    }

    @Override
    public String toString() {
        return id();
    }
}
