package com.skillgate.agent.skills;

import java.util.Locale;

/**
 * Whether a skill may spawn sub-agent sessions. {@link #OPUS} and
 * {@link #ANY} permit delegation, {@link #NONE} forbids it.
 */
public enum SkillDelegation {
    OPUS, NONE, ANY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean permitsDelegation() {
        return this != NONE;
    }

    /** Unknown or blank input falls back to {@link #OPUS}. */
    public static SkillDelegation fromId(String raw) {
        if (raw == null)
            return OPUS;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "any" -> ANY;
            default -> OPUS;
        };
    }

    @Override
    public String toString() {
        return id();
    }
}
