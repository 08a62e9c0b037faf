package com.skillgate.agent.skills;

import java.util.Locale;

/**
 * A skill's self-declared ambient capability level, ordered from least to
 * most privileged. {@link #FULL} and {@link #CUSTOM} share the top rank;
 * {@code custom} means the skill supplies its own tool list.
 */
public enum SkillScope {
    CONVERSATION_ONLY("conversation-only", 0),
    READ_ONLY("read-only", 1),
    WORKSPACE("workspace", 2),
    READ_WRITE("read-write", 3),
    FULL("full", 4),
    CUSTOM("custom", 4);

    private final String id;
    private final int rank;

    SkillScope(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    public String id() {
        return id;
    }

    /** Position in the ceiling ordering. */
    public int rank() {
        return rank;
    }

    /** Scopes with no scope-derived allow ceiling. */
    public boolean isUnbounded() {
        return this == FULL || this == CUSTOM;
    }

    public boolean isAtMost(SkillScope other) {
        return rank <= other.rank;
    }

    /**
     * Parse a scope id case-insensitively; unknown or blank input falls back to
     * {@link #CONVERSATION_ONLY}.
     */
    public static SkillScope fromId(String raw) {
        if (raw == null)
            return CONVERSATION_ONLY;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SkillScope scope : values()) {
            if (scope.id.equals(normalized))
                return scope;
        }
        return CONVERSATION_ONLY;
    }

    @Override
    public String toString() {
        return id;
    }
}
