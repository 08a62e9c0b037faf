package com.skillgate.agent.tools.policy;

import java.util.*;

/**
 * Named tool profiles used as the site-wide base layer ({@code tools.profile}
 * in config).
 */
public final class ToolProfiles {

    private ToolProfiles() {
    }

    public enum ToolProfileId {
        MINIMAL, CODING, MESSAGING, FULL;

        public static Optional<ToolProfileId> fromId(String raw) {
            if (raw == null || raw.isBlank())
                return Optional.empty();
            try {
                return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    private static final Map<ToolProfileId, ToolPolicy> PROFILES;
    static {
        Map<ToolProfileId, ToolPolicy> m = new EnumMap<>(ToolProfileId.class);
        m.put(ToolProfileId.MINIMAL, ToolPolicy.allowOnly(List.of("session_status")));
        m.put(ToolProfileId.CODING, ToolPolicy.allowOnly(
                List.of("group:fs", "group:runtime", "group:sessions", "group:memory", "image")));
        m.put(ToolProfileId.MESSAGING, ToolPolicy.allowOnly(
                List.of("group:messaging", "sessions_list", "sessions_history", "sessions_send", "session_status")));
        m.put(ToolProfileId.FULL, ToolPolicy.EMPTY);
        PROFILES = Collections.unmodifiableMap(m);
    }

    /**
     * Policy for a profile id, or null for {@code full}, blank and unknown ids
     * (no restriction).
     */
    public static ToolPolicy resolve(String profile) {
        return ToolProfileId.fromId(profile)
                .map(PROFILES::get)
                .filter(p -> !p.isUnrestricted())
                .orElse(null);
    }
}
