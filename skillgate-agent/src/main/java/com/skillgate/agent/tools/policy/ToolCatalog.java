package com.skillgate.agent.tools.policy;

import java.util.*;

/**
 * Static table of canonical tool names, aliases and named groups.
 *
 * <p>
 * Group members are tool references and may name other groups. The catalog
 * does not check for cycles; {@link ToolReferenceResolver} tolerates them.
 * Instances are immutable. Tests and embedders can build alternate catalogs
 * instead of relying on {@link #DEFAULT}.
 * </p>
 */
public final class ToolCatalog {

    public static final String GROUP_PREFIX = "group:";

    public static final String SESSIONS_SPAWN = "sessions_spawn";
    public static final String SKILL_MEMORY_WRITE = "skill_memory_write";

    private static final Map<String, String> DEFAULT_ALIASES = Map.of(
            "bash", "exec",
            "apply-patch", "apply_patch");

    private static final Map<String, List<String>> DEFAULT_GROUPS;
    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("group:memory", List.of("memory_search", "memory_get"));
        m.put("group:web", List.of("web_search", "web_fetch"));
        m.put("group:fs", List.of("read", "write", "edit", "apply_patch"));
        m.put("group:runtime", List.of("exec", "process"));
        m.put("group:sessions",
                List.of("sessions_list", "sessions_history", "sessions_send", "sessions_spawn", "session_status"));
        m.put("group:ui", List.of("browser", "canvas"));
        m.put("group:automation", List.of("cron", "gateway"));
        m.put("group:messaging", List.of("message"));
        m.put("group:nodes", List.of("nodes"));
        m.put("group:skillgate", List.of(
                "group:ui", "group:nodes", "group:automation", "group:messaging",
                "agents_list", "group:sessions", "group:memory", "group:web", "image"));
        DEFAULT_GROUPS = Collections.unmodifiableMap(m);
    }

    private static final Set<String> DEFAULT_EXTRA_TOOLS = Set.of(
            "image", "tts", "agents_list", "whatsapp_login", SKILL_MEMORY_WRITE);

    public static final ToolCatalog DEFAULT = new ToolCatalog(DEFAULT_ALIASES, DEFAULT_GROUPS, DEFAULT_EXTRA_TOOLS);

    private final Map<String, String> aliases;
    private final Map<String, List<String>> groups;
    private final Set<String> toolNames;

    /**
     * @param aliases    alias to canonical name, keys in lower case
     * @param groups     group reference ({@code group:<name>}) to member references
     * @param extraTools canonical names that belong to no group
     */
    public ToolCatalog(Map<String, String> aliases, Map<String, List<String>> groups, Set<String> extraTools) {
        Map<String, String> a = new LinkedHashMap<>();
        aliases.forEach((k, v) -> a.put(k.trim().toLowerCase(Locale.ROOT), v));
        this.aliases = Collections.unmodifiableMap(a);

        Map<String, List<String>> g = new LinkedHashMap<>();
        groups.forEach((k, v) -> g.put(k.trim().toLowerCase(Locale.ROOT), List.copyOf(v)));
        this.groups = Collections.unmodifiableMap(g);

        Set<String> names = new LinkedHashSet<>(extraTools);
        for (List<String> members : this.groups.values()) {
            for (String member : members) {
                if (!member.startsWith(GROUP_PREFIX))
                    names.add(member);
            }
        }
        names.addAll(this.aliases.values());
        this.toolNames = Collections.unmodifiableSet(names);
    }

    public static boolean isGroupReference(String reference) {
        return reference != null && reference.startsWith(GROUP_PREFIX);
    }

    /** Canonical target of an alias, or null. Key must already be lower case. */
    public String aliasTarget(String normalized) {
        return aliases.get(normalized);
    }

    /** Members of a group, or null when the group is unknown. */
    public List<String> groupMembers(String groupReference) {
        return groups.get(groupReference);
    }

    public boolean isKnownTool(String name) {
        return toolNames.contains(name);
    }

    public Set<String> toolNames() {
        return toolNames;
    }

    public Set<String> groupNames() {
        return groups.keySet();
    }
}
