package com.skillgate.agent.skills;

import java.util.*;

/**
 * Default tool group references granted by each {@link SkillScope}.
 * {@code full} and {@code custom} have no entry: no scope-derived ceiling.
 */
public final class SkillScopePolicyTable {

    public static final SkillScopePolicyTable DEFAULT;
    static {
        Map<SkillScope, List<String>> m = new EnumMap<>(SkillScope.class);
        m.put(SkillScope.CONVERSATION_ONLY, List.of());
        m.put(SkillScope.READ_ONLY, List.of("group:memory", "group:web"));
        m.put(SkillScope.WORKSPACE, List.of("group:fs", "group:web", "image"));
        m.put(SkillScope.READ_WRITE, List.of("group:fs", "group:memory", "group:web", "image"));
        DEFAULT = new SkillScopePolicyTable(m);
    }

    private final Map<SkillScope, List<String>> defaults;

    /**
     * @param defaults scope to default references; a bounded scope absent
     *                 from the map grants no default references
     */
    public SkillScopePolicyTable(Map<SkillScope, List<String>> defaults) {
        Map<SkillScope, List<String>> copy = new EnumMap<>(SkillScope.class);
        defaults.forEach((scope, refs) -> {
            if (refs != null)
                copy.put(scope, List.copyOf(refs));
        });
        this.defaults = Collections.unmodifiableMap(copy);
    }

    /**
     * Default references for {@code scope}, or null when the table has no
     * entry for it.
     */
    public List<String> defaultGroupsFor(SkillScope scope) {
        return defaults.get(scope);
    }
}
