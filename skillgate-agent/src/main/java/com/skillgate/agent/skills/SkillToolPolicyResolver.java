package com.skillgate.agent.skills;

import com.skillgate.agent.tools.policy.ToolCatalog;
import com.skillgate.agent.tools.policy.ToolPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a skill's declared {@link SkillPermissions} into the tool policy
 * layer that skill contributes.
 *
 * <p>
 * Scope sets the ceiling of ambient tool access and delegation decides
 * whether {@code sessions_spawn} is available. {@code skill_memory_write} is
 * granted to every bounded skill regardless of delegation. Unbounded scopes
 * ({@code full}/{@code custom}) without an explicit allow list produce no
 * allow list at all: only their deny list, if any.
 * </p>
 */
public final class SkillToolPolicyResolver {

    public static final SkillToolPolicyResolver DEFAULT = new SkillToolPolicyResolver(SkillScopePolicyTable.DEFAULT);

    private final SkillScopePolicyTable scopeTable;

    public SkillToolPolicyResolver(SkillScopePolicyTable scopeTable) {
        this.scopeTable = Objects.requireNonNull(scopeTable, "scopeTable");
    }

    /**
     * @return the skill's policy layer, or null when the skill imposes no
     *         restriction
     */
    public ToolPolicy resolve(SkillPermissions permissions) {
        if (permissions == null)
            permissions = SkillPermissions.DEFAULT;

        List<String> override = permissions.toolsAllow();
        List<String> deny = permissions.toolsDeny();
        List<String> defaultGroups = scopeTable.defaultGroupsFor(permissions.scope());

        if (override == null && permissions.scope().isUnbounded()) {
            return deny != null ? ToolPolicy.denyOnly(deny) : null;
        }

        List<String> base = override != null ? override : defaultGroups;
        List<String> allow = new ArrayList<>(base != null ? base : List.of());
        if (permissions.delegation().permitsDelegation()) {
            allow.add(ToolCatalog.SESSIONS_SPAWN);
        }
        allow.add(ToolCatalog.SKILL_MEMORY_WRITE);
        return new ToolPolicy(allow, deny);
    }
}
