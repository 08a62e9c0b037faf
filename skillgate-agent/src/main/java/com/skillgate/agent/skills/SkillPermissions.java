package com.skillgate.agent.skills;

import java.util.List;
import java.util.Objects;

/**
 * Permissions a skill declares in its {@code ## Permissions} block.
 *
 * @param scope      ambient capability level
 * @param tools      explicit tool overrides, null when not declared
 * @param delegation sub-agent delegation policy
 * @param external   external system access
 */
public record SkillPermissions(
        SkillScope scope,
        SkillToolOverrides tools,
        SkillDelegation delegation,
        SkillExternalAccess external) {

    /** Permissions of a skill that declares none. */
    public static final SkillPermissions DEFAULT = new SkillPermissions(
            SkillScope.CONVERSATION_ONLY, null, SkillDelegation.OPUS, SkillExternalAccess.NONE);

    public SkillPermissions {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(delegation, "delegation");
        Objects.requireNonNull(external, "external");
    }

    public static SkillPermissions of(SkillScope scope, SkillDelegation delegation) {
        return new SkillPermissions(scope, null, delegation, SkillExternalAccess.NONE);
    }

    public SkillPermissions withTools(List<String> allow, List<String> deny) {
        SkillToolOverrides overrides = allow == null && deny == null ? null : new SkillToolOverrides(allow, deny);
        return new SkillPermissions(scope, overrides, delegation, external);
    }

    /** Explicit allow override, or null. */
    public List<String> toolsAllow() {
        return tools != null ? tools.allow() : null;
    }

    /** Explicit deny list, or null. */
    public List<String> toolsDeny() {
        return tools != null ? tools.deny() : null;
    }

    /**
     * Tool lists a skill declares under {@code tools:}. Either side may be
     * null.
     */
    public record SkillToolOverrides(List<String> allow, List<String> deny) {
        public SkillToolOverrides {
            allow = allow != null ? List.copyOf(allow) : null;
            deny = deny != null ? List.copyOf(deny) : null;
        }
    }
}
