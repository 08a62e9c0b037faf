package com.skillgate.agent.session;

import com.skillgate.agent.skills.SkillTypes.SkillEntry;
import com.skillgate.agent.skills.SkillTypes.SkillSnapshot;
import com.skillgate.agent.tier.DelegationOverride;
import com.skillgate.agent.tier.UserTier;
import com.skillgate.agent.tools.policy.ToolPolicy;
import com.skillgate.agent.tools.policy.ToolPolicyMatcher;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool access for one session: who the user is, which skills are active, and
 * the single policy the tool dispatcher enforces.
 */
public final class SessionToolPolicy {

    private final UserTier userTier;
    @Getter
    private final SkillSnapshot skills;
    /** Per-skill policy layers in skill order; a null value means no restriction. */
    @Getter
    private final Map<String, ToolPolicy> skillPolicies;
    @Getter
    private final ToolPolicy policy;
    private final DelegationOverride delegationOverride;
    private final ToolPolicyMatcher matcher;

    SessionToolPolicy(UserTier userTier, SkillSnapshot skills, Map<String, ToolPolicy> skillPolicies,
            ToolPolicy policy, DelegationOverride delegationOverride, ToolPolicyMatcher matcher) {
        this.userTier = userTier;
        this.skills = skills;
        this.skillPolicies = Collections.unmodifiableMap(new LinkedHashMap<>(skillPolicies));
        this.policy = policy;
        this.delegationOverride = delegationOverride;
        this.matcher = matcher;
    }

    public Optional<UserTier> userTier() {
        return Optional.ofNullable(userTier);
    }

    public Optional<DelegationOverride> delegationOverride() {
        return Optional.ofNullable(delegationOverride);
    }

    public List<SkillEntry> eligibleSkills() {
        return skills.skills();
    }

    public boolean isToolAllowed(String toolName) {
        return matcher.isToolAllowed(toolName, policy);
    }

    /** Keep the tools from {@code toolNames} this session may call, in order. */
    public List<String> filterToolNames(Collection<String> toolNames) {
        return matcher.filterToolNames(toolNames, policy);
    }
}
