package com.skillgate.agent.tier;

import com.skillgate.agent.skills.SkillScope;
import com.skillgate.agent.tools.policy.ToolPolicy;

import java.util.*;

/**
 * Per-tier scope ceilings and default tool policies, plus the ceiling gate
 * that decides whether a skill is eligible for a tier at all.
 */
public final class TierPolicyTable {

    public static final TierPolicyTable DEFAULT;
    static {
        Map<UserTier, TierProfile> m = new EnumMap<>(UserTier.class);
        m.put(UserTier.ADMIN, TierProfile.UNRESTRICTED);
        m.put(UserTier.TRUSTED, new TierProfile(SkillScope.READ_WRITE, ToolPolicy.allowOnly(List.of(
                "group:fs", "group:memory", "group:web", "image", "sessions_spawn", "skill_memory_write"))));
        // no memory, runtime or system tools
        m.put(UserTier.DEFAULT, new TierProfile(SkillScope.WORKSPACE, ToolPolicy.allowOnly(List.of(
                "group:fs", "group:web", "image", "sessions_spawn", "skill_memory_write"))));
        DEFAULT = new TierPolicyTable(m);
    }

    private final Map<UserTier, TierProfile> profiles;

    /**
     * @param profiles tier to profile; tiers missing from the map are
     *                 unrestricted
     */
    public TierPolicyTable(Map<UserTier, TierProfile> profiles) {
        Map<UserTier, TierProfile> copy = new EnumMap<>(UserTier.class);
        copy.putAll(profiles);
        this.profiles = Collections.unmodifiableMap(copy);
    }

    public TierProfile profile(UserTier tier) {
        return profiles.getOrDefault(tier, TierProfile.UNRESTRICTED);
    }

    /** Scope ceiling for {@code tier}; null means unbounded. */
    public SkillScope ceiling(UserTier tier) {
        return profile(tier).ceiling();
    }

    /** Tool policy layer for {@code tier}; null means no restriction. */
    public ToolPolicy defaultPolicy(UserTier tier) {
        return profile(tier).defaultPolicy();
    }

    /**
     * Ceiling gate: a null ceiling admits every scope, otherwise the scope
     * must rank at or below the ceiling ({@code custom} ranks with
     * {@code full}).
     */
    public static boolean admits(SkillScope scope, SkillScope ceiling) {
        if (ceiling == null)
            return true;
        return scope.isAtMost(ceiling);
    }

    public boolean admits(SkillScope scope, UserTier tier) {
        return admits(scope, ceiling(tier));
    }
}
