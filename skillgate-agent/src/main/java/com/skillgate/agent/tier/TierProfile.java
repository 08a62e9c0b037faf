package com.skillgate.agent.tier;

import com.skillgate.agent.skills.SkillScope;
import com.skillgate.agent.tools.policy.ToolPolicy;

/**
 * What a tier may do.
 *
 * @param ceiling       highest skill scope the tier may activate; null is
 *                      unbounded
 * @param defaultPolicy tool policy layer for the tier; null is no restriction
 */
public record TierProfile(SkillScope ceiling, ToolPolicy defaultPolicy) {

    public static final TierProfile UNRESTRICTED = new TierProfile(null, null);
}
