package com.skillgate.agent.session;

import com.skillgate.agent.skills.SkillEligibility;
import com.skillgate.agent.skills.SkillPermissionLogger;
import com.skillgate.agent.skills.SkillPermissionLogger.SkillExclusionEntry;
import com.skillgate.agent.skills.SkillToolPolicyResolver;
import com.skillgate.agent.skills.SkillTypes.SkillEligibilityContext;
import com.skillgate.agent.skills.SkillTypes.SkillEntry;
import com.skillgate.agent.skills.SkillTypes.SkillSnapshot;
import com.skillgate.agent.tier.TierPolicyTable;
import com.skillgate.agent.tier.UserTier;
import com.skillgate.agent.tier.UserTierResolver;
import com.skillgate.agent.tools.policy.ToolPolicy;
import com.skillgate.agent.tools.policy.ToolPolicyComposer;
import com.skillgate.agent.tools.policy.ToolPolicyMatcher;
import com.skillgate.agent.tools.policy.ToolProfiles;
import com.skillgate.common.config.SkillGateConfig;
import com.skillgate.common.delivery.DeliveryContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.*;

/**
 * Builds a session's {@link SessionToolPolicy}.
 *
 * <ol>
 * <li>resolve the user tier from the delivery context</li>
 * <li>drop skills above the tier's scope ceiling, then apply
 * {@code skills.filter}</li>
 * <li>compose the base layer (profile plus {@code tools.allow/deny}), the tier
 * policy and each remaining skill's policy</li>
 * </ol>
 */
@Slf4j
public class SessionToolPolicyResolver {

    private final TierPolicyTable tierTable;
    private final SkillEligibility eligibility;
    private final SkillToolPolicyResolver skillPolicies;
    private final ToolPolicyComposer composer;
    private final ToolPolicyMatcher matcher;

    public SessionToolPolicyResolver() {
        this(TierPolicyTable.DEFAULT, SkillToolPolicyResolver.DEFAULT,
                ToolPolicyComposer.DEFAULT, ToolPolicyMatcher.DEFAULT);
    }

    public SessionToolPolicyResolver(TierPolicyTable tierTable, SkillToolPolicyResolver skillPolicies,
            ToolPolicyComposer composer, ToolPolicyMatcher matcher) {
        this.tierTable = tierTable;
        this.eligibility = new SkillEligibility(tierTable);
        this.skillPolicies = skillPolicies;
        this.composer = composer;
        this.matcher = matcher;
    }

    public SessionToolPolicy resolve(SkillGateConfig config, List<SkillEntry> entries,
            DeliveryContext deliveryContext) {
        UserTier tier = UserTierResolver
                .resolveUserTier(config, DeliveryContext.normalize(deliveryContext))
                .orElse(null);

        List<String> skillFilter = config != null && config.getSkills() != null
                ? config.getSkills().getFilter()
                : null;
        List<SkillEntry> eligible = eligibility.filter(entries, new SkillEligibilityContext(tier), skillFilter);
        SkillSnapshot snapshot = eligibility.snapshot(eligible);

        List<ToolPolicy> layers = new ArrayList<>();
        layers.add(baseLayer(config));
        if (tier != null)
            layers.add(tierTable.defaultPolicy(tier));

        Map<String, ToolPolicy> perSkill = new LinkedHashMap<>();
        for (SkillEntry entry : eligible) {
            ToolPolicy skillPolicy = skillPolicies.resolve(entry.permissions());
            perSkill.put(entry.name(), skillPolicy);
            layers.add(skillPolicy);
        }

        ToolPolicy composed = composer.compose(layers);
        log.debug("Session tool policy: tier={}, skills={}, allow={}, deny={}",
                tier != null ? tier.id() : "(none)", snapshot.names(), composed.allow(), composed.deny());

        return new SessionToolPolicy(tier, snapshot, perSkill, composed,
                tier != null ? UserTierResolver.resolveDelegationOverride(tier, config).orElse(null) : null,
                matcher);
    }

    /**
     * Profile policy composed with the config's {@code tools.allow} and
     * {@code tools.deny}. Empty config lists count as unset.
     */
    ToolPolicy baseLayer(SkillGateConfig config) {
        SkillGateConfig.ToolsConfig tools = config != null ? config.getTools() : null;
        if (tools == null)
            return null;
        ToolPolicy profile = ToolProfiles.resolve(tools.getProfile());
        List<String> allow = nonEmpty(tools.getAllow());
        List<String> deny = nonEmpty(tools.getDeny());
        ToolPolicy configured = allow == null && deny == null ? null : new ToolPolicy(allow, deny);
        if (profile == null)
            return configured;
        if (configured == null)
            return profile;
        return composer.compose(profile, configured);
    }

    /**
     * Report, per active skill, the {@code availableTools} its own policy
     * removes. Returns the reported entries.
     *
     * @param bypassed enforcement is off for this session; exclusions are
     *                 logged but never written to learnings
     */
    public List<SkillExclusionEntry> auditExclusions(SessionToolPolicy session, Collection<String> availableTools,
            SkillPermissionLogger logger, boolean bypassed) {
        List<SkillExclusionEntry> excluded = new ArrayList<>();
        for (SkillEntry entry : session.eligibleSkills()) {
            ToolPolicy skillPolicy = session.getSkillPolicies().get(entry.name());
            if (skillPolicy == null)
                continue;
            String baseDir = entry.skill().baseDir();
            Path skillBaseDir = baseDir != null && !baseDir.isBlank() ? Path.of(baseDir) : null;
            Set<String> kept = new HashSet<>(matcher.filterToolNames(availableTools, skillPolicy));
            for (String tool : availableTools) {
                if (!kept.contains(tool)) {
                    excluded.add(new SkillExclusionEntry(entry.name(), skillBaseDir,
                            tool, entry.effectivePermissions().scope(), bypassed));
                }
            }
        }
        logger.logExclusions(excluded);
        return excluded;
    }

    private static List<String> nonEmpty(List<String> list) {
        return list == null || list.isEmpty() ? null : list;
    }
}
