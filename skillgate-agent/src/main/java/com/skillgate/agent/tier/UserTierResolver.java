package com.skillgate.agent.tier;

import com.skillgate.common.config.SkillGateConfig;
import com.skillgate.common.delivery.DeliveryContext;
import com.skillgate.common.logging.SubsystemLogger;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a platform identity to a {@link UserTier}.
 *
 * <p>
 * The identity is {@code {channel}_{senderId}} (e.g.
 * {@code telegram_7338489031}), matched exactly against
 * {@code agents.defaults.users.admins}, then {@code trusted}. Sessions with
 * no sender (cron, heartbeat, API, agent-to-agent) have no tier and get no
 * tier restrictions.
 * </p>
 */
public final class UserTierResolver {

    private static final SubsystemLogger log = SubsystemLogger.create("skills").child("tier");

    static final String DEFAULT_DELEGATION_THINKING = "high";

    private UserTierResolver() {
    }

    public static Optional<UserTier> resolveUserTier(SkillGateConfig config, String channel, String senderId) {
        if (channel == null || channel.isBlank() || senderId == null || senderId.isBlank())
            return Optional.empty();
        String userId = channel + "_" + senderId;
        SkillGateConfig.UsersConfig users = config != null ? config.resolveUsers() : null;
        UserTier tier;
        if (users == null) {
            tier = UserTier.DEFAULT;
        } else if (contains(users.getAdmins(), userId)) {
            tier = UserTier.ADMIN;
        } else if (contains(users.getTrusted(), userId)) {
            tier = UserTier.TRUSTED;
        } else {
            tier = UserTier.DEFAULT;
        }
        log.debug("resolved user tier", Map.of("userId", userId, "tier", tier.id()));
        return Optional.of(tier);
    }

    public static Optional<UserTier> resolveUserTier(SkillGateConfig config, DeliveryContext context) {
        if (context == null)
            return Optional.empty();
        return resolveUserTier(config, context.channel(), context.senderId());
    }

    /**
     * Sub-agent override for a tier. Default-tier users delegate with high
     * thinking and, when configured, {@code users.defaultDelegationModel};
     * other tiers get none.
     */
    public static Optional<DelegationOverride> resolveDelegationOverride(UserTier tier, SkillGateConfig config) {
        if (tier != UserTier.DEFAULT)
            return Optional.empty();
        SkillGateConfig.UsersConfig users = config != null ? config.resolveUsers() : null;
        String model = users != null ? users.getDefaultDelegationModel() : null;
        String trimmed = model != null && !model.isBlank() ? model.trim() : null;
        return Optional.of(new DelegationOverride(trimmed, DEFAULT_DELEGATION_THINKING));
    }

    private static boolean contains(List<String> list, String userId) {
        return list != null && list.contains(userId);
    }
}
