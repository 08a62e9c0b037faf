package com.skillgate.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type. Only the sections that feed tool and skill
 * permission resolution are modelled; unknown keys are ignored on load.
 */
@Data
public class SkillGateConfig {

    /** Agent defaults, including user trust lists. */
    private AgentsConfig agents;

    /** Site-wide tool policy (the base layer of every composed policy). */
    private ToolsConfig tools;

    /** Skills settings. */
    private SkillsConfig skills;

    @Data
    public static class AgentsConfig {
        private AgentDefaults defaults;
    }

    @Data
    public static class AgentDefaults {
        /** Platform user trust lists. */
        private UsersConfig users;
    }

    /**
     * Membership lists keyed by {@code {channel}_{senderId}}, e.g.
     * {@code telegram_7338489031}. Matching is exact and case-sensitive.
     */
    @Data
    public static class UsersConfig {
        private List<String> admins;
        private List<String> trusted;
        /** Model used for sub-agent delegation by default-tier users. */
        private String defaultDelegationModel;
    }

    @Data
    public static class ToolsConfig {
        /** minimal | coding | messaging | full */
        private String profile;
        private List<String> allow;
        private List<String> deny;
    }

    @Data
    public static class SkillsConfig {
        /** When set, only these skill names are eligible (empty = none). */
        private List<String> filter;
    }

    /**
     * Convenience accessor: {@code agents.defaults.users}, or null anywhere
     * along the path.
     */
    public UsersConfig resolveUsers() {
        if (agents == null || agents.getDefaults() == null) {
            return null;
        }
        return agents.getDefaults().getUsers();
    }
}
