package com.skillgate.agent.skills;

import com.skillgate.agent.tier.UserTier;

import java.util.List;
import java.util.Map;

/**
 * Skill values handed over by the skill loader.
 */
public final class SkillTypes {

        private SkillTypes() {
        }

        // =========================================================================
        // Core Skill record
        // =========================================================================

        /**
         * A loaded skill definition.
         *
         * @param name        skill name (directory name)
         * @param description short description (from frontmatter)
         * @param filePath    absolute path to the SKILL.md file
         * @param baseDir     directory containing the skill
         */
        public record Skill(
                        String name,
                        String description,
                        String filePath,
                        String baseDir) {
        }

        // =========================================================================
        // Invocation policy
        // =========================================================================

        /**
         * Controls how/whether a skill can be invoked.
         *
         * @param userInvocable          whether users can invoke this skill directly
         * @param disableModelInvocation whether the model should NOT auto-invoke this
         *                               skill
         */
        public record SkillInvocationPolicy(
                        boolean userInvocable,
                        boolean disableModelInvocation) {

                public static final SkillInvocationPolicy DEFAULT = new SkillInvocationPolicy(true, false);

                /**
                 * Read {@code user-invocable} and {@code disable-model-invocation}
                 * from parsed frontmatter.
                 */
                public static SkillInvocationPolicy fromFrontmatter(Map<String, String> frontmatter) {
                        if (frontmatter == null)
                                return DEFAULT;
                        return new SkillInvocationPolicy(
                                        parseBool(frontmatter.get("user-invocable"), true),
                                        parseBool(frontmatter.get("disable-model-invocation"), false));
                }

                private static boolean parseBool(String value, boolean fallback) {
                        if (value == null || value.isBlank())
                                return fallback;
                        return switch (value.trim().toLowerCase()) {
                                case "true", "yes", "1", "on" -> true;
                                case "false", "no", "0", "off" -> false;
                                default -> fallback;
                        };
                }
        }

        // =========================================================================
        // Skill entry (skill + parsed metadata)
        // =========================================================================

        /**
         * A loaded skill with its frontmatter, invocation flags and declared
         * permissions. {@code permissions} is null when the loader did not parse
         * any.
         */
        public record SkillEntry(
                        Skill skill,
                        Map<String, String> frontmatter,
                        SkillInvocationPolicy invocation,
                        SkillPermissions permissions) {

                public SkillEntry {
                        frontmatter = frontmatter != null ? Map.copyOf(frontmatter) : Map.of();
                        invocation = invocation != null ? invocation : SkillInvocationPolicy.DEFAULT;
                }

                /**
                 * Build an entry from SKILL.md source: invocation flags from the
                 * frontmatter map, permissions from the {@code ## Permissions}
                 * section.
                 */
                public static SkillEntry fromSource(Skill skill, Map<String, String> frontmatter, String content) {
                        return new SkillEntry(skill, frontmatter,
                                        SkillInvocationPolicy.fromFrontmatter(frontmatter),
                                        SkillPermissionsParser.parse(content));
                }

                public String name() {
                        return skill.name();
                }

                /** Declared permissions, or the defaults. */
                public SkillPermissions effectivePermissions() {
                        return permissions != null ? permissions : SkillPermissions.DEFAULT;
                }
        }

        // =========================================================================
        // Eligibility context
        // =========================================================================

        /**
         * Who the skill set is being built for. A null tier means the session has
         * no platform user and no tier gate applies.
         */
        public record SkillEligibilityContext(UserTier userTier) {

                public static final SkillEligibilityContext NONE = new SkillEligibilityContext(null);
        }

        // =========================================================================
        // Skill snapshot
        // =========================================================================

        /**
         * Skills admitted for a session.
         *
         * @param skills            eligible entries
         * @param activePermissions most restrictive permissions across them, null
         *                          when there are none
         */
        public record SkillSnapshot(
                        List<SkillEntry> skills,
                        SkillPermissions activePermissions) {

                public List<String> names() {
                        return skills.stream().map(SkillEntry::name).toList();
                }
        }
}
