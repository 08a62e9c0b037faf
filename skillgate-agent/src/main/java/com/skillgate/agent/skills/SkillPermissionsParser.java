package com.skillgate.agent.skills;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code ## Permissions} section of a SKILL.md file.
 *
 * <pre>
 * ## Permissions
 *
 * scope: workspace
 * tools:
 *   allow: [read, write, web_fetch]
 *   deny: [exec, deploy]
 * delegation: opus
 * external: read
 * </pre>
 *
 * Invalid enum values fall back to their defaults here, so everything
 * downstream sees valid {@link SkillPermissions}. A file with no (or an empty)
 * section yields {@link SkillPermissions#DEFAULT}.
 */
public final class SkillPermissionsParser {

    private SkillPermissionsParser() {
    }

    private static final Pattern HEADING = Pattern.compile("^##\\s+permissions\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEXT_HEADING = Pattern.compile("^##\\s");
    private static final Pattern TOP_LEVEL_KEY = Pattern.compile("^(\\w[\\w-]*):\\s*(.*)$");
    private static final Pattern TOOLS_SUB_KEY = Pattern.compile("^\\s+(allow|deny):\\s*(.*)$");

    public static SkillPermissions parse(String content) {
        String section = extractSection(content);
        if (section == null)
            return SkillPermissions.DEFAULT;

        SkillScope scope = SkillScope.CONVERSATION_ONLY;
        SkillDelegation delegation = SkillDelegation.OPUS;
        SkillExternalAccess external = SkillExternalAccess.NONE;
        List<String> allow = null;
        List<String> deny = null;

        for (String line : section.split("\n")) {
            Matcher top = TOP_LEVEL_KEY.matcher(line);
            if (!top.matches()) {
                Matcher sub = TOOLS_SUB_KEY.matcher(line);
                if (sub.matches()) {
                    List<String> list = parseBracketList(sub.group(2));
                    if (list != null) {
                        if ("allow".equals(sub.group(1)))
                            allow = list;
                        else
                            deny = list;
                    }
                }
                continue;
            }
            String value = top.group(2).trim();
            switch (top.group(1).toLowerCase(Locale.ROOT)) {
                case "scope" -> scope = SkillScope.fromId(value);
                case "delegation" -> delegation = SkillDelegation.fromId(value);
                case "external" -> external = SkillExternalAccess.fromId(value);
                default -> {
                    // "tools:" only introduces the indented sub-keys
                }
            }
        }
        return new SkillPermissions(scope, null, delegation, external).withTools(allow, deny);
    }

    /**
     * Lines between the Permissions heading and the next {@code ## } heading,
     * trimmed; null when absent or blank.
     */
    static String extractSection(String content) {
        if (content == null || content.isBlank())
            return null;
        String[] lines = content.replace("\r\n", "\n").split("\n", -1);
        int start = -1;
        for (int i = 0; i < lines.length; i++) {
            if (HEADING.matcher(lines[i].trim()).matches()) {
                start = i + 1;
                break;
            }
        }
        if (start == -1)
            return null;
        int end = lines.length;
        for (int i = start; i < lines.length; i++) {
            if (NEXT_HEADING.matcher(lines[i]).find()) {
                end = i;
                break;
            }
        }
        String section = String.join("\n", Arrays.asList(lines).subList(start, end)).trim();
        return section.isEmpty() ? null : section;
    }

    /**
     * {@code [a, b, group:web]} to a list; null unless bracketed and non-empty.
     */
    static List<String> parseBracketList(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]"))
            return null;
        String inner = trimmed.substring(1, trimmed.length() - 1).trim();
        if (inner.isEmpty())
            return null;
        return Arrays.stream(inner.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
