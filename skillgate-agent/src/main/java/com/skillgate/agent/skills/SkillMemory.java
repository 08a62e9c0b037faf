package com.skillgate.agent.skills;

import com.skillgate.common.delivery.DeliveryContext;
import com.skillgate.common.logging.SubsystemLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a skill's memory files for the system prompt.
 *
 * <pre>
 * &lt;skill&gt;/memory/defaults.md            shared defaults
 * &lt;skill&gt;/memory/users/&lt;userId&gt;.md       per-user memory
 * </pre>
 */
public final class SkillMemory {

    private static final SubsystemLogger log = SubsystemLogger.create("skills");

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^A-Za-z0-9_+@.\\-]");

    private SkillMemory() {
    }

    /**
     * Keep letters, digits and {@code _ + @ . -}; replace everything else with
     * {@code _}.
     */
    public static String sanitizeForFilename(String input) {
        if (input == null)
            return "";
        return UNSAFE_FILENAME_CHARS.matcher(input).replaceAll("_");
    }

    /** Per-user memory file for {@code userId} (already sanitized). */
    public static Path userMemoryFile(Path skillBaseDir, String userId) {
        return skillBaseDir.resolve("memory").resolve("users").resolve(userId + ".md");
    }

    /**
     * Load defaults and, when the context names a sender, the user's memory.
     * Returns {@code ""} when nothing is present.
     */
    public static String load(Path skillBaseDir, DeliveryContext deliveryContext) {
        String skillName = skillBaseDir.getFileName() != null ? skillBaseDir.getFileName().toString() : "";
        List<String> sections = new ArrayList<>();

        String defaults = readTrimmed(skillBaseDir.resolve("memory").resolve("defaults.md"));
        if (!defaults.isEmpty()) {
            sections.add("## Skill Defaults\n\n" + defaults);
            log.debug("skill memory defaults loaded", Map.of("skill", skillName, "chars", defaults.length()));
        }

        String identity = deliveryContext != null ? deliveryContext.userIdentity() : null;
        if (identity != null) {
            String userId = sanitizeForFilename(identity);
            String userMemory = readTrimmed(userMemoryFile(skillBaseDir, userId));
            if (!userMemory.isEmpty()) {
                sections.add("## User Memory\n\n" + userMemory);
                log.debug("skill memory user file loaded",
                        Map.of("skill", skillName, "user", userId, "chars", userMemory.length()));
            }
        } else {
            log.debug("skill memory: " + skillName + " skipped user memory (no delivery context)");
        }
        return String.join("\n\n", sections);
    }

    private static String readTrimmed(Path file) {
        if (!Files.isRegularFile(file))
            return "";
        try {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.warn("skill memory read failed", Map.of("path", file.toString(), "error", String.valueOf(e.getMessage())));
            return "";
        }
    }
}
