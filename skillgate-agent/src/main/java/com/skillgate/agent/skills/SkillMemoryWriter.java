package com.skillgate.agent.skills;

import com.skillgate.common.logging.SubsystemLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Appends entries to a user's skill memory file. Writes for the same skill
 * and user are serialized.
 */
public final class SkillMemoryWriter {

    private static final SubsystemLogger log = SubsystemLogger.create("skills");

    public static final int MEMORY_FILE_MAX_LINES = 100;
    public static final String PRUNING_NEEDED = "pruning_needed";

    /** One {@code key}/{@code append} pair from the tool call. */
    public record MemoryEntry(String key, String append) {
    }

    /** Outcome of a write; {@code warning} is null unless pruning is needed. */
    public record MemoryWriteResult(boolean ok, String warning) {
        public static final MemoryWriteResult OK = new MemoryWriteResult(true, null);
    }

    private final SkillSerializer serializer;

    public SkillMemoryWriter() {
        this(new SkillSerializer());
    }

    public SkillMemoryWriter(SkillSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Append {@code line} to the {@code ## sectionKey} section (heading
     * matched case-insensitively), right after its last non-blank line. A
     * missing section is created at the end.
     */
    public static String appendToSection(String content, String sectionKey, String line) {
        String[] lines = content.split("\n", -1);
        String keyLower = sectionKey.trim().toLowerCase(Locale.ROOT);

        int headingIdx = -1;
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.startsWith("## ") && trimmed.substring(3).trim().toLowerCase(Locale.ROOT).equals(keyLower)) {
                headingIdx = i;
                break;
            }
        }

        if (headingIdx == -1) {
            String trimmed = content.stripTrailing();
            return trimmed.isEmpty()
                    ? "## " + sectionKey + "\n" + line + "\n"
                    : trimmed + "\n\n## " + sectionKey + "\n" + line + "\n";
        }

        int nextHeadingIdx = lines.length;
        for (int i = headingIdx + 1; i < lines.length; i++) {
            if (lines[i].stripLeading().startsWith("## ")) {
                nextHeadingIdx = i;
                break;
            }
        }

        int insertIdx = nextHeadingIdx;
        while (insertIdx > headingIdx + 1 && lines[insertIdx - 1].trim().isEmpty()) {
            insertIdx--;
        }

        List<String> result = new ArrayList<>(Arrays.asList(lines).subList(0, insertIdx));
        result.add(line);
        result.addAll(Arrays.asList(lines).subList(insertIdx, lines.length));
        return String.join("\n", result);
    }

    /**
     * Apply {@code entries} to {@code memory/users/<userId>.md} under the skill
     * directory, creating directories as needed.
     *
     * @throws IOException if the memory file cannot be read or written
     */
    public MemoryWriteResult write(String skillName, Path skillBaseDir, String userId, List<MemoryEntry> entries)
            throws IOException {
        if (entries == null || entries.isEmpty())
            return MemoryWriteResult.OK;

        Path userFile = SkillMemory.userMemoryFile(skillBaseDir, userId);
        String key = "skillMemory:" + skillName + ":" + userId;
        try {
            return serializer.serializeByKey(key, () -> applyEntries(skillName, userId, userFile, entries)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io)
                throw io;
            if (cause instanceof UncheckedIOException uio)
                throw uio.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            throw e;
        }
    }

    private MemoryWriteResult applyEntries(String skillName, String userId, Path userFile, List<MemoryEntry> entries)
            throws IOException {
        Files.createDirectories(userFile.getParent());
        String content = Files.exists(userFile) ? Files.readString(userFile, StandardCharsets.UTF_8) : "";

        for (MemoryEntry entry : entries) {
            content = appendToSection(content, entry.key(), entry.append());
        }

        int lineCount = content.split("\n", -1).length;
        String warning = lineCount > MEMORY_FILE_MAX_LINES ? PRUNING_NEEDED : null;

        Files.writeString(userFile, content, StandardCharsets.UTF_8);
        log.debug("skill memory write", Map.of(
                "skill", skillName, "user", userId, "entries", entries.size(), "lines", lineCount));
        return new MemoryWriteResult(true, warning);
    }
}
