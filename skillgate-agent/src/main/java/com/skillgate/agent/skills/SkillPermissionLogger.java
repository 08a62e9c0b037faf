package com.skillgate.agent.skills;

import com.skillgate.common.logging.SubsystemLogger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session tracker of tools excluded by skill permissions.
 *
 * <p>
 * Every exclusion is logged at warn on the {@code skills} subsystem. Counts
 * are kept per skill and tool; once a count reaches
 * {@link #LEARNINGS_THRESHOLD} a line is appended to the skill's
 * {@code learnings.md} under {@code ## Permission Exclusions}. Bypassed
 * exclusions are logged with a {@code [bypassed]} tag and never written.
 * </p>
 */
public class SkillPermissionLogger {

    private static final SubsystemLogger log = SubsystemLogger.create("skills");

    public static final int LEARNINGS_THRESHOLD = 3;
    public static final String SECTION_HEADER = "## Permission Exclusions";
    public static final String LEARNINGS_FILE = "learnings.md";

    /**
     * One tool removed from a session because of a skill's permissions.
     *
     * @param skillBaseDir skill directory holding {@code learnings.md}; null
     *                     when the skill has none, in which case nothing is
     *                     written
     * @param bypassed     the exclusion was reported while enforcement was off
     */
    public record SkillExclusionEntry(
            String skillName,
            Path skillBaseDir,
            String toolName,
            SkillScope scope,
            boolean bypassed) {

        boolean writable() {
            return !bypassed && skillBaseDir != null;
        }
    }

    private final Map<String, Integer> counts = new ConcurrentHashMap<>();
    private final Map<String, SkillExclusionEntry> entries = new ConcurrentHashMap<>();
    private final List<CompletableFuture<Void>> pendingWrites = new ArrayList<>();
    private final SkillSerializer serializer;
    private final Clock clock;

    public SkillPermissionLogger() {
        this(new SkillSerializer(), Clock.systemUTC());
    }

    public SkillPermissionLogger(SkillSerializer serializer, Clock clock) {
        this.serializer = serializer;
        this.clock = clock;
    }

    private static String makeKey(String skillName, String toolName) {
        return skillName + ":" + toolName;
    }

    /** Record one exclusion. */
    public void logExclusion(SkillExclusionEntry entry) {
        String key = makeKey(entry.skillName(), entry.toolName());
        int count = counts.merge(key, 1, Integer::sum);
        entries.put(key, entry);

        String tag = entry.bypassed() ? " [bypassed]" : "";
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("skillName", entry.skillName());
        meta.put("toolName", entry.toolName());
        meta.put("scope", entry.scope().id());
        meta.put("bypassed", entry.bypassed());
        meta.put("count", count);
        log.warn("skill permission: tool \"" + entry.toolName() + "\" excluded by skill \""
                + entry.skillName() + "\" (scope: " + entry.scope() + ")" + tag, meta);

        if (count == LEARNINGS_THRESHOLD && entry.writable()) {
            track(appendToLearnings(entry, count));
        }
    }

    public void logExclusions(List<SkillExclusionEntry> batch) {
        for (SkillExclusionEntry entry : batch) {
            logExclusion(entry);
        }
    }

    public int getCount(String skillName, String toolName) {
        return counts.getOrDefault(makeKey(skillName, toolName), 0);
    }

    /**
     * Write every non-bypassed entry at or above the threshold whose skill has
     * a base directory. Called at
     * session end; lines already written today are not duplicated.
     */
    public CompletableFuture<Void> flushToLearnings() {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        counts.forEach((key, count) -> {
            if (count < LEARNINGS_THRESHOLD)
                return;
            SkillExclusionEntry entry = entries.get(key);
            if (entry == null || !entry.writable())
                return;
            writes.add(appendToLearnings(entry, count));
        });
        writes.forEach(this::track);
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]));
    }

    /** Block until every learnings write started so far has finished. */
    public void awaitPendingWrites() {
        List<CompletableFuture<Void>> snapshot;
        synchronized (pendingWrites) {
            snapshot = new ArrayList<>(pendingWrites);
            pendingWrites.clear();
        }
        CompletableFuture.allOf(snapshot.toArray(new CompletableFuture[0])).join();
    }

    private void track(CompletableFuture<Void> write) {
        synchronized (pendingWrites) {
            pendingWrites.add(write);
        }
    }

    private CompletableFuture<Void> appendToLearnings(SkillExclusionEntry entry, int count) {
        Path learningsPath = entry.skillBaseDir().resolve(LEARNINGS_FILE);
        String date = LocalDate.now(clock).toString();

        SkillScope suggested = suggestScopeForTool(entry.toolName(), entry.scope());
        String suggestion = suggested != null
                ? " Consider upgrading to `" + suggested + "` if this tool is needed."
                : "";
        String duplicateKey = date + ": Skill \"" + entry.skillName() + "\" excluded tool \"" + entry.toolName() + "\"";
        String line = "- " + duplicateKey + " x" + count + " across sessions. Current scope: `"
                + entry.scope() + "`." + suggestion + " [auto-logged]";

        return serializer.serializeByKey("learnings:" + learningsPath.toAbsolutePath(), () -> {
            String existing = Files.exists(learningsPath)
                    ? Files.readString(learningsPath, StandardCharsets.UTF_8)
                    : "";
            if (existing.contains(duplicateKey))
                return null;
            Files.writeString(learningsPath, insertLine(existing, line), StandardCharsets.UTF_8);
            return null;
        }).<Void>handle((ignored, ex) -> {
            if (ex != null) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("learningsPath", learningsPath.toString());
                meta.put("skillName", entry.skillName());
                log.warn("Failed to write skill permission exclusion to learnings.md: " + cause.getMessage(), meta);
            }
            return null;
        });
    }

    /** Newest line goes directly under the section header. */
    static String insertLine(String existing, String line) {
        int headerPos = existing.indexOf(SECTION_HEADER);
        if (headerPos >= 0) {
            int insertPos = headerPos + SECTION_HEADER.length();
            return existing.substring(0, insertPos) + "\n" + line + existing.substring(insertPos);
        }
        String trimmed = existing.stripTrailing();
        String separator = trimmed.isEmpty() ? "" : "\n\n";
        return trimmed + separator + SECTION_HEADER + "\n" + line + "\n";
    }

    private static final Set<String> FS_TOOLS = Set.of("read", "write", "edit", "apply_patch");
    private static final List<String> SYSTEM_TOOLS = List.of("exec", "process", "cron", "gateway");

    /**
     * Lowest scope that would plausibly admit {@code toolName}, or null when
     * no single scope covers it.
     */
    public static SkillScope suggestScopeForTool(String toolName, SkillScope currentScope) {
        String normalized = toolName.toLowerCase(Locale.ROOT);
        if (normalized.contains("memory"))
            return currentScope == SkillScope.CONVERSATION_ONLY ? SkillScope.READ_ONLY : SkillScope.READ_WRITE;
        if (FS_TOOLS.contains(normalized))
            return SkillScope.WORKSPACE;
        if (normalized.contains("web"))
            return SkillScope.READ_ONLY;
        if (SYSTEM_TOOLS.stream().anyMatch(normalized::contains))
            return SkillScope.FULL;
        return null;
    }
}
