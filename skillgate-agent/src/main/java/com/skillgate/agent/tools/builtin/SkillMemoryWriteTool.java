package com.skillgate.agent.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skillgate.agent.skills.SkillMemory;
import com.skillgate.agent.skills.SkillMemoryWriter;
import com.skillgate.agent.skills.SkillMemoryWriter.MemoryEntry;
import com.skillgate.agent.skills.SkillMemoryWriter.MemoryWriteResult;
import com.skillgate.agent.skills.SkillTypes.SkillEntry;
import com.skillgate.agent.tools.AgentTool;
import com.skillgate.agent.tools.ToolParamUtils;
import com.skillgate.agent.tools.policy.ToolCatalog;
import com.skillgate.common.delivery.DeliveryContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@code skill_memory_write}: persists durable user preferences into the
 * active skill's per-user memory file.
 *
 * <p>
 * The user id is bound when the tool is created from the session's delivery
 * context, so the model cannot write into another user's file.
 * </p>
 */
@Slf4j
public class SkillMemoryWriteTool implements AgentTool {

    static final String WRITE_FAILED = "Memory write failed. Will retry next session.";

    private final Map<String, Path> skills;
    private final String userId;
    private final SkillMemoryWriter writer;

    /**
     * @param skills active skill name to base directory
     * @param userId sanitized {@code channel_senderId}
     */
    public SkillMemoryWriteTool(Map<String, Path> skills, String userId, SkillMemoryWriter writer) {
        this.skills = new LinkedHashMap<>(skills);
        this.userId = userId;
        this.writer = writer;
    }

    /**
     * Tool bound to the session's sender, or empty when the session has no
     * sender identity. Skills without a base directory have nowhere to keep
     * memory and are left out.
     */
    public static Optional<SkillMemoryWriteTool> forSession(List<SkillEntry> activeSkills,
            DeliveryContext deliveryContext, SkillMemoryWriter writer) {
        String identity = deliveryContext != null ? deliveryContext.userIdentity() : null;
        if (identity == null)
            return Optional.empty();
        Map<String, Path> skills = new LinkedHashMap<>();
        for (SkillEntry entry : activeSkills) {
            if (entry.skill() == null)
                continue;
            String baseDir = entry.skill().baseDir();
            if (baseDir == null || baseDir.isBlank()) {
                log.debug("skill_memory_write: skipping {} (no base dir)", entry.name());
                continue;
            }
            skills.put(entry.name(), Path.of(baseDir));
        }
        return Optional.of(new SkillMemoryWriteTool(skills, SkillMemory.sanitizeForFilename(identity), writer));
    }

    @Override
    public String getName() {
        return ToolCatalog.SKILL_MEMORY_WRITE;
    }

    @Override
    public String getDescription() {
        return "Persist durable user preferences to skill memory. Use when a user reveals a lasting " +
                "preference (dietary needs, style preferences, etc.) that should be remembered across " +
                "sessions. Do not store transient context.";
    }

    @Override
    public JsonNode getParameterSchema() {
        ObjectNode schema = ToolParamUtils.createObject();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");

        ObjectNode skill = properties.putObject("skill");
        skill.put("type", "string");
        skill.put("description", "Name of the active skill to write memory for.");

        ObjectNode entries = properties.putObject("entries");
        entries.put("type", "array");
        entries.put("description", "Memory entries to append to the user's skill memory file.");
        ObjectNode item = entries.putObject("items");
        item.put("type", "object");
        ObjectNode itemProps = item.putObject("properties");
        itemProps.putObject("key").put("type", "string")
                .put("description", "Section name (e.g. 'Preferences', 'Notes', 'History').");
        itemProps.putObject("append").put("type", "string")
                .put("description", "Line to append to the section.");
        item.putArray("required").add("key").add("append");

        schema.putArray("required").add("skill").add("entries");
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context) {
        return CompletableFuture.supplyAsync(() -> doExecute(context.getParameters()));
    }

    ToolResult doExecute(JsonNode params) {
        String skillName = ToolParamUtils.readStringParam(params, "skill");
        if (skillName == null)
            return failure("skill name required");

        Path baseDir = skills.get(skillName);
        if (baseDir == null) {
            return failure("Unknown skill \"" + skillName + "\". Available: " + String.join(", ", skills.keySet()));
        }

        List<MemoryEntry> entries = readEntries(params != null ? params.get("entries") : null);
        if (entries.isEmpty())
            return failure("No valid entries provided.");

        try {
            MemoryWriteResult result = writer.write(skillName, baseDir, userId, entries);
            ObjectNode payload = ToolParamUtils.createObject();
            payload.put("ok", result.ok());
            if (result.warning() != null)
                payload.put("warning", result.warning());
            return ToolParamUtils.jsonResult(payload);
        } catch (IOException | RuntimeException e) {
            log.warn("skill_memory_write failed: skill={} error={}", skillName, e.getMessage());
            return failure(WRITE_FAILED);
        }
    }

    private static List<MemoryEntry> readEntries(JsonNode node) {
        List<MemoryEntry> entries = new ArrayList<>();
        if (node == null || !node.isArray())
            return entries;
        for (JsonNode entry : node) {
            String key = ToolParamUtils.readStringParam(entry, "key");
            String append = ToolParamUtils.readStringParam(entry, "append");
            if (key != null && append != null)
                entries.add(new MemoryEntry(key, append));
        }
        return entries;
    }

    private static ToolResult failure(String error) {
        ObjectNode payload = ToolParamUtils.createObject();
        payload.put("ok", false);
        payload.put("error", error);
        return ToolParamUtils.jsonResult(payload);
    }
}
