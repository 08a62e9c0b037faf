package com.skillgate.agent.skills;

import com.skillgate.agent.skills.SkillMemoryWriter.MemoryEntry;
import com.skillgate.agent.skills.SkillMemoryWriter.MemoryWriteResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SkillMemoryWriterTest {

    @Nested
    class AppendToSection {

        @Test
        void createsSectionInEmptyContent() {
            assertEquals("## Preferences\n- Vegetarian\n",
                    SkillMemoryWriter.appendToSection("", "Preferences", "- Vegetarian"));
        }

        @Test
        void appendsNewSectionAtEnd() {
            assertEquals("## Notes\n- a\n\n## Preferences\n- b\n",
                    SkillMemoryWriter.appendToSection("## Notes\n- a\n\n", "Preferences", "- b"));
        }

        @Test
        void insertsAfterLastLineOfExistingSection() {
            String content = "## Preferences\n- a\n\n## Notes\n- n\n";
            assertEquals("## Preferences\n- a\n- b\n\n## Notes\n- n\n",
                    SkillMemoryWriter.appendToSection(content, "preferences", "- b"));
        }

        @Test
        void appendsToLastSection() {
            assertEquals("## Notes\n- n\n- m\n",
                    SkillMemoryWriter.appendToSection("## Notes\n- n\n", "Notes", "- m"));
        }

        @Test
        void emptySectionGetsFirstLine() {
            assertEquals("## Notes\n- first\n## Other\n",
                    SkillMemoryWriter.appendToSection("## Notes\n## Other\n", "Notes", "- first"));
        }
    }

    @TempDir
    Path skillDir;

    private final SkillMemoryWriter writer = new SkillMemoryWriter();

    @Test
    void writesUserFileAndCreatesDirectories() throws Exception {
        MemoryWriteResult result = writer.write("recipes", skillDir, "telegram_123", List.of(
                new MemoryEntry("Preferences", "- Vegetarian"),
                new MemoryEntry("Preferences", "- No nuts")));

        assertTrue(result.ok());
        assertNull(result.warning());
        assertEquals("## Preferences\n- Vegetarian\n- No nuts\n",
                Files.readString(skillDir.resolve("memory/users/telegram_123.md")));
    }

    @Test
    void emptyEntriesIsNoop() throws Exception {
        assertEquals(MemoryWriteResult.OK, writer.write("recipes", skillDir, "u", List.of()));
        assertFalse(Files.exists(skillDir.resolve("memory")));
    }

    @Test
    void warnsWhenFileNeedsPruning() throws Exception {
        List<MemoryEntry> entries = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            entries.add(new MemoryEntry("History", "- item " + i));
        }
        MemoryWriteResult result = writer.write("recipes", skillDir, "u", entries);
        assertTrue(result.ok());
        assertEquals(SkillMemoryWriter.PRUNING_NEEDED, result.warning());
    }

    @Test
    void concurrentWritesAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<MemoryWriteResult>> writes = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                MemoryEntry entry = new MemoryEntry("Notes", "- note " + i);
                writes.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return writer.write("recipes", skillDir, "telegram_1", List.of(entry));
                    } catch (IOException e) {
                        throw new IllegalStateException(e);
                    }
                }, pool));
            }
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }

        String content = Files.readString(skillDir.resolve("memory/users/telegram_1.md"));
        for (int i = 0; i < 20; i++) {
            assertTrue(content.contains("- note " + i + "\n"), "missing note " + i);
        }
    }

    @Test
    void ioFailurePropagates() throws Exception {
        // a regular file where the memory directory should be
        Files.writeString(skillDir.resolve("memory"), "not a directory");
        assertThrows(IOException.class, () -> writer.write("recipes", skillDir, "u",
                List.of(new MemoryEntry("Notes", "- x"))));
    }
}
