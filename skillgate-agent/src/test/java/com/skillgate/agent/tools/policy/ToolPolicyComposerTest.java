package com.skillgate.agent.tools.policy;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ToolPolicyComposerTest {

    private final ToolPolicyComposer composer = ToolPolicyComposer.DEFAULT;
    private final ToolReferenceResolver resolver = ToolReferenceResolver.DEFAULT;

    @Test
    void intersectsGroupWithExplicitTools() {
        ToolPolicy composed = composer.compose(
                ToolPolicy.allowOnly(List.of("group:fs", "group:web")),
                ToolPolicy.allowOnly(List.of("read", "write", "web_search")));

        assertEquals(Set.of("read", "write", "web_search"), new HashSet<>(composed.allow()));
        assertNull(composed.deny());
    }

    @Test
    void twoLayerIntersectionIsExact() {
        List<String> a = List.of("group:fs", "group:memory", "image", "bash");
        List<String> b = List.of("group:runtime", "read", "memory_get", "tts");

        Set<String> expected = new HashSet<>(resolver.expand(a));
        expected.retainAll(resolver.expand(b));

        ToolPolicy composed = composer.compose(ToolPolicy.allowOnly(a), ToolPolicy.allowOnly(b));
        assertEquals(expected, new HashSet<>(composed.allow()));
        assertEquals(Set.of("exec", "read", "memory_get"), expected);
    }

    @Test
    void emptyAllowIsAbsorbing() {
        ToolPolicy composed = composer.compose(
                ToolPolicy.allowOnly(List.of()),
                ToolPolicy.allowOnly(List.of("read")));
        assertEquals(List.of(), composed.allow());

        ToolPolicy reversed = composer.compose(
                ToolPolicy.allowOnly(List.of("read")),
                null,
                ToolPolicy.allowOnly(List.of()));
        assertEquals(List.of(), reversed.allow());
    }

    @Test
    void denyUnionHasNoDuplicates() {
        ToolPolicy composed = composer.compose(
                ToolPolicy.denyOnly(List.of("exec")),
                ToolPolicy.denyOnly(List.of("exec")));
        assertEquals(List.of("exec"), composed.deny());
    }

    @Test
    void denyUnionKeepsFirstSeenOrder() {
        ToolPolicy composed = composer.compose(
                ToolPolicy.denyOnly(List.of("exec", "deploy")),
                ToolPolicy.denyOnly(List.of("cron", "exec")));
        assertEquals(List.of("exec", "deploy", "cron"), composed.deny());
    }

    @Test
    void denyGroupsStayLiteral() {
        ToolPolicy composed = composer.compose(ToolPolicy.denyOnly(List.of("group:runtime")));
        assertEquals(List.of("group:runtime"), composed.deny());
    }

    @Test
    void passThroughLayersNeverRestrict() {
        ToolPolicy composed = composer.compose(null, ToolPolicy.allowOnly(List.of("read")));
        assertEquals(resolver.expand("read"), new HashSet<>(composed.allow()));

        ToolPolicy withDenyOnly = composer.compose(
                ToolPolicy.denyOnly(List.of("exec")),
                ToolPolicy.allowOnly(List.of("group:fs")));
        assertEquals(resolver.expand("group:fs"), new HashSet<>(withDenyOnly.allow()));
        assertEquals(List.of("exec"), withDenyOnly.deny());
    }

    @Test
    void noLayersGivesEmptyPolicy() {
        assertEquals(ToolPolicy.EMPTY, composer.compose(List.of()));
        assertEquals(ToolPolicy.EMPTY, composer.compose(Arrays.asList(null, null)));
        assertEquals(ToolPolicy.EMPTY, composer.compose((List<ToolPolicy>) null));
        assertTrue(composer.compose(List.of()).isUnrestricted());
    }

    @Test
    void allowLayersWithUnknownToolsIntersectLiterally() {
        ToolPolicy composed = composer.compose(
                ToolPolicy.allowOnly(List.of("custom_tool", "read")),
                ToolPolicy.allowOnly(List.of("CUSTOM_TOOL")));
        assertEquals(List.of("custom_tool"), composed.allow());
    }
}
