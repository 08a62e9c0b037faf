package com.skillgate.agent.tools.policy;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolPolicyMatcherTest {

    private final ToolPolicyMatcher matcher = ToolPolicyMatcher.DEFAULT;

    @Test
    void nullPolicyAllowsEverything() {
        assertTrue(matcher.isToolAllowed("exec", null));
    }

    @Test
    void blankNameIsNeverAllowed() {
        assertFalse(matcher.isToolAllowed(" ", null));
        assertFalse(matcher.isToolAllowed(null, ToolPolicy.EMPTY));
    }

    @Test
    void filterSkipsNullAndBlankNamesWithOrWithoutPolicy() {
        List<String> names = Arrays.asList("read", null, " ", "exec");
        assertEquals(List.of("read", "exec"), matcher.filterToolNames(names, null));
        assertEquals(List.of("read"), matcher.filterToolNames(names, ToolPolicy.denyOnly(List.of("exec"))));
    }

    @Test
    void allowListExpandsGroups() {
        ToolPolicy policy = ToolPolicy.allowOnly(List.of("group:fs"));
        assertTrue(matcher.isToolAllowed("read", policy));
        assertTrue(matcher.isToolAllowed("Apply-Patch", policy));
        assertFalse(matcher.isToolAllowed("exec", policy));
    }

    @Test
    void denyWinsOverAllow() {
        ToolPolicy policy = new ToolPolicy(List.of("group:runtime", "read"), List.of("exec"));
        assertFalse(matcher.isToolAllowed("exec", policy));
        assertFalse(matcher.isToolAllowed("bash", policy));
        assertTrue(matcher.isToolAllowed("process", policy));
    }

    @Test
    void denyGroupsAreExpandedAtDispatch() {
        ToolPolicy policy = ToolPolicy.denyOnly(List.of("group:runtime"));
        assertFalse(matcher.isToolAllowed("process", policy));
        assertTrue(matcher.isToolAllowed("read", policy));
    }

    @Test
    void emptyAllowRefusesEverything() {
        ToolPolicy policy = ToolPolicy.allowOnly(List.of());
        assertFalse(matcher.isToolAllowed("read", policy));
    }

    @Test
    void wildcardsMatch() {
        ToolPolicy policy = new ToolPolicy(List.of("web_*", "sessions_*"), List.of("sessions_spawn"));
        assertTrue(matcher.isToolAllowed("web_fetch", policy));
        assertTrue(matcher.isToolAllowed("sessions_list", policy));
        assertFalse(matcher.isToolAllowed("sessions_spawn", policy));
        assertFalse(matcher.isToolAllowed("read", policy));

        assertTrue(matcher.isToolAllowed("anything", ToolPolicy.allowOnly(List.of("*"))));
    }

    @Test
    void wildcardDoesNotTreatDotsAsRegex() {
        ToolPolicy policy = ToolPolicy.allowOnly(List.of("a.b*"));
        assertTrue(matcher.isToolAllowed("a.bc", policy));
        assertFalse(matcher.isToolAllowed("axbc", policy));
    }

    @Test
    void filterKeepsInputOrder() {
        ToolPolicy policy = new ToolPolicy(List.of("group:fs", "group:web"), List.of("write"));
        List<String> kept = matcher.filterToolNames(
                List.of("web_fetch", "exec", "read", "write", "edit"), policy);
        assertEquals(List.of("web_fetch", "read", "edit"), kept);
    }
}
