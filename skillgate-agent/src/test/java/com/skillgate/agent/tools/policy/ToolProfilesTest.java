package com.skillgate.agent.tools.policy;

import com.skillgate.agent.tools.policy.ToolProfiles.ToolProfileId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolProfilesTest {

    @Test
    void minimalAllowsOnlySessionStatus() {
        assertEquals(List.of("session_status"), ToolProfiles.resolve("minimal").allow());
    }

    @Test
    void codingIncludesRuntimeAndFs() {
        ToolPolicy coding = ToolProfiles.resolve("Coding");
        assertTrue(coding.allow().containsAll(List.of("group:fs", "group:runtime", "group:sessions",
                "group:memory", "image")));
        assertNull(coding.deny());
    }

    @Test
    void messagingAllowsMessageTools() {
        ToolPolicy messaging = ToolProfiles.resolve("messaging");
        assertTrue(ToolPolicyMatcher.DEFAULT.isToolAllowed("message", messaging));
        assertFalse(ToolPolicyMatcher.DEFAULT.isToolAllowed("exec", messaging));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "full", "unknown", "  " })
    void fullUnknownOrBlankHasNoPolicy(String id) {
        assertNull(ToolProfiles.resolve(id));
    }

    @Test
    void profileIdParsing() {
        assertEquals(Optional.of(ToolProfileId.MESSAGING), ToolProfileId.fromId(" MESSAGING "));
        assertEquals(Optional.empty(), ToolProfileId.fromId("nope"));
    }
}
