package com.skillgate.agent.tier;

import com.skillgate.agent.skills.SkillScope;
import com.skillgate.agent.tools.policy.ToolPolicy;
import com.skillgate.agent.tools.policy.ToolPolicyMatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TierPolicyTableTest {

    private final TierPolicyTable table = TierPolicyTable.DEFAULT;

    @ParameterizedTest
    @EnumSource(SkillScope.class)
    void nullCeilingAdmitsEverything(SkillScope scope) {
        assertTrue(TierPolicyTable.admits(scope, (SkillScope) null));
        assertTrue(table.admits(scope, UserTier.ADMIN));
    }

    @Test
    void ceilingOrdering() {
        assertFalse(TierPolicyTable.admits(SkillScope.FULL, SkillScope.READ_WRITE));
        assertFalse(TierPolicyTable.admits(SkillScope.CUSTOM, SkillScope.READ_WRITE));
        assertTrue(TierPolicyTable.admits(SkillScope.WORKSPACE, SkillScope.WORKSPACE));
        assertTrue(TierPolicyTable.admits(SkillScope.CONVERSATION_ONLY, SkillScope.WORKSPACE));
        assertTrue(TierPolicyTable.admits(SkillScope.CUSTOM, SkillScope.FULL));
    }

    @Test
    void defaultCeilings() {
        assertNull(table.ceiling(UserTier.ADMIN));
        assertEquals(SkillScope.READ_WRITE, table.ceiling(UserTier.TRUSTED));
        assertEquals(SkillScope.WORKSPACE, table.ceiling(UserTier.DEFAULT));
    }

    @Test
    void defaultTierHasNoMemoryOrRuntimeTools() {
        ToolPolicy policy = table.defaultPolicy(UserTier.DEFAULT);
        ToolPolicyMatcher matcher = ToolPolicyMatcher.DEFAULT;

        assertTrue(matcher.isToolAllowed("read", policy));
        assertTrue(matcher.isToolAllowed("web_fetch", policy));
        assertTrue(matcher.isToolAllowed("skill_memory_write", policy));
        assertFalse(matcher.isToolAllowed("memory_search", policy));
        assertFalse(matcher.isToolAllowed("exec", policy));
        assertNull(policy.deny());
    }

    @Test
    void trustedTierAddsMemory() {
        assertTrue(ToolPolicyMatcher.DEFAULT.isToolAllowed("memory_get", table.defaultPolicy(UserTier.TRUSTED)));
        assertNull(table.defaultPolicy(UserTier.ADMIN));
    }

    @Test
    void missingTierIsUnrestricted() {
        TierPolicyTable custom = new TierPolicyTable(Map.of(
                UserTier.DEFAULT, new TierProfile(SkillScope.READ_ONLY, ToolPolicy.allowOnly(List.of("read")))));
        assertNull(custom.ceiling(UserTier.TRUSTED));
        assertFalse(custom.admits(SkillScope.WORKSPACE, UserTier.DEFAULT));
        assertEquals(TierProfile.UNRESTRICTED, new TierPolicyTable(Map.of()).profile(UserTier.DEFAULT));
    }
}
