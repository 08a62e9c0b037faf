package com.skillgate.agent.skills;

import com.skillgate.agent.skills.SkillTypes.*;
import com.skillgate.agent.tier.TierPolicyTable;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Decides which skills a user may run at all. A skill whose scope is above
 * the user's tier ceiling is dropped from the skill set, not merely
 * tool-restricted.
 */
@Slf4j
public final class SkillEligibility {

    public static final SkillEligibility DEFAULT = new SkillEligibility(TierPolicyTable.DEFAULT);

    private final TierPolicyTable tierTable;

    public SkillEligibility(TierPolicyTable tierTable) {
        this.tierTable = Objects.requireNonNull(tierTable, "tierTable");
    }

    /**
     * No tier, or no declared permissions: included. Otherwise the scope must
     * pass the tier's ceiling.
     */
    public boolean shouldInclude(SkillEntry entry, SkillEligibilityContext context) {
        if (context == null || context.userTier() == null)
            return true;
        SkillPermissions permissions = entry.permissions();
        if (permissions == null)
            return true;
        boolean admitted = tierTable.admits(permissions.scope(), context.userTier());
        if (!admitted) {
            log.debug("Skill '{}' (scope {}) excluded for tier {}",
                    entry.name(), permissions.scope(), context.userTier());
        }
        return admitted;
    }

    /**
     * Apply the tier gate, then the optional name filter. A non-null but empty
     * filter admits nothing.
     */
    public List<SkillEntry> filter(List<SkillEntry> entries, SkillEligibilityContext context,
            List<String> skillFilter) {
        if (entries == null || entries.isEmpty())
            return List.of();
        List<SkillEntry> filtered = entries.stream()
                .filter(entry -> shouldInclude(entry, context))
                .toList();
        if (skillFilter == null)
            return filtered;
        Set<String> names = new LinkedHashSet<>();
        for (String name : skillFilter) {
            if (name != null && !name.isBlank())
                names.add(name.trim());
        }
        log.debug("Applying skill filter: {}", names.isEmpty() ? "(none)" : String.join(", ", names));
        return filtered.stream().filter(entry -> names.contains(entry.name())).toList();
    }

    /**
     * Build the session snapshot for already-filtered entries.
     */
    public SkillSnapshot snapshot(List<SkillEntry> eligible) {
        return new SkillSnapshot(List.copyOf(eligible), mostRestrictive(
                eligible.stream().map(SkillEntry::effectivePermissions).toList()));
    }

    /**
     * Lowest scope across {@code permissions}, with delegation {@code none} if
     * any skill forbids it and the narrowest external access. Tool overrides
     * are not merged (each skill's own policy layer carries them). Null for an
     * empty list.
     */
    public static SkillPermissions mostRestrictive(List<SkillPermissions> permissions) {
        if (permissions == null || permissions.isEmpty())
            return null;
        SkillScope scope = null;
        SkillDelegation delegation = null;
        SkillExternalAccess external = null;
        for (SkillPermissions p : permissions) {
            if (scope == null || p.scope().rank() < scope.rank())
                scope = p.scope();
            if (delegation == null || p.delegation() == SkillDelegation.NONE)
                delegation = p.delegation();
            if (external == null || p.external().ordinal() < external.ordinal())
                external = p.external();
        }
        return new SkillPermissions(scope, null, delegation, external);
    }

    /** Entries the model may see in its prompt. */
    public static List<SkillEntry> promptEntries(List<SkillEntry> eligible) {
        return eligible.stream()
                .filter(entry -> !entry.invocation().disableModelInvocation())
                .toList();
    }
}
