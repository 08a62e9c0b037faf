package com.skillgate.agent.tools.policy;

import java.util.*;

/**
 * Expands tool references (canonical names, aliases, {@code group:*}
 * references) into canonical tool names against a {@link ToolCatalog}.
 *
 * <p>
 * References that match nothing in the catalog are kept as their normalized
 * literal, so policies may name tools the catalog does not know yet.
 * </p>
 */
public final class ToolReferenceResolver {

    public static final ToolReferenceResolver DEFAULT = new ToolReferenceResolver(ToolCatalog.DEFAULT);

    private final ToolCatalog catalog;

    public ToolReferenceResolver(ToolCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    /**
     * Trim, lower-case and fold aliases. A hyphen/underscore spelling of a
     * known alias or tool folds to the canonical name; anything else is
     * returned as the normalized literal. Null becomes "".
     */
    public String normalize(String reference) {
        if (reference == null)
            return "";
        String normalized = reference.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || ToolCatalog.isGroupReference(normalized))
            return normalized;

        String folded = fold(normalized);
        if (folded != null)
            return folded;
        folded = fold(normalized.replace('-', '_'));
        if (folded != null)
            return folded;
        folded = fold(normalized.replace('_', '-'));
        return folded != null ? folded : normalized;
    }

    /**
     * Expand references into a set of canonical tool names. Duplicates
     * collapse; iteration order is not part of the contract.
     */
    public Set<String> expand(Collection<String> references) {
        Set<String> out = new LinkedHashSet<>();
        if (references == null)
            return out;
        Set<String> visitedGroups = new HashSet<>();
        for (String reference : references) {
            expandInto(normalize(reference), out, visitedGroups);
        }
        return out;
    }

    public Set<String> expand(String... references) {
        return expand(Arrays.asList(references));
    }

    private void expandInto(String normalized, Set<String> out, Set<String> visitedGroups) {
        if (normalized.isEmpty())
            return;
        if (!ToolCatalog.isGroupReference(normalized)) {
            out.add(normalized);
            return;
        }
        List<String> members = catalog.groupMembers(normalized);
        if (members == null) {
            // unknown group, keep the literal
            out.add(normalized);
            return;
        }
        if (!visitedGroups.add(normalized))
            return;
        for (String member : members) {
            expandInto(normalize(member), out, visitedGroups);
        }
    }

    private String fold(String candidate) {
        String target = catalog.aliasTarget(candidate);
        if (target != null)
            return target;
        return catalog.isKnownTool(candidate) ? candidate : null;
    }
}
