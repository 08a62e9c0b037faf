package com.skillgate.agent.tools.policy;

import java.util.*;

/**
 * Combines policy layers (profile, user tier, skill, ...) into one net policy.
 *
 * <ul>
 * <li>Null layers have no opinion and are skipped.</li>
 * <li>{@code allow} is the intersection of the expanded allow sets of the
 * layers that declare one. A layer without {@code allow} is not an operand.
 * An empty allow on any layer forces an empty result.</li>
 * <li>{@code deny} is the ordered, deduplicated union of every layer's deny
 * entries, taken literally. Group references in deny lists are not expanded
 * here.</li>
 * </ul>
 *
 * The result is never null; with no participating layers it is
 * {@link ToolPolicy#EMPTY}.
 */
public final class ToolPolicyComposer {

    public static final ToolPolicyComposer DEFAULT = new ToolPolicyComposer(ToolReferenceResolver.DEFAULT);

    private final ToolReferenceResolver resolver;

    public ToolPolicyComposer(ToolReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ToolPolicy compose(ToolPolicy... layers) {
        return compose(Arrays.asList(layers));
    }

    public ToolPolicy compose(List<ToolPolicy> layers) {
        if (layers == null || layers.isEmpty())
            return ToolPolicy.EMPTY;

        Set<String> allow = null;
        Set<String> deny = null;
        for (ToolPolicy layer : layers) {
            if (layer == null)
                continue;
            if (layer.allow() != null) {
                Set<String> expanded = resolver.expand(layer.allow());
                if (allow == null) {
                    allow = new LinkedHashSet<>(expanded);
                } else {
                    allow.retainAll(expanded);
                }
            }
            if (layer.deny() != null) {
                if (deny == null)
                    deny = new LinkedHashSet<>();
                deny.addAll(layer.deny());
            }
        }
        return new ToolPolicy(
                allow != null ? new ArrayList<>(allow) : null,
                deny != null ? new ArrayList<>(deny) : null);
    }
}
