package com.skillgate.agent.tools.policy;

import java.util.List;

/**
 * One layer of tool policy: allow and/or deny lists of tool references.
 *
 * <ul>
 * <li>{@code allow == null}: the layer does not restrict what is allowed.</li>
 * <li>{@code allow} empty: the layer permits nothing.</li>
 * <li>{@code deny == null}: the layer adds no denials.</li>
 * </ul>
 *
 * A missing layer (no opinion at all) is represented by a null
 * {@code ToolPolicy} reference, not by an instance.
 */
public record ToolPolicy(List<String> allow, List<String> deny) {

    /** No restriction. */
    public static final ToolPolicy EMPTY = new ToolPolicy(null, null);

    public ToolPolicy {
        allow = allow != null ? List.copyOf(allow) : null;
        deny = deny != null ? List.copyOf(deny) : null;
    }

    public static ToolPolicy allowOnly(List<String> allow) {
        return new ToolPolicy(allow, null);
    }

    public static ToolPolicy denyOnly(List<String> deny) {
        return new ToolPolicy(null, deny);
    }

    public boolean hasAllow() {
        return allow != null;
    }

    public boolean hasDeny() {
        return deny != null;
    }

    public boolean isUnrestricted() {
        return allow == null && (deny == null || deny.isEmpty());
    }
}
