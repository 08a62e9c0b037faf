package com.skillgate.agent.tools.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Dispatch-time check of a tool name against a composed {@link ToolPolicy}.
 *
 * <p>
 * A tool is refused when it matches the deny list, or when an allow list is
 * present and the tool does not match it. Entries are expanded through the
 * {@link ToolReferenceResolver}, so deny lists may name groups the dispatcher
 * understands. {@code *} works as a wildcard ({@code "*"}, {@code "web_*"}).
 * </p>
 */
@Slf4j
public final class ToolPolicyMatcher {

    public static final ToolPolicyMatcher DEFAULT = new ToolPolicyMatcher(ToolReferenceResolver.DEFAULT);

    private final ToolReferenceResolver resolver;

    public ToolPolicyMatcher(ToolReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    private sealed interface CompiledPattern permits AllPattern, ExactPattern, RegexPattern {
    }

    private record AllPattern() implements CompiledPattern {
    }

    private record ExactPattern(String value) implements CompiledPattern {
    }

    private record RegexPattern(Pattern value) implements CompiledPattern {
    }

    private static CompiledPattern compilePattern(String normalized) {
        if ("*".equals(normalized))
            return new AllPattern();
        if (!normalized.contains("*"))
            return new ExactPattern(normalized);
        String escaped = Pattern.quote(normalized).replace("*", "\\E.*\\Q");
        return new RegexPattern(Pattern.compile("^" + escaped + "$"));
    }

    private List<CompiledPattern> compilePatterns(List<String> patterns) {
        if (patterns == null || patterns.isEmpty())
            return List.of();
        return resolver.expand(patterns).stream()
                .map(ToolPolicyMatcher::compilePattern)
                .toList();
    }

    private static boolean matchesAny(String name, List<CompiledPattern> patterns) {
        for (CompiledPattern p : patterns) {
            if (p instanceof AllPattern)
                return true;
            if (p instanceof ExactPattern e && name.equals(e.value()))
                return true;
            if (p instanceof RegexPattern r && r.value().matcher(name).matches())
                return true;
        }
        return false;
    }

    /**
     * Whether {@code toolName} may be invoked under {@code policy}. A null
     * policy allows everything; a blank name is never allowed.
     */
    public boolean isToolAllowed(String toolName, ToolPolicy policy) {
        if (toolName == null || toolName.isBlank())
            return false;
        if (policy == null)
            return true;
        return test(resolver.normalize(toolName), compilePatterns(policy.deny()),
                policy.allow() != null ? compilePatterns(policy.allow()) : null);
    }

    /**
     * Keep only the tool names {@code policy} allows, in input order.
     */
    public List<String> filterToolNames(Collection<String> toolNames, ToolPolicy policy) {
        List<CompiledPattern> deny = policy != null ? compilePatterns(policy.deny()) : List.of();
        List<CompiledPattern> allow = policy != null && policy.allow() != null ? compilePatterns(policy.allow()) : null;
        List<String> result = new ArrayList<>();
        for (String name : toolNames) {
            if (name == null || name.isBlank())
                continue;
            if (policy == null || test(resolver.normalize(name), deny, allow)) {
                result.add(name);
            }
        }
        return result;
    }

    private static boolean test(String normalized, List<CompiledPattern> deny, List<CompiledPattern> allow) {
        if (matchesAny(normalized, deny)) {
            log.debug("Tool '{}' denied by deny-list", normalized);
            return false;
        }
        if (allow == null)
            return true;
        if (matchesAny(normalized, allow))
            return true;
        log.debug("Tool '{}' not in allow-list", normalized);
        return false;
    }
}
