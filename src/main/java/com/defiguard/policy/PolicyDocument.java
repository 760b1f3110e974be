package com.defiguard.policy;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/**
 * A loaded policy: a default mode plus at most one rule per tool, in file order.
 *
 * <p>Immutable. Reloading builds a new document and swaps it into the
 * {@link PolicyEngine}; an existing instance is never modified.
 */
@Getter
public class PolicyDocument {

    private final PolicyMode mode;

    @JsonIgnore
    private final Map<ToolName, PolicyRule> rulesByTool;

    /** Where the document came from, e.g. a resource description or "fallback". */
    private final String source;

    private final Instant loadedAt;

    private PolicyDocument(PolicyMode mode, Map<ToolName, PolicyRule> rulesByTool, String source, Instant loadedAt) {
        this.mode = mode;
        this.rulesByTool = rulesByTool;
        this.source = source;
        this.loadedAt = loadedAt;
    }

    /**
     * @throws ConfigurationException if two rules name the same tool
     */
    public static PolicyDocument of(PolicyMode mode, List<PolicyRule> rules, String source) {
        Objects.requireNonNull(mode, "mode");
        Map<ToolName, PolicyRule> byTool = new LinkedHashMap<>();
        for (PolicyRule rule : rules) {
            if (byTool.putIfAbsent(rule.getToolName(), rule) != null) {
                throw new ConfigurationException(
                        "Duplicate policy rule for tool " + rule.getToolName() + " in " + source);
            }
        }
        return new PolicyDocument(mode, Collections.unmodifiableMap(byTool), source, Instant.now());
    }

    /** A rule-less document that applies {@code mode} to every tool. */
    public static PolicyDocument fromMode(PolicyMode mode, String source) {
        return of(mode, List.of(), source);
    }

    public Optional<PolicyRule> findRule(ToolName toolName) {
        return Optional.ofNullable(rulesByTool.get(toolName));
    }

    public List<PolicyRule> getRules() {
        return List.copyOf(rulesByTool.values());
    }
}
