package com.defiguard.policy;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads and validates a policy document.
 *
 * <p>Format: {@code {"mode": "default-allow"|"default-deny", "rules": [{"tool", "allowed",
 * "rule_id", "reason"}]}}.
 *
 * <p>Every defect is fatal and raised as {@link ConfigurationException}: unreadable JSON,
 * unknown or missing mode, unknown keys, a rule naming a tool outside the closed set, a
 * rule without a boolean {@code allowed}, duplicate rules. A document is never partially
 * applied. A missing file is fatal when {@code requireFile} is set; otherwise the
 * configured fallback mode applies with no rules.
 */
public class PolicyDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyDocumentLoader.class);

    private static final Set<String> DOCUMENT_KEYS = Set.of("mode", "rules");
    private static final Set<String> RULE_KEYS = Set.of("tool", "tool_name", "allowed", "rule_id", "reason");

    private final ObjectMapper objectMapper;
    private final Resource location;
    private final boolean requireFile;
    private final PolicyMode fallbackMode;

    public PolicyDocumentLoader(
            ObjectMapper objectMapper, Resource location, boolean requireFile, PolicyMode fallbackMode) {
        this.objectMapper = objectMapper;
        this.location = location;
        this.requireFile = requireFile;
        this.fallbackMode = fallbackMode;
    }

    /** Loads the configured location, applying the missing-file rules. */
    public PolicyDocument load() {
        if (location == null || !location.exists()) {
            String where = location != null ? location.getDescription() : "<unset>";
            if (requireFile) {
                throw new ConfigurationException("Policy file not found: " + where);
            }
            log.warn("Policy file not found at {}; applying fallback mode {}", where, fallbackMode.getWireValue());
            return PolicyDocument.fromMode(fallbackMode, "fallback");
        }

        try (InputStream in = location.getInputStream()) {
            PolicyDocument document = parse(in, location.getDescription());
            log.info(
                    "Loaded policy [source={}, mode={}, rules={}]",
                    document.getSource(),
                    document.getMode().getWireValue(),
                    document.getRulesByTool().size());
            return document;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read policy file " + location.getDescription(), e);
        }
    }

    public PolicyDocument parse(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed policy document " + source + ": "
                    + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Policy document " + source + " must be a JSON object");
        }
        rejectUnknownKeys(root, DOCUMENT_KEYS, "policy document " + source);

        JsonNode modeNode = root.get("mode");
        if (modeNode == null || !modeNode.isTextual()) {
            throw new ConfigurationException("Policy document " + source + " is missing 'mode'");
        }
        PolicyMode mode = PolicyMode.fromWireValue(modeNode.asText())
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown policy mode '" + modeNode.asText() + "' in " + source
                                + " (expected default-allow or default-deny)"));

        List<PolicyRule> rules = new ArrayList<>();
        JsonNode rulesNode = root.get("rules");
        if (rulesNode != null && !rulesNode.isNull()) {
            if (!rulesNode.isArray()) {
                throw new ConfigurationException("'rules' in " + source + " must be an array");
            }
            int index = 0;
            for (JsonNode ruleNode : rulesNode) {
                rules.add(parseRule(ruleNode, source + " rules[" + index + "]"));
                index++;
            }
        }
        return PolicyDocument.of(mode, rules, source);
    }

    private PolicyRule parseRule(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new ConfigurationException("Policy rule " + where + " must be an object");
        }
        rejectUnknownKeys(node, RULE_KEYS, "policy rule " + where);

        JsonNode toolNode = node.has("tool") ? node.get("tool") : node.get("tool_name");
        if (toolNode == null || !toolNode.isTextual()) {
            throw new ConfigurationException("Policy rule " + where + " is missing 'tool'");
        }
        String toolText = toolNode.asText();
        if (!ToolName.isWellFormed(toolText)) {
            throw new ConfigurationException("Policy rule " + where + " has an invalid tool name");
        }
        ToolName toolName = ToolName.fromWireName(toolText)
                .orElseThrow(() -> new ConfigurationException(
                        "Policy rule " + where + " references unknown tool " + toolText));

        JsonNode allowedNode = node.get("allowed");
        if (allowedNode == null || !allowedNode.isBoolean()) {
            throw new ConfigurationException("Policy rule " + where + " requires a boolean 'allowed'");
        }

        return PolicyRule.builder()
                .toolName(toolName)
                .allowed(allowedNode.booleanValue())
                .ruleId(optionalText(node, "rule_id", where))
                .reason(defaultIfNull(optionalText(node, "reason", where), PolicyRule.DEFAULT_REASON))
                .build();
    }

    private static String optionalText(JsonNode node, String key, String where) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ConfigurationException("'" + key + "' in policy rule " + where + " must be a string");
        }
        return value.asText();
    }

    private static String defaultIfNull(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> allowed, String where) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new ConfigurationException("Unknown key '" + name + "' in " + where);
            }
        }
    }
}
