package com.defiguard.audit;

import com.defiguard.tool.ToolName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces the audit-safe copy of a call's arguments. Keys a tool flags as sensitive,
 * and any key that looks like secret material, are replaced with {@value #MASK} at every
 * depth. Long strings are truncated.
 */
public final class ArgumentRedactor {

    public static final String MASK = "[REDACTED]";

    static final int MAX_STRING_LENGTH = 256;

    private static final Pattern SECRET_KEY = Pattern.compile(
            "(?i).*(key|secret|private|mnemonic|seed|password|passphrase).*");

    private ArgumentRedactor() {}

    /**
     * @param toolName the resolved tool, or null when the name was not recognized
     * @param raw      arguments as received; never modified
     */
    public static JsonNode redact(ToolName toolName, JsonNode raw) {
        if (raw == null) {
            return null;
        }
        Set<String> sensitive = toolName != null ? toolName.getSensitiveArguments() : Set.of();
        return redactNode(raw.deepCopy(), sensitive);
    }

    private static JsonNode redactNode(JsonNode node, Set<String> sensitive) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (sensitive.contains(field.getKey()) || SECRET_KEY.matcher(field.getKey()).matches()) {
                    field.setValue(TextNode.valueOf(MASK));
                } else {
                    field.setValue(redactNode(field.getValue(), sensitive));
                }
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, redactNode(array.get(i), sensitive));
            }
            return array;
        }
        if (node.isTextual() && node.asText().length() > MAX_STRING_LENGTH) {
            return TextNode.valueOf(node.asText().substring(0, MAX_STRING_LENGTH) + "...[truncated]");
        }
        return node;
    }
}
