package dev.workflow.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Map;

/**
 * Read-only view of the values a condition can refer to. Lookup order is
 * step outputs, then variables, then trigger attributes.
 */
public record ConditionScope(
    Map<String, JsonNode> outputs,
    Map<String, JsonNode> variables,
    JsonNode trigger
) {

    /**
     * Resolve a possibly dotted name. The first segment selects the binding, the rest walk into objects.
     */
    public JsonNode lookup(String name) {
        String[] segments = name.split("\\.");
        JsonNode current = resolveRoot(segments[0]);
        for (int i = 1; i < segments.length && !current.isMissingNode(); i++) {
            current = current.path(segments[i]);
        }
        return current;
    }

    private JsonNode resolveRoot(String key) {
        if (outputs.containsKey(key)) {
            return outputs.get(key);
        }
        if (variables.containsKey(key)) {
            return variables.get(key);
        }
        if ("trigger".equals(key) && trigger != null) {
            return trigger;
        }
        if (trigger != null && trigger.has(key)) {
            return trigger.get(key);
        }
        return MissingNode.getInstance();
    }
}
