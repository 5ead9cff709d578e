package dev.workflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.workflow.model.EnginePolicy;
import dev.workflow.model.ExecutionCheckpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed stdin payload of {@code run} and {@code resume --decision approve}.
 *
 * @param workflow  raw workflow definition, compiled by the caller
 * @param trigger   trigger metadata, an empty object when absent
 * @param variables run variables
 * @param runtime   host-provided runtime state
 * @param workflows definitions that {@code subworkflow} steps may reference by id
 */
public record RunPayload(
    JsonNode workflow,
    JsonNode trigger,
    Map<String, JsonNode> variables,
    RuntimeOptions runtime,
    Map<String, JsonNode> workflows
) {

    /**
     * Host runtime state carried between invocations.
     *
     * @param attempt        how many times the host has dispatched this execution (1-based)
     * @param idempotencyKey nullable
     * @param policy         nullable overrides of {@link EnginePolicy} fields
     * @param checkpoint     nullable paused state returned by the previous invocation
     */
    public record RuntimeOptions(
        int attempt,
        String idempotencyKey,
        JsonNode policy,
        ExecutionCheckpoint checkpoint
    ) {
        static RuntimeOptions empty() {
            return new RuntimeOptions(1, null, null, null);
        }

        /** Apply {@code policy.*} overrides on top of {@code base}. */
        public EnginePolicy applyTo(EnginePolicy base) {
            if (policy == null || !policy.isObject()) {
                return base;
            }
            return new EnginePolicy(
                positiveInt(policy.get("maxSteps"), base.maxSteps()),
                positiveInt(policy.get("maxLoopIterations"), base.maxLoopIterations()),
                positiveInt(policy.get("maxParallelism"), base.maxParallelism()),
                policy.path("agentResponseTimeoutMs").isIntegralNumber()
                    && policy.get("agentResponseTimeoutMs").asLong() > 0
                    ? policy.get("agentResponseTimeoutMs").asLong() : base.agentResponseTimeoutMs(),
                positiveInt(policy.get("maxSubworkflowDepth"), base.maxSubworkflowDepth()));
        }

        private static int positiveInt(JsonNode node, int fallback) {
            return node != null && node.isIntegralNumber() && node.asInt() > 0 ? node.asInt() : fallback;
        }
    }

    public static RunPayload parse(JsonNode root, String command) throws PayloadException {
        if (root == null || !root.isObject()) {
            throw new PayloadException(command + " payload must be a JSON object");
        }
        JsonNode workflow = root.get("workflow");
        if (workflow == null || workflow.isNull()) {
            throw new PayloadException(command + " payload must include workflow object");
        }

        JsonNode trigger = root.path("trigger");
        if (!trigger.isMissingNode() && !trigger.isNull() && !trigger.isObject()) {
            throw new PayloadException("trigger must be an object");
        }

        return new RunPayload(
            workflow,
            trigger.isObject() ? trigger : JsonNodeFactory.instance.objectNode(),
            objectEntries(root.get("variables"), "variables"),
            parseRuntime(root.get("runtime")),
            objectEntries(root.get("workflows"), "workflows"));
    }

    private static RuntimeOptions parseRuntime(JsonNode node) throws PayloadException {
        if (node == null || node.isNull()) {
            return RuntimeOptions.empty();
        }
        if (!node.isObject()) {
            throw new PayloadException("runtime must be an object");
        }
        int attempt = node.path("attempt").isIntegralNumber() && node.get("attempt").asInt() > 0
            ? node.get("attempt").asInt() : 1;
        String idempotencyKey = node.path("idempotencyKey").isTextual() ? node.get("idempotencyKey").asText() : null;
        return new RuntimeOptions(attempt, idempotencyKey, node.get("policy"), parseCheckpoint(node.get("checkpoint")));
    }

    static ExecutionCheckpoint parseCheckpoint(JsonNode node) throws PayloadException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject() || !node.path("stepId").isTextual() || node.get("stepId").asText().isBlank()) {
            throw new PayloadException("runtime.checkpoint must be an object with a stepId");
        }

        var loopIterations = new LinkedHashMap<String, Integer>();
        for (var entry : node.path("loopIterations").properties()) {
            if (!entry.getValue().isIntegralNumber() || entry.getValue().asInt() < 1) {
                throw new PayloadException("runtime.checkpoint.loopIterations values must be integers >= 1");
            }
            loopIterations.put(entry.getKey(), entry.getValue().asInt());
        }

        var scopes = new LinkedHashMap<String, Map<String, JsonNode>>();
        for (var entry : node.path("scopes").properties()) {
            scopes.put(entry.getKey(), objectEntries(entry.getValue(), "runtime.checkpoint.scopes." + entry.getKey()));
        }

        return new ExecutionCheckpoint(
            node.get("stepId").asText().trim(),
            loopIterations,
            objectEntries(node.get("outputs"), "runtime.checkpoint.outputs"),
            scopes);
    }

    private static Map<String, JsonNode> objectEntries(JsonNode node, String field) throws PayloadException {
        var entries = new LinkedHashMap<String, JsonNode>();
        if (node == null || node.isNull()) {
            return entries;
        }
        if (!node.isObject()) {
            throw new PayloadException(field + " must be an object");
        }
        for (var entry : node.properties()) {
            entries.put(entry.getKey(), entry.getValue());
        }
        return entries;
    }
}
