package dev.workflow.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.model.ApprovalDefault;
import dev.workflow.model.CompileError;
import dev.workflow.model.RetryPolicy;
import dev.workflow.model.Step;
import dev.workflow.model.StepCommon;
import dev.workflow.model.StepType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates raw step objects and turns them into {@link Step} values.
 * A step with any error of its own is not descended into; siblings are still checked.
 */
final class StepParser {

    private static final String THEN = "then";
    private static final String ELSE = "else";
    private static final String STEPS = "steps";
    private static final Set<String> NESTED_KEYS = Set.of(THEN, ELSE, STEPS);

    private static final long MIN_AWAIT_TIMEOUT_MS = 1000L;

    private final List<CompileError> errors;

    StepParser(List<CompileError> errors) {
        this.errors = errors;
    }

    /**
     * Parse every element of a step array. Failed elements are dropped; their errors are recorded.
     */
    List<Step> parseAll(JsonNode array, String path, boolean insideParallel) {
        var steps = new ArrayList<Step>();
        for (int i = 0; i < array.size(); i++) {
            Step step = parse(array.get(i), "%s[%d]".formatted(path, i), insideParallel);
            if (step != null) {
                steps.add(step);
            }
        }
        return steps;
    }

    private Step parse(JsonNode node, String path, boolean insideParallel) {
        if (node == null || !node.isObject()) {
            error(path + " must be an object", path);
            return null;
        }

        String rawType = node.path("type").isTextual() ? node.get("type").asText().trim() : "";
        if (rawType.isEmpty()) {
            error(path + ".type is required", path + ".type");
            return null;
        }
        var type = StepType.fromValue(rawType);
        if (type.isEmpty()) {
            error("%s.type '%s' is not a recognized step type".formatted(path, rawType), path + ".type");
            return null;
        }

        int errorsBefore = errors.size();

        String id = node.path("id").isTextual() ? node.get("id").asText().trim() : "";
        if (id.isEmpty()) {
            error(path + ".id is required", path + ".id");
        }
        checkOptionalString(node, "name", path);
        checkOptionalString(node, "outputVariable", path);
        if (node.has("continueOnError") && !node.get("continueOnError").isBoolean()) {
            error(path + ".continueOnError must be a boolean", path + ".continueOnError");
        }
        RetryPolicy retry = parseRetry(node.get("retry"), path);
        checkNestedKeysAllowed(node, type.get(), path);

        if (type.get() == StepType.APPROVAL && insideParallel) {
            error(path + " approval steps are not supported inside parallel steps", path);
        }

        // Variant checks run before descending so a broken parent hides its subtree
        checkVariant(node, type.get(), path);
        if (errors.size() > errorsBefore) {
            return null;
        }

        boolean childrenInParallel = insideParallel || type.get() == StepType.PARALLEL;
        List<Step> thenSteps = nested(node, THEN, path, childrenInParallel);
        List<Step> elseSteps = nested(node, ELSE, path, childrenInParallel);
        List<Step> bodySteps = nested(node, STEPS, path, childrenInParallel);
        if (errors.size() > errorsBefore) {
            return null;
        }

        ObjectNode definition = canonicalStep(node, id, rawType, Map.of(
            THEN, thenSteps, ELSE, elseSteps, STEPS, bodySteps));
        var common = new StepCommon(
            id,
            textOrNull(node, "name"),
            blankToNull(textOrNull(node, "outputVariable")),
            retry,
            node.path("continueOnError").asBoolean(false),
            definition);

        return switch (type.get()) {
            case AGENT -> new Step.Agent(common, firstText(node, "goal", "prompt", "content"), node.get("context"));
            case AGENT_MESSAGE -> new Step.AgentMessage(
                common,
                firstText(node, "content", "message", "goal"),
                awaitResponse(node) != null && awaitResponse(node).asBoolean(),
                awaitTimeout(node) != null ? awaitTimeout(node).asLong() : null,
                node.path("interrupt").asBoolean(false));
            case TOOL -> new Step.Tool(common, node.get("tool").asText().trim(), node.get("arguments"));
            case BASH -> new Step.Bash(common, node.get("command").asText());
            case CONDITIONAL -> new Step.Conditional(common, node.get("condition"), thenSteps, elseSteps);
            case LOOP -> new Step.Loop(common, node.get("condition"),
                node.has("maxIterations") ? node.get("maxIterations").asInt() : null, bodySteps);
            case PARALLEL -> new Step.Parallel(common, bodySteps);
            case SUBWORKFLOW -> new Step.Subworkflow(common, blankToNull(textOrNull(node, "workflowId")), bodySteps);
            case APPROVAL -> new Step.Approval(
                common,
                firstText(node, "message", "prompt"),
                items(node),
                node.has("timeoutAt") ? parseInstant(node.get("timeoutAt").asText()) : null,
                node.has("defaultAction")
                    ? ApprovalDefault.fromValue(node.get("defaultAction").asText()).orElseThrow()
                    : null);
        };
    }

    private void checkVariant(JsonNode node, StepType type, String path) {
        switch (type) {
            case BASH -> {
                if (!isNonBlankText(node.get("command"))) {
                    error(path + ".command is required for bash steps", path + ".command");
                }
            }
            case TOOL -> {
                if (!isNonBlankText(node.get("tool"))) {
                    error(path + ".tool is required for tool steps", path + ".tool");
                } else if ("bash".equals(node.get("tool").asText().trim())) {
                    error(path + ".tool must not be \"bash\"; use a bash step for shell commands", path + ".tool");
                }
            }
            case AGENT_MESSAGE -> checkAgentMessage(node, path);
            case LOOP -> {
                requireBody(node, path, "loop");
                JsonNode max = node.get("maxIterations");
                if (max != null && (!max.isIntegralNumber() || max.asLong() < 1)) {
                    error(path + ".maxIterations must be an integer >= 1", path + ".maxIterations");
                }
            }
            case PARALLEL -> requireBody(node, path, "parallel");
            case SUBWORKFLOW -> {
                boolean hasBody = node.path(STEPS).isArray() && !node.get(STEPS).isEmpty();
                boolean hasRef = isNonBlankText(node.get("workflowId"));
                if (!hasBody && !hasRef) {
                    error(path + " subworkflow step requires steps or workflowId", path);
                } else if (hasBody && hasRef) {
                    error(path + " subworkflow step accepts either steps or workflowId, not both", path);
                }
            }
            case APPROVAL -> checkApproval(node, path);
            default -> {
                // agent and conditional carry no required attributes beyond id/type
            }
        }
    }

    private void checkAgentMessage(JsonNode node, String path) {
        if (firstText(node, "content", "message", "goal") == null) {
            error(path + " agent_message step requires content (content, message, or goal)", path);
        }
        if (node.has("interrupt") && !node.get("interrupt").isBoolean()) {
            error(path + ".interrupt must be a boolean", path + ".interrupt");
        }

        JsonNode awaitResponse = awaitResponse(node);
        if (awaitResponse != null && !awaitResponse.isBoolean()) {
            error(path + ".await_response must be a boolean", path + ".await_response");
        }

        JsonNode timeout = awaitTimeout(node);
        if (timeout != null) {
            if (!timeout.isNumber() || !Double.isFinite(timeout.asDouble())
                || timeout.asDouble() < MIN_AWAIT_TIMEOUT_MS) {
                error(path + ".await_timeout_ms must be a number >= 1000", path + ".await_timeout_ms");
            } else if (awaitResponse == null) {
                error(path + ".await_timeout_ms requires await_response to be set", path + ".await_timeout_ms");
            }
        }
    }

    private void checkApproval(JsonNode node, String path) {
        if (node.has("items") && !node.get("items").isArray()) {
            error(path + ".items must be an array", path + ".items");
        }
        if (node.has("timeoutAt")) {
            JsonNode timeoutAt = node.get("timeoutAt");
            if (!timeoutAt.isTextual() || parseInstant(timeoutAt.asText()) == null) {
                error(path + ".timeoutAt must be an ISO-8601 timestamp", path + ".timeoutAt");
            }
        }
        if (node.has("defaultAction")) {
            JsonNode action = node.get("defaultAction");
            if (!action.isTextual() || ApprovalDefault.fromValue(action.asText()).isEmpty()) {
                error(path + ".defaultAction must be one of approve, deny, fail", path + ".defaultAction");
            }
        }
    }

    private void requireBody(JsonNode node, String path, String typeName) {
        JsonNode body = node.get(STEPS);
        if (body == null || body.isNull() || (body.isArray() && body.isEmpty())) {
            error("%s.steps must not be empty for %s steps".formatted(path, typeName), path + ".steps");
        }
    }

    private void checkNestedKeysAllowed(JsonNode node, StepType type, String path) {
        Set<String> allowed = switch (type) {
            case CONDITIONAL -> Set.of(THEN, ELSE);
            case LOOP, PARALLEL, SUBWORKFLOW -> Set.of(STEPS);
            default -> Set.of();
        };
        for (String key : NESTED_KEYS) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (!allowed.contains(key)) {
                error("%s.%s is not allowed on %s steps".formatted(path, key, type.value()), path + "." + key);
            } else if (!value.isArray()) {
                error("%s.%s must be an array".formatted(path, key), path + "." + key);
            }
        }
    }

    private RetryPolicy parseRetry(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return RetryPolicy.none();
        }
        if (!node.isObject()) {
            error(path + ".retry must be an object", path + ".retry");
            return RetryPolicy.none();
        }
        int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        long backoffMs = RetryPolicy.DEFAULT_BACKOFF_MS;
        JsonNode attempts = node.get("maxAttempts");
        if (attempts != null) {
            if (!attempts.isIntegralNumber() || attempts.asLong() < 1) {
                error(path + ".retry.maxAttempts must be an integer >= 1", path + ".retry.maxAttempts");
            } else {
                maxAttempts = attempts.asInt();
            }
        }
        JsonNode backoff = node.get("backoffMs");
        if (backoff != null) {
            if (!backoff.isIntegralNumber() || backoff.asLong() < 0) {
                error(path + ".retry.backoffMs must be an integer >= 0", path + ".retry.backoffMs");
            } else {
                backoffMs = backoff.asLong();
            }
        }
        return new RetryPolicy(maxAttempts, backoffMs);
    }

    private List<Step> nested(JsonNode node, String key, String path, boolean insideParallel) {
        JsonNode value = node.get(key);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        return List.copyOf(parseAll(value, path + "." + key, insideParallel));
    }

    /**
     * Canonical JSON of a step: trimmed id/type, nested bodies replaced by their canonical children,
     * every other attribute deep-sorted.
     */
    private static ObjectNode canonicalStep(JsonNode node, String id, String type, Map<String, List<Step>> nested) {
        ObjectNode copy = JsonNodeFactory.instance.objectNode();
        for (var field : node.properties()) {
            String key = field.getKey();
            if (NESTED_KEYS.contains(key) && field.getValue().isArray()) {
                ArrayNode children = JsonNodeFactory.instance.arrayNode();
                nested.get(key).forEach(child -> children.add(child.common().definition()));
                copy.set(key, children);
            } else {
                copy.set(key, field.getValue());
            }
        }
        copy.put("id", id);
        copy.put("type", type);
        return (ObjectNode) CanonicalJson.canonicalize(copy);
    }

    private void checkOptionalString(JsonNode node, String field, String path) {
        if (node.has(field) && !node.get(field).isNull() && !node.get(field).isTextual()) {
            error("%s.%s must be a string".formatted(path, field), path + "." + field);
        }
    }

    private void error(String message, String path) {
        errors.add(new CompileError(message, path));
    }

    private static JsonNode awaitResponse(JsonNode node) {
        return node.has("await_response") ? node.get("await_response") : node.get("awaitResponse");
    }

    private static JsonNode awaitTimeout(JsonNode node) {
        return node.has("await_timeout_ms") ? node.get("await_timeout_ms") : node.get("awaitTimeoutMs");
    }

    private static List<JsonNode> items(JsonNode node) {
        var items = new ArrayList<JsonNode>();
        if (node.path("items").isArray()) {
            node.get("items").forEach(items::add);
        }
        return List.copyOf(items);
    }

    private static boolean isNonBlankText(JsonNode value) {
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            if (isNonBlankText(node.get(field))) {
                return node.get(field).asText().trim();
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.path(field).isTextual() ? node.get(field).asText() : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /** Null when {@code value} is not an ISO-8601 timestamp with offset. */
    static Instant parseInstant(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
