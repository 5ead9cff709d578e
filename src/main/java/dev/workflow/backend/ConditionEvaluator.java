package dev.workflow.backend;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Default predicate semantics for conditional and loop steps.
 * Supported forms: a JSON boolean, {@code {"variable": name}} (truthiness),
 * {@code {"variable": name, "equals": value}} and {@code {"variable": name, "notEquals": value}}.
 * Anything else is false.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {}

    public static boolean evaluate(JsonNode condition, ConditionScope scope) {
        if (condition == null || condition.isNull() || condition.isMissingNode()) {
            return false;
        }
        if (condition.isBoolean()) {
            return condition.asBoolean();
        }
        if (!condition.isObject() || !condition.path("variable").isTextual()) {
            return false;
        }

        JsonNode current = scope.lookup(condition.get("variable").asText());
        if (condition.has("equals")) {
            return sameValue(current, condition.get("equals"));
        }
        if (condition.has("notEquals")) {
            return !sameValue(current, condition.get("notEquals"));
        }
        return isTruthy(current);
    }

    private static boolean sameValue(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        return left.equals(right);
    }

    static boolean isTruthy(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0.0;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        return true;
    }
}
