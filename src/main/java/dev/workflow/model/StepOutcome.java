package dev.workflow.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of handing one step action to a backend.
 */
public sealed interface StepOutcome {

    record Success(JsonNode output) implements StepOutcome {}

    record Failure(String error, JsonNode output) implements StepOutcome {}

    static StepOutcome success(JsonNode output) {
        return new Success(output);
    }

    static StepOutcome failure(String error) {
        return new Failure(error, null);
    }
}
