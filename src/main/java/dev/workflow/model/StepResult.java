package dev.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Per-step outcome recorded in an execution envelope.
 * {@code attempt} counts every execution of the step id within the invocation,
 * so loop iterations and retries both get distinct values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"stepId", "status", "attempt", "iteration", "startedAt", "completedAt", "output", "error"})
public record StepResult(
    String stepId,
    StepStatus status,
    int attempt,
    Integer iteration,   // nullable, set inside loop bodies
    String startedAt,    // ISO-8601
    String completedAt,  // ISO-8601
    JsonNode output,
    String error
) {

    public static StepResult running(String stepId, int attempt, Integer iteration, String startedAt) {
        return new StepResult(stepId, StepStatus.RUNNING, attempt, iteration, startedAt, null, null, null);
    }

    public static StepResult skipped(String stepId, String at) {
        return new StepResult(stepId, StepStatus.SKIPPED, 1, null, null, at, null, null);
    }

    public StepResult complete(String at, JsonNode output) {
        return new StepResult(stepId, StepStatus.COMPLETED, attempt, iteration, startedAt, at, output, null);
    }

    public StepResult fail(String at, JsonNode output, String error) {
        return new StepResult(stepId, StepStatus.FAILED, attempt, iteration, startedAt, at, output, error);
    }

    public StepResult waitForApproval(String at, JsonNode output) {
        return new StepResult(stepId, StepStatus.WAITING_APPROVAL, attempt, iteration, startedAt, at, output, null);
    }
}
