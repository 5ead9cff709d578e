package dev.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Result envelope of one {@code run} or {@code resume} invocation.
 */
@JsonPropertyOrder({"ok", "status", "executionId", "workflowHash", "output", "steps",
    "requiresApproval", "checkpoint", "error"})
public record ExecutionRun(
    boolean ok,
    RunStatus status,
    String executionId,
    @JsonInclude(JsonInclude.Include.NON_NULL) String workflowHash,
    Map<String, JsonNode> output,
    List<StepResult> steps,
    ApprovalRequest requiresApproval,
    @JsonInclude(JsonInclude.Include.NON_NULL) ExecutionCheckpoint checkpoint,
    String error
) {

    public static ExecutionRun completed(String executionId, String workflowHash,
                                         Map<String, JsonNode> output, List<StepResult> steps) {
        return new ExecutionRun(true, RunStatus.OK, executionId, workflowHash, output, steps, null, null, null);
    }

    public static ExecutionRun failed(String executionId, String workflowHash,
                                      Map<String, JsonNode> output, List<StepResult> steps, String error) {
        return new ExecutionRun(false, RunStatus.FAILED, executionId, workflowHash, output, steps, null, null, error);
    }

    public static ExecutionRun cancelled(String executionId, String workflowHash,
                                         Map<String, JsonNode> output, List<StepResult> steps, String error) {
        return new ExecutionRun(true, RunStatus.CANCELLED, executionId, workflowHash, output, steps, null, null, error);
    }

    public static ExecutionRun awaitingApproval(String executionId, String workflowHash,
                                                Map<String, JsonNode> output, List<StepResult> steps,
                                                ApprovalRequest approval, ExecutionCheckpoint checkpoint) {
        return new ExecutionRun(true, RunStatus.NEEDS_APPROVAL, executionId, workflowHash, output, steps,
            approval, checkpoint, null);
    }

    /** Envelope for a run rejected before the engine was invoked. */
    public static ExecutionRun rejected(String executionId, String error) {
        return failed(executionId, null, Map.of(), List.of(), error);
    }
}
