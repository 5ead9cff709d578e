package dev.workflow.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single node of a workflow tree. The set of variants is closed: anything the
 * compiler cannot classify never becomes a {@code Step}.
 */
public sealed interface Step {

    StepCommon common();

    default String id() {
        return common().id();
    }

    default String outputVariable() {
        return common().outputVariable();
    }

    default RetryPolicy retry() {
        return common().retry();
    }

    /** Nested steps in document order, empty for leaf steps. */
    default List<Step> children() {
        return List.of();
    }

    /** Delegate a goal to the agent orchestrator. */
    record Agent(StepCommon common, String goal, JsonNode context) implements Step {}

    /** Post a message into the agent session, optionally waiting for its reply. */
    record AgentMessage(
        StepCommon common,
        String content,
        boolean awaitResponse,
        Long awaitTimeoutMs, // nullable, >= 1000 when present
        boolean interrupt
    ) implements Step {}

    record Tool(StepCommon common, String tool, JsonNode arguments) implements Step {}

    record Bash(StepCommon common, String command) implements Step {}

    record Conditional(
        StepCommon common,
        JsonNode condition,
        List<Step> thenSteps,
        List<Step> elseSteps
    ) implements Step {
        @Override
        public List<Step> children() {
            var all = new ArrayList<Step>(thenSteps);
            all.addAll(elseSteps);
            return all;
        }
    }

    record Loop(
        StepCommon common,
        JsonNode condition, // nullable: run until the iteration bound
        Integer maxIterations, // nullable: engine policy applies
        List<Step> steps
    ) implements Step {
        @Override
        public List<Step> children() {
            return steps;
        }
    }

    record Parallel(StepCommon common, List<Step> steps) implements Step {
        @Override
        public List<Step> children() {
            return steps;
        }
    }

    /** Runs either an inline body or a workflow resolved by id at execution time. */
    record Subworkflow(
        StepCommon common,
        String workflowId, // nullable when steps are inline
        List<Step> steps
    ) implements Step {
        @Override
        public List<Step> children() {
            return steps;
        }

        public boolean isInline() {
            return !steps.isEmpty();
        }
    }

    record Approval(
        StepCommon common,
        String message,
        List<JsonNode> items,
        Instant timeoutAt,              // nullable
        ApprovalDefault defaultAction   // nullable
    ) implements Step {}
}
