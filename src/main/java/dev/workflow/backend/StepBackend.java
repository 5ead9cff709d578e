package dev.workflow.backend;

import com.fasterxml.jackson.databind.JsonNode;
import dev.workflow.model.Step;
import dev.workflow.model.StepOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Host boundary for step actions. The engine owns ordering, retries and suspension;
 * a backend only carries out one attempt of one step and reports the result.
 * Implementations must be safe to call from several threads for parallel steps.
 */
public interface StepBackend {

    /** Run a shell command step. */
    StepOutcome runBash(Step.Bash step, StepContext context);

    /** Invoke a named tool with the step's arguments. */
    StepOutcome runTool(Step.Tool step, StepContext context);

    /**
     * Hand an {@code agent} or {@code agent_message} step to the agent orchestrator.
     *
     * @param step an {@link Step.Agent} or {@link Step.AgentMessage}
     */
    StepOutcome dispatchAgent(Step step, StepContext context);

    /**
     * Wait for the orchestrator's reply to a delivered {@code agent_message}.
     * The engine bounds the wait with the step's {@code await_timeout_ms}.
     */
    CompletableFuture<StepOutcome> awaitAgentResponse(Step.AgentMessage step, StepContext context);

    /** Evaluate a conditional or loop predicate. */
    default boolean evaluate(JsonNode condition, ConditionScope scope) {
        return ConditionEvaluator.evaluate(condition, scope);
    }

    /** Get backend display name. */
    String getName();
}
