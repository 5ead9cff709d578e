package dev.workflow.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.model.Step;
import dev.workflow.model.StepOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Default backend: records what each step would hand to the host and reports success.
 * The embedding session picks the recorded descriptors up from the result envelope.
 */
public class DispatchBackend implements StepBackend {

    public static final String NAME = "dispatch";

    @Override
    public StepOutcome runBash(Step.Bash step, StepContext context) {
        ObjectNode out = descriptor(step, "bash");
        out.put("command", step.command());
        return StepOutcome.success(out);
    }

    @Override
    public StepOutcome runTool(Step.Tool step, StepContext context) {
        ObjectNode out = descriptor(step, "tool");
        out.put("tool", step.tool());
        out.set("arguments", orNull(step.arguments()));
        return StepOutcome.success(out);
    }

    @Override
    public StepOutcome dispatchAgent(Step step, StepContext context) {
        if (step instanceof Step.AgentMessage message) {
            ObjectNode out = descriptor(step, "agent_message");
            out.put("content", message.content());
            out.put("interrupt", message.interrupt());
            out.put("delivered", true);
            return StepOutcome.success(out);
        }
        if (step instanceof Step.Agent agent) {
            ObjectNode out = descriptor(step, "agent");
            out.put("goal", agent.goal());
            out.set("context", orNull(agent.context()));
            return StepOutcome.success(out);
        }
        return StepOutcome.failure("Not an agent step: " + step.id());
    }

    @Override
    public CompletableFuture<StepOutcome> awaitAgentResponse(Step.AgentMessage step, StepContext context) {
        // No orchestrator is attached in dispatch mode; the reply is left for the host to fill in
        ObjectNode out = descriptor(step, "agent_message");
        out.put("content", step.content());
        out.put("awaited", true);
        out.putNull("response");
        return CompletableFuture.completedFuture(StepOutcome.success(out));
    }

    @Override
    public String getName() {
        return NAME;
    }

    protected static ObjectNode descriptor(Step step, String type) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.put("type", type);
        out.put("name", step.common().displayName());
        return out;
    }

    private static JsonNode orNull(JsonNode value) {
        return value == null ? JsonNodeFactory.instance.nullNode() : value;
    }
}
