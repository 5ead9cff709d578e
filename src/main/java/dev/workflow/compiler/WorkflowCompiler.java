package dev.workflow.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.model.CompileError;
import dev.workflow.model.CompileResult;
import dev.workflow.model.CompiledWorkflow;
import dev.workflow.model.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a raw workflow definition and produces its canonical, hashed form.
 * Malformed input is reported through {@link CompileResult#errors()}, never thrown.
 */
public final class WorkflowCompiler {

    private static final String ROOT = "workflow";

    private WorkflowCompiler() {}

    public static CompileResult compile(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return CompileResult.failure(List.of(new CompileError("workflow must be an object", ROOT)));
        }

        JsonNode rootSteps = raw.get("steps");
        if (rootSteps == null || !rootSteps.isArray()) {
            return CompileResult.failure(List.of(
                new CompileError("workflow.steps must be an array", ROOT + ".steps")));
        }
        if (rootSteps.isEmpty()) {
            return CompileResult.failure(List.of(
                new CompileError("workflow.steps must not be empty", ROOT + ".steps")));
        }

        var errors = new ArrayList<CompileError>();
        List<Step> steps = new StepParser(errors).parseAll(rootSteps, ROOT + ".steps", false);
        if (!errors.isEmpty()) {
            return CompileResult.failure(errors);
        }

        ObjectNode canonical = canonicalRoot(raw, steps);
        String workflowHash = CanonicalJson.HASH_PREFIX + CanonicalJson.sha256Hex(CanonicalJson.serialize(canonical));

        return CompileResult.success(new CompiledWorkflow(
            canonical, workflowHash, StepOrder.of(steps), List.copyOf(steps)));
    }

    private static ObjectNode canonicalRoot(JsonNode raw, List<Step> steps) {
        ObjectNode root = ((ObjectNode) raw).deepCopy();
        ArrayNode canonicalSteps = JsonNodeFactory.instance.arrayNode();
        steps.forEach(step -> canonicalSteps.add(step.common().definition()));
        root.set("steps", canonicalSteps);
        return (ObjectNode) CanonicalJson.canonicalize(root);
    }
}
