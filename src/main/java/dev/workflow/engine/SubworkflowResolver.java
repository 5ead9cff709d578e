package dev.workflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.model.CompileResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles workflows referenced by {@code subworkflow.workflowId} on first use.
 * Repeated lookups return the same compiled instance so step identity is stable.
 */
final class SubworkflowResolver {

    private final Map<String, JsonNode> definitions;
    private final Map<String, CompileResult> compiled = new ConcurrentHashMap<>();

    SubworkflowResolver(Map<String, JsonNode> definitions) {
        this.definitions = Map.copyOf(definitions);
    }

    Optional<CompileResult> resolve(String workflowId) {
        JsonNode definition = definitions.get(workflowId);
        if (definition == null) {
            return Optional.empty();
        }
        return Optional.of(compiled.computeIfAbsent(workflowId, id -> WorkflowCompiler.compile(definition)));
    }
}
