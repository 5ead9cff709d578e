package dev.workflow.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Serializable paused state of a suspended run. The host stores it next to the
 * resume token and hands it back as {@code runtime.checkpoint} on resume.
 *
 * @param stepId         approval step the run is paused at
 * @param loopIterations iteration each enclosing loop was on, keyed by loop step id
 * @param outputs        top-level output bindings at suspension time
 * @param scopes         output bindings of enclosing subworkflows, keyed by subworkflow step id
 */
@JsonPropertyOrder({"stepId", "loopIterations", "outputs", "scopes"})
public record ExecutionCheckpoint(
    String stepId,
    Map<String, Integer> loopIterations,
    Map<String, JsonNode> outputs,
    Map<String, Map<String, JsonNode>> scopes
) {}
