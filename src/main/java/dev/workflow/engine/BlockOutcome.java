package dev.workflow.engine;

import dev.workflow.model.ApprovalRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a block of steps ended.
 */
sealed interface BlockOutcome {

    BlockOutcome COMPLETED = new Completed();

    record Completed() implements BlockOutcome {}

    record Failed(String error) implements BlockOutcome {}

    /** Ended the run early without it being a failure, e.g. an approval defaulting to deny. */
    record Cancelled(String error) implements BlockOutcome {}

    /**
     * Paused at an approval. Enclosing loops and subworkflows add their position
     * while the outcome travels back up.
     */
    record Suspended(
        ApprovalRequest approval,
        Map<String, Integer> loopIterations,
        Map<String, Map<String, JsonNode>> scopes
    ) implements BlockOutcome {

        static Suspended at(ApprovalRequest approval) {
            return new Suspended(approval, new LinkedHashMap<>(), new LinkedHashMap<>());
        }
    }
}
