package dev.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Describes the checkpoint a suspended run is waiting on.
 */
@JsonPropertyOrder({"stepId", "prompt", "items", "resumeToken", "timeoutAt", "defaultAction"})
public record ApprovalRequest(
    String stepId,
    String prompt,
    List<JsonNode> items,
    String resumeToken,
    @JsonInclude(JsonInclude.Include.NON_NULL) String timeoutAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) String defaultAction
) {}
