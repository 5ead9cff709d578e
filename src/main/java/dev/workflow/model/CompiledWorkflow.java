package dev.workflow.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Immutable result of a successful compile. Two compiles of semantically identical
 * definitions produce equal {@code workflowHash} values.
 */
public record CompiledWorkflow(
    ObjectNode canonical,
    String workflowHash,
    List<String> stepOrder,
    List<Step> steps
) {}
