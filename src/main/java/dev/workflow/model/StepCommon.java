package dev.workflow.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Attributes shared by every step variant.
 */
public record StepCommon(
    String id,
    String name,          // nullable
    String outputVariable, // nullable
    RetryPolicy retry,
    boolean continueOnError,
    ObjectNode definition // canonical JSON of the step, handed to backends as-is
) {

    public String displayName() {
        return name != null ? name : id;
    }
}
