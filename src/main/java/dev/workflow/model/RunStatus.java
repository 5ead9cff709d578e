package dev.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal status of one run or resume invocation.
 */
public enum RunStatus {
    OK("ok"),
    NEEDS_APPROVAL("needs_approval"),
    CANCELLED("cancelled"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
