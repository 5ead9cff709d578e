package dev.workflow.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Recognized values of a step's {@code type} attribute.
 */
public enum StepType {
    AGENT("agent"),
    AGENT_MESSAGE("agent_message"),
    TOOL("tool"),
    BASH("bash"),
    CONDITIONAL("conditional"),
    LOOP("loop"),
    PARALLEL("parallel"),
    SUBWORKFLOW("subworkflow"),
    APPROVAL("approval");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<StepType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
