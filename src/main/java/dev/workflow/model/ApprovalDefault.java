package dev.workflow.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * What an approval step does when its {@code timeoutAt} passes without a decision.
 */
public enum ApprovalDefault {
    APPROVE("approve"),
    DENY("deny"),
    FAIL("fail");

    private final String value;

    ApprovalDefault(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ApprovalDefault> fromValue(String value) {
        return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst();
    }
}
