package dev.workflow.cli;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.workflow.model.CompileError;
import dev.workflow.model.CompileResult;

import java.util.List;

/**
 * Result line of {@code validate}.
 */
@JsonPropertyOrder({"ok", "status", "workflowHash", "stepOrder", "errors"})
record ValidationReport(
    boolean ok,
    String status,
    String workflowHash,
    List<String> stepOrder,
    List<CompileError> errors
) {

    static ValidationReport of(CompileResult result) {
        if (result.ok()) {
            return new ValidationReport(true, "valid", result.workflow().workflowHash(),
                result.workflow().stepOrder(), List.of());
        }
        return invalid(result.errors());
    }

    static ValidationReport invalid(List<CompileError> errors) {
        return new ValidationReport(false, "invalid", null, List.of(), errors);
    }
}
