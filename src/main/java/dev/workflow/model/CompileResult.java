package dev.workflow.model;

import java.util.List;

/**
 * Outcome of {@code WorkflowCompiler.compile}: either a compiled workflow or a non-empty error list.
 */
public record CompileResult(
    boolean ok,
    CompiledWorkflow workflow, // null when !ok
    List<CompileError> errors
) {
    public static CompileResult success(CompiledWorkflow workflow) {
        return new CompileResult(true, workflow, List.of());
    }

    public static CompileResult failure(List<CompileError> errors) {
        return new CompileResult(false, null, List.copyOf(errors));
    }

    public String firstErrorMessage() {
        return errors.isEmpty() ? "Workflow compilation failed" : errors.get(0).message();
    }
}
