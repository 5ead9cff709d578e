package dev.workflow.backend;

import java.nio.file.Path;

/**
 * What a backend sees when it is asked to carry out one step attempt.
 *
 * @param executionId caller-supplied execution id
 * @param workspace   working directory for step actions
 * @param attempt     1-based attempt counter for this step id
 * @param iteration   enclosing loop iteration, or null outside loops
 * @param scope       variables, outputs and trigger visible to the step
 */
public record StepContext(
    String executionId,
    Path workspace,
    int attempt,
    Integer iteration,
    ConditionScope scope
) {}
