package dev.workflow.model;

/**
 * Safety limits that keep a single invocation bounded.
 */
public record EnginePolicy(
    int maxSteps,
    int maxLoopIterations,
    int maxParallelism,
    long agentResponseTimeoutMs,
    int maxSubworkflowDepth
) {
    public static final int DEFAULT_MAX_STEPS = 50;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 25;
    public static final int DEFAULT_MAX_PARALLELISM = 8;
    public static final long DEFAULT_AGENT_RESPONSE_TIMEOUT_MS = 300_000L;
    public static final int DEFAULT_MAX_SUBWORKFLOW_DEPTH = 8;

    public static EnginePolicy defaults() {
        return new EnginePolicy(DEFAULT_MAX_STEPS, DEFAULT_MAX_LOOP_ITERATIONS, DEFAULT_MAX_PARALLELISM,
            DEFAULT_AGENT_RESPONSE_TIMEOUT_MS, DEFAULT_MAX_SUBWORKFLOW_DEPTH);
    }

    public EnginePolicy withMaxSteps(int value) {
        return new EnginePolicy(value, maxLoopIterations, maxParallelism, agentResponseTimeoutMs, maxSubworkflowDepth);
    }
}
