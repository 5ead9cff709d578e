package dev.workflow.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable bookkeeping for one run or resume invocation.
 * Shared by parallel branches, so counters are thread-safe.
 */
final class ExecutionState {

    private final String executionId;
    private final String workflowHash;
    private final AtomicInteger stepCount = new AtomicInteger();
    private final Map<String, Integer> stepAttempts = new ConcurrentHashMap<>();
    private volatile ResumeTarget fastForwardTo;

    ExecutionState(String executionId, String workflowHash, ResumeTarget fastForwardTo) {
        this.executionId = executionId;
        this.workflowHash = workflowHash;
        this.fastForwardTo = fastForwardTo;
    }

    String executionId() { return executionId; }
    String workflowHash() { return workflowHash; }
    int stepCount() { return stepCount.get(); }

    /** Count one more visited step and return the new total. */
    int visitStep() {
        return stepCount.incrementAndGet();
    }

    /** Next 1-based attempt number for a step id; every execution of the id gets a new one. */
    int nextAttempt(String stepId) {
        return stepAttempts.merge(stepId, 1, Integer::sum);
    }

    /** True while a resume is still skipping work finished before the checkpoint. */
    boolean fastForwarding() {
        return fastForwardTo != null;
    }

    ResumeTarget fastForwardTarget() {
        return fastForwardTo;
    }

    void reachedCheckpoint() {
        this.fastForwardTo = null;
    }
}
