package dev.workflow.event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One progress or audit event. Exactly one of {@code executionId} / {@code workflowId} is set.
 */
public record WorkflowEvent(
    String type,
    String executionId, // nullable
    String workflowId,  // nullable
    String ts,
    Map<String, Object> fields
) {

    public static WorkflowEvent forExecution(String type, String executionId, String ts) {
        return new WorkflowEvent(type, executionId, null, ts, Map.of());
    }

    public static WorkflowEvent forWorkflow(String type, String workflowId, String ts) {
        return new WorkflowEvent(type, null, workflowId, ts, Map.of());
    }

    /** Copy of this event with one more attribute. Null values are dropped. */
    public WorkflowEvent with(String key, Object value) {
        if (value == null) {
            return this;
        }
        var copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new WorkflowEvent(type, executionId, workflowId, ts, copy);
    }
}
