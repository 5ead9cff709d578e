package dev.workflow.event;

/**
 * Receives progress events. The engine may call {@link #emit} from several threads.
 */
@FunctionalInterface
public interface EventSink {

    void emit(WorkflowEvent event);
}
