package dev.workflow.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Writes each event as one JSON object per line, flushing after every line so a
 * supervising process can tail the stream.
 */
public final class JsonLinesEventSink implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final PrintStream out;
    private final ObjectMapper mapper;

    public JsonLinesEventSink(PrintStream out, ObjectMapper mapper) {
        this.out = out;
        this.mapper = mapper;
    }

    @Override
    public void emit(WorkflowEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", event.type());
        if (event.executionId() != null) {
            node.put("executionId", event.executionId());
        }
        if (event.workflowId() != null) {
            node.put("workflowId", event.workflowId());
        }
        node.put("ts", event.ts());
        event.fields().forEach((key, value) -> node.set(key, mapper.valueToTree(value)));

        String line;
        try {
            line = mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unserializable event {}: {}", event.type(), e.getMessage());
            return;
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
