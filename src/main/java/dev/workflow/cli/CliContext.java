package dev.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflow.event.EventSink;
import dev.workflow.event.JsonLinesEventSink;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Streams and clock a command runs against. Tests swap in buffers and a fixed clock.
 *
 * @param in  payload source, read to completion before anything executes
 * @param out receives exactly one JSON result line
 * @param err receives JSON event lines and plain diagnostics
 */
public record CliContext(
    InputStream in,
    PrintStream out,
    PrintStream err,
    Clock clock,
    ObjectMapper mapper
) {

    public static CliContext system() {
        return new CliContext(System.in, System.out, System.err, Clock.systemUTC(), new ObjectMapper());
    }

    String readStdin() throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
    }

    void printJson(Object value) throws JsonProcessingException {
        out.println(mapper.writeValueAsString(value));
        out.flush();
    }

    /** Report a diagnostic on stderr and hand back the exit code to return. */
    int fail(String message, int exitCode) {
        err.println(message);
        err.flush();
        return exitCode;
    }

    EventSink events() {
        return new JsonLinesEventSink(err, mapper);
    }
}
