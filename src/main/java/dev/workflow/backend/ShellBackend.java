package dev.workflow.backend;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.model.Step;
import dev.workflow.model.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs {@code bash} steps for real with {@code bash -c} inside the workspace.
 * Every other step kind is dispatched like {@link DispatchBackend}.
 */
public class ShellBackend extends DispatchBackend {

    public static final String NAME = "shell";

    private static final Logger logger = LoggerFactory.getLogger(ShellBackend.class);

    static final int MAX_CAPTURED_CHARS = 16_384;

    @Override
    public StepOutcome runBash(Step.Bash step, StepContext context) {
        var builder = new ProcessBuilder("bash", "-c", step.command())
            .redirectErrorStream(true);
        if (context.workspace() != null) {
            builder.directory(context.workspace().toFile());
        }
        builder.environment().put("WORKFLOW_EXECUTION_ID", context.executionId());
        builder.environment().put("WORKFLOW_STEP_ID", step.id());
        builder.environment().put("WORKFLOW_STEP_ATTEMPT", Integer.toString(context.attempt()));

        logger.debug("Running bash step {} (attempt {}): {}", step.id(), context.attempt(), step.command());
        try {
            Process process = builder.start();
            process.getOutputStream().close();
            String captured = readCapped(process.getInputStream());
            int exitCode = process.waitFor();

            ObjectNode out = descriptor(step, "bash");
            out.put("command", step.command());
            out.put("exitCode", exitCode);
            out.put("output", captured);
            if (exitCode != 0) {
                return new StepOutcome.Failure("Command exited with status " + exitCode, out);
            }
            return StepOutcome.success(out);
        } catch (IOException e) {
            return StepOutcome.failure("Failed to start command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepOutcome.failure("Interrupted while waiting for command");
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    /** Read the whole stream, keeping only the last {@link #MAX_CAPTURED_CHARS} characters. */
    private static String readCapped(InputStream stream) throws IOException {
        String all = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        return all.length() <= MAX_CAPTURED_CHARS ? all : all.substring(all.length() - MAX_CAPTURED_CHARS);
    }
}
