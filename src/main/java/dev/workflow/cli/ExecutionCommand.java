package dev.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.backend.StepBackend;
import dev.workflow.backend.StepBackends;
import dev.workflow.compiler.CanonicalJson;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.engine.PayloadException;
import dev.workflow.engine.RunPayload;
import dev.workflow.engine.WorkflowEngine;
import dev.workflow.model.CompileResult;
import dev.workflow.model.CompiledWorkflow;
import dev.workflow.model.EnginePolicy;
import dev.workflow.model.ExecutionRun;
import dev.workflow.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared flow of {@code run} and {@code resume --decision approve}: read the payload,
 * compile, check the hash, execute, print the envelope.
 */
abstract class ExecutionCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionCommand.class);

    static final String HASH_MISMATCH = "workflow_hash_mismatch";
    static final String COMPILE_ERROR = "workflow_compile_error";

    @Option(names = "--execution-id", description = "Execution id assigned by the host")
    String executionId;

    @Option(names = "--workflow-hash", description = "Expected workflow hash, bare or sha256:-prefixed")
    String workflowHash;

    @Option(names = "--workspace", description = "Working directory for step actions")
    String workspace;

    @Option(names = "--backend", defaultValue = "dispatch",
        description = "Step backend: dispatch, shell (default: ${DEFAULT-VALUE})")
    String backend;

    @Option(names = "--max-steps", description = "Override the maxSteps guardrail")
    Integer maxSteps;

    final CliContext context;

    ExecutionCommand(CliContext context) {
        this.context = context;
    }

    @FunctionalInterface
    interface EngineCall {
        ExecutionRun apply(WorkflowEngine engine, CompiledWorkflow workflow, RunPayload payload, Path workspace);
    }

    int compileAndExecute(String command, EngineCall call) throws IOException {
        StepBackend stepBackend;
        try {
            stepBackend = StepBackends.forName(backend);
        } catch (IllegalArgumentException e) {
            return context.fail(e.getMessage(), ExitCodes.USAGE);
        }
        if (maxSteps != null && maxSteps < 1) {
            return context.fail("--max-steps must be >= 1", ExitCodes.USAGE);
        }

        String raw = context.readStdin();
        if (raw.isEmpty()) {
            return context.fail(command + " requires JSON payload on stdin", ExitCodes.INVALID_INPUT);
        }

        RunPayload payload;
        try {
            payload = RunPayload.parse(context.mapper().readTree(raw), command);
        } catch (JsonProcessingException e) {
            return context.fail("Invalid JSON input for " + command + " payload", ExitCodes.INVALID_INPUT);
        } catch (PayloadException e) {
            return context.fail(e.getMessage(), ExitCodes.INVALID_INPUT);
        }

        CompileResult compiled = WorkflowCompiler.compile(payload.workflow());
        if (!compiled.ok()) {
            ObjectNode envelope = context.mapper().valueToTree(
                ExecutionRun.rejected(executionId, COMPILE_ERROR + ": " + compiled.firstErrorMessage()));
            envelope.set("errors", context.mapper().valueToTree(compiled.errors()));
            context.printJson(envelope);
            return ExitCodes.INVALID_INPUT;
        }

        String expected = CanonicalJson.normalizeHash(workflowHash);
        String actual = compiled.workflow().workflowHash();
        if (!expected.equals(actual)) {
            context.err().println("Workflow hash mismatch: expected %s, got %s".formatted(expected, actual));
            context.printJson(ExecutionRun.rejected(executionId,
                "%s: expected %s, got %s".formatted(HASH_MISMATCH, expected, actual)));
            return ExitCodes.USAGE;
        }

        EnginePolicy policy = payload.runtime().applyTo(EnginePolicy.defaults());
        if (maxSteps != null) {
            policy = policy.withMaxSteps(maxSteps);
        }
        logger.debug("{} {} with backend {} and policy {}", command, executionId, stepBackend.getName(), policy);

        var engine = new WorkflowEngine(stepBackend, context.events(), context.clock(), policy);
        ExecutionRun result = call.apply(engine, compiled.workflow(), payload, Path.of(workspace));
        context.printJson(result);
        return result.status() == RunStatus.FAILED ? ExitCodes.EXECUTION_FAILED : ExitCodes.OK;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
