package dev.workflow.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.model.Step;
import dev.workflow.model.StepOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShellBackendTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path workspace;

    private static Step.Bash bash(String command) throws Exception {
        var workflow = MAPPER.createObjectNode();
        var step = workflow.putArray("steps").addObject();
        step.put("id", "sh");
        step.put("type", "bash");
        step.put("command", command);
        return (Step.Bash) WorkflowCompiler.compile(workflow).workflow().steps().get(0);
    }

    private StepContext context() {
        return new StepContext("exec-1", workspace, 2, null,
            new ConditionScope(Map.of(), Map.of(), MAPPER.createObjectNode()));
    }

    @Test
    void capturesOutputAndExitCode() throws Exception {
        var outcome = new ShellBackend().runBash(bash("echo hello"), context());

        assertThat(outcome).isInstanceOf(StepOutcome.Success.class);
        var output = ((StepOutcome.Success) outcome).output();
        assertThat(output.get("exitCode").asInt()).isZero();
        assertThat(output.get("output").asText()).isEqualTo("hello\n");
    }

    @Test
    void runsInWorkspaceWithStepEnvironment() throws Exception {
        new ShellBackend().runBash(
            bash("echo \"$WORKFLOW_EXECUTION_ID/$WORKFLOW_STEP_ID/$WORKFLOW_STEP_ATTEMPT\" > marker.txt"), context());

        assertThat(Files.readString(workspace.resolve("marker.txt"))).isEqualTo("exec-1/sh/2\n");
    }

    @Test
    void nonZeroExitIsFailureWithOutput() throws Exception {
        var outcome = new ShellBackend().runBash(bash("echo boom >&2; exit 3"), context());

        assertThat(outcome).isInstanceOf(StepOutcome.Failure.class);
        var failure = (StepOutcome.Failure) outcome;
        assertThat(failure.error()).isEqualTo("Command exited with status 3");
        assertThat(failure.output().get("output").asText()).contains("boom");
    }

    @Test
    void otherStepKindsAreDispatched() throws Exception {
        var workflow = MAPPER.readTree("""
            {"steps": [{"id": "t", "type": "tool", "tool": "search", "arguments": {"q": "x"}}]}
            """);
        var tool = (Step.Tool) WorkflowCompiler.compile(workflow).workflow().steps().get(0);

        var outcome = new ShellBackend().runTool(tool, context());

        var output = ((StepOutcome.Success) outcome).output();
        assertThat(output.get("type").asText()).isEqualTo("tool");
        assertThat(output.get("tool").asText()).isEqualTo("search");
        assertThat(output.at("/arguments/q").asText()).isEqualTo("x");
    }
}
