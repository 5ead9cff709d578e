package dev.workflow.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflow.model.CompileError;
import dev.workflow.model.CompileResult;
import dev.workflow.model.Step;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowCompilerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static CompileResult compile(String text) throws Exception {
        return WorkflowCompiler.compile(json(text));
    }

    @Test
    void compilesSingleBashStep() throws Exception {
        var result = compile("""
            {"steps": [{"id": "lint", "type": "bash", "command": "npm test"}]}
            """);

        assertThat(result.ok()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.workflow().workflowHash()).startsWith("sha256:").hasSize(7 + 64);
        assertThat(result.workflow().stepOrder()).containsExactly("lint");
        assertThat(result.workflow().steps().get(0)).isInstanceOf(Step.Bash.class);
    }

    @Test
    void hashIgnoresKeyOrderAtEveryDepth() throws Exception {
        var first = compile("""
            {"name": "ci", "steps": [
              {"id": "main", "type": "conditional", "condition": {"variable": "x", "equals": 1},
               "then": [{"id": "a", "type": "tool", "tool": "search", "arguments": {"q": "x", "limit": 3}}]}
            ]}
            """);
        var second = compile("""
            {"steps": [
              {"then": [{"arguments": {"limit": 3, "q": "x"}, "tool": "search", "type": "tool", "id": "a"}],
               "condition": {"equals": 1, "variable": "x"}, "type": "conditional", "id": "main"}
            ], "name": "ci"}
            """);

        assertThat(first.workflow().workflowHash()).isEqualTo(second.workflow().workflowHash());
    }

    @Test
    void hashChangesWithContent() throws Exception {
        var first = compile("""
            {"steps": [{"id": "lint", "type": "bash", "command": "npm test"}]}
            """);
        var second = compile("""
            {"steps": [{"id": "lint", "type": "bash", "command": "npm run lint"}]}
            """);

        assertThat(first.workflow().workflowHash()).isNotEqualTo(second.workflow().workflowHash());
    }

    @Test
    void hashIgnoresWhitespaceAroundIdAndType() throws Exception {
        var padded = compile("""
            {"steps": [{"id": "  lint ", "type": " bash", "command": "npm test"}]}
            """);
        var plain = compile("""
            {"steps": [{"id": "lint", "type": "bash", "command": "npm test"}]}
            """);

        assertThat(padded.workflow().workflowHash()).isEqualTo(plain.workflow().workflowHash());
        assertThat(padded.workflow().stepOrder()).containsExactly("lint");
    }

    @Test
    void stepOrderFollowsDocumentOrder() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "main", "type": "conditional", "condition": true,
               "then": [{"id": "then-b", "type": "bash", "command": "b"},
                        {"id": "then-a", "type": "bash", "command": "a"}],
               "else": [{"id": "else-1", "type": "bash", "command": "e"}]}
            ]}
            """);

        assertThat(result.workflow().stepOrder()).containsExactly("main", "then-b", "then-a", "else-1");
    }

    @Test
    void compilingTwiceIsStable() throws Exception {
        String text = """
            {"steps": [
              {"id": "gate", "type": "approval", "message": "Ship it?"},
              {"id": "fan", "type": "parallel", "steps": [
                {"id": "x", "type": "bash", "command": "x"},
                {"id": "y", "type": "agent", "goal": "review"}]}
            ]}
            """;

        var first = compile(text);
        var second = compile(text);

        assertThat(first.workflow().workflowHash()).isEqualTo(second.workflow().workflowHash());
        assertThat(first.workflow().stepOrder()).isEqualTo(second.workflow().stepOrder())
            .containsExactly("gate", "fan", "x", "y");
    }

    @Test
    void rejectsNonObjectAndMissingSteps() throws Exception {
        assertThat(compile("[]").firstErrorMessage()).isEqualTo("workflow must be an object");
        assertThat(compile("{}").firstErrorMessage()).isEqualTo("workflow.steps must be an array");
        assertThat(compile("""
            {"steps": []}
            """).firstErrorMessage()).isEqualTo("workflow.steps must not be empty");
    }

    @Test
    void agentMessageRequiresContent() throws Exception {
        var result = compile("""
            {"steps": [{"id": "ping", "type": "agent_message"}]}
            """);

        assertThat(result.ok()).isFalse();
        assertThat(result.errors()).extracting(CompileError::message)
            .anyMatch(m -> m.contains("agent_message step requires content"));
    }

    @Test
    void agentMessageAcceptsMessageOrGoalAsContent() throws Exception {
        assertThat(compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "message": "hi"}]}
            """).ok()).isTrue();
        assertThat(compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "goal": "hi"}]}
            """).ok()).isTrue();
    }

    @Test
    void awaitResponseMustBeBoolean() throws Exception {
        var result = compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "content": "hi", "await_response": "yes"}]}
            """);

        assertThat(result.errors()).extracting(CompileError::message)
            .anyMatch(m -> m.contains("await_response must be a boolean"));
    }

    @Test
    void awaitTimeoutHasOneSecondFloor() throws Exception {
        var result = compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "content": "hi",
                        "await_response": true, "await_timeout_ms": 10}]}
            """);

        assertThat(result.errors()).extracting(CompileError::message)
            .anyMatch(m -> m.contains("1000"));
    }

    @Test
    void awaitTimeoutRequiresAwaitResponse() throws Exception {
        var result = compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "content": "hi", "await_timeout_ms": 5000}]}
            """);

        assertThat(result.errors()).extracting(CompileError::message)
            .containsExactly("workflow.steps[0].await_timeout_ms requires await_response to be set");
    }

    @Test
    void camelCaseAwaitAliasesAreAccepted() throws Exception {
        var result = compile("""
            {"steps": [{"id": "ping", "type": "agent_message", "content": "hi",
                        "awaitResponse": true, "awaitTimeoutMs": 2000}]}
            """);

        assertThat(result.ok()).isTrue();
        var message = (Step.AgentMessage) result.workflow().steps().get(0);
        assertThat(message.awaitResponse()).isTrue();
        assertThat(message.awaitTimeoutMs()).isEqualTo(2000L);
    }

    @Test
    void reportsUnknownTypeAndMissingId() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "a", "type": "teleport"},
              {"type": "bash", "command": "ls"}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::message).containsExactly(
            "workflow.steps[0].type 'teleport' is not a recognized step type",
            "workflow.steps[1].id is required");
    }

    @Test
    void bashAndToolRequireTheirAction() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "a", "type": "bash"},
              {"id": "b", "type": "tool"},
              {"id": "c", "type": "tool", "tool": "bash"}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::path).containsExactly(
            "workflow.steps[0].command", "workflow.steps[1].tool", "workflow.steps[2].tool");
    }

    @Test
    void nestedErrorsCarryFullPath() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "main", "type": "conditional", "condition": true,
               "then": [{"id": "ok", "type": "bash", "command": "x"},
                        {"id": "bad", "type": "bash"}]}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::message)
            .containsExactly("workflow.steps[0].then[1].command is required for bash steps");
    }

    @Test
    void rejectsMisplacedOrMalformedBodies() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "a", "type": "bash", "command": "x", "then": []},
              {"id": "b", "type": "conditional", "condition": true, "then": {}},
              {"id": "c", "type": "loop", "steps": []},
              {"id": "d", "type": "parallel"}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::message).containsExactly(
            "workflow.steps[0].then is not allowed on bash steps",
            "workflow.steps[1].then must be an array",
            "workflow.steps[2].steps must not be empty for loop steps",
            "workflow.steps[3].steps must not be empty for parallel steps");
    }

    @Test
    void rejectsApprovalInsideParallel() throws Exception {
        var result = compile("""
            {"steps": [{"id": "fan", "type": "parallel", "steps": [
              {"id": "gate", "type": "approval"}]}]}
            """);

        assertThat(result.errors()).extracting(CompileError::message)
            .containsExactly("workflow.steps[0].steps[0] approval steps are not supported inside parallel steps");
    }

    @Test
    void validatesRetryAndApprovalAttributes() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "a", "type": "bash", "command": "x", "retry": {"maxAttempts": 0}},
              {"id": "b", "type": "approval", "timeoutAt": "tomorrow", "defaultAction": "shrug"}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::message).containsExactly(
            "workflow.steps[0].retry.maxAttempts must be an integer >= 1",
            "workflow.steps[1].timeoutAt must be an ISO-8601 timestamp",
            "workflow.steps[1].defaultAction must be one of approve, deny, fail");
    }

    @Test
    void subworkflowNeedsExactlyOneSource() throws Exception {
        var result = compile("""
            {"steps": [
              {"id": "a", "type": "subworkflow"},
              {"id": "b", "type": "subworkflow", "workflowId": "child",
               "steps": [{"id": "x", "type": "bash", "command": "x"}]}
            ]}
            """);

        assertThat(result.errors()).extracting(CompileError::message).containsExactly(
            "workflow.steps[0] subworkflow step requires steps or workflowId",
            "workflow.steps[1] subworkflow step accepts either steps or workflowId, not both");
    }

    @Test
    void parsesCommonAttributes() throws Exception {
        var result = compile("""
            {"steps": [{"id": "build", "type": "bash", "command": "make", "name": "Build",
                        "outputVariable": "buildResult", "continueOnError": true,
                        "retry": {"maxAttempts": 3, "backoffMs": 250}}]}
            """);

        Step step = result.workflow().steps().get(0);
        assertThat(step.common().displayName()).isEqualTo("Build");
        assertThat(step.outputVariable()).isEqualTo("buildResult");
        assertThat(step.common().continueOnError()).isTrue();
        assertThat(step.retry().maxAttempts()).isEqualTo(3);
        assertThat(step.retry().backoffMs()).isEqualTo(250L);
    }
}
