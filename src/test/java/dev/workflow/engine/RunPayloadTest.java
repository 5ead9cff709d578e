package dev.workflow.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflow.model.EnginePolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunPayloadTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void parsesFullPayload() throws Exception {
        var payload = RunPayload.parse(MAPPER.readTree("""
            {
              "workflow": {"steps": []},
              "trigger": {"branch": "main"},
              "variables": {"env": "prod"},
              "runtime": {
                "attempt": 3,
                "idempotencyKey": "k-1",
                "policy": {"maxSteps": 7},
                "checkpoint": {"stepId": "gate", "loopIterations": {"retry-loop": 2},
                               "outputs": {"build": {"ok": true}}, "scopes": {"child": {"x": 1}}}
              },
              "workflows": {"child": {"steps": []}}
            }
            """), "run");

        assertThat(payload.trigger().get("branch").asText()).isEqualTo("main");
        assertThat(payload.variables()).containsOnlyKeys("env");
        assertThat(payload.runtime().attempt()).isEqualTo(3);
        assertThat(payload.runtime().idempotencyKey()).isEqualTo("k-1");
        assertThat(payload.runtime().checkpoint().stepId()).isEqualTo("gate");
        assertThat(payload.runtime().checkpoint().loopIterations()).containsEntry("retry-loop", 2);
        assertThat(payload.runtime().checkpoint().outputs()).containsOnlyKeys("build");
        assertThat(payload.runtime().checkpoint().scopes().get("child")).containsOnlyKeys("x");
        assertThat(payload.workflows()).containsOnlyKeys("child");
    }

    @Test
    void defaultsOptionalSections() throws Exception {
        var payload = RunPayload.parse(MAPPER.readTree("""
            {"workflow": {"steps": []}}
            """), "run");

        assertThat(payload.trigger().isObject()).isTrue();
        assertThat(payload.variables()).isEmpty();
        assertThat(payload.runtime().attempt()).isEqualTo(1);
        assertThat(payload.runtime().checkpoint()).isNull();
        assertThat(payload.runtime().applyTo(EnginePolicy.defaults())).isEqualTo(EnginePolicy.defaults());
    }

    @Test
    void policyOverridesOnlyValidFields() throws Exception {
        var payload = RunPayload.parse(MAPPER.readTree("""
            {"workflow": {"steps": []},
             "runtime": {"policy": {"maxSteps": 5, "maxParallelism": -1, "maxLoopIterations": "lots"}}}
            """), "run");

        EnginePolicy policy = payload.runtime().applyTo(EnginePolicy.defaults());

        assertThat(policy.maxSteps()).isEqualTo(5);
        assertThat(policy.maxParallelism()).isEqualTo(EnginePolicy.DEFAULT_MAX_PARALLELISM);
        assertThat(policy.maxLoopIterations()).isEqualTo(EnginePolicy.DEFAULT_MAX_LOOP_ITERATIONS);
    }

    @Test
    void requiresWorkflow() {
        assertThatThrownBy(() -> RunPayload.parse(MAPPER.readTree("{\"trigger\": {}}"), "resume"))
            .isInstanceOf(PayloadException.class)
            .hasMessage("resume payload must include workflow object");
    }

    @Test
    void rejectsMalformedSections() {
        assertThatThrownBy(() -> RunPayload.parse(MAPPER.readTree("""
            {"workflow": {}, "variables": []}
            """), "run"))
            .hasMessage("variables must be an object");
        assertThatThrownBy(() -> RunPayload.parse(MAPPER.readTree("""
            {"workflow": {}, "runtime": {"checkpoint": {"loopIterations": {}}}}
            """), "run"))
            .hasMessage("runtime.checkpoint must be an object with a stepId");
    }
}
