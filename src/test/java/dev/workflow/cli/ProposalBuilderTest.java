package dev.workflow.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.model.CompiledWorkflow;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProposalBuilderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static CompiledWorkflow compile(String text) throws Exception {
        return WorkflowCompiler.compile(MAPPER.readTree(text)).workflow();
    }

    @Test
    void stubHasEmptyWorkflowAndMediumRisk() {
        var proposal = ProposalBuilder.stub("sha256:abc", "tidy");

        assertThat(proposal.proposedWorkflow().isEmpty()).isTrue();
        assertThat(proposal.proposedHash()).isNull();
        assertThat(proposal.riskLevel()).isEqualTo(ProposalBuilder.RISK_MEDIUM);
        assertThat(proposal.diff()).isEqualTo(ProposalBuilder.STUB_DIFF);
    }

    @Test
    void nestedShellWithoutGateIsHighRisk() throws Exception {
        var workflow = compile("""
            {"steps": [{"id": "fan", "type": "parallel", "steps": [
              {"id": "a", "type": "agent", "goal": "plan"},
              {"id": "b", "type": "bash", "command": "make"}]}]}
            """);

        assertThat(ProposalBuilder.riskLevel(workflow.steps())).isEqualTo(ProposalBuilder.RISK_HIGH);
    }

    @Test
    void approvalGateLowersShellRisk() throws Exception {
        var workflow = compile("""
            {"steps": [
              {"id": "gate", "type": "approval"},
              {"id": "b", "type": "bash", "command": "make"}]}
            """);

        var proposal = ProposalBuilder.forWorkflow("sha256:abc", "ship", workflow);

        assertThat(proposal.riskLevel()).isEqualTo(ProposalBuilder.RISK_MEDIUM);
        assertThat(proposal.proposedWorkflow()).isSameAs(workflow.canonical());
        assertThat(proposal.diff()).isEqualTo("--- sha256:abc\n+++ " + workflow.workflowHash() + "\n+ gate\n+ b");
    }
}
