package dev.workflow.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.workflow.model.CompiledWorkflow;
import dev.workflow.model.Step;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Packages a change intent into a proposal record for the external review pipeline.
 */
final class ProposalBuilder {

    static final String RISK_MEDIUM = "medium";
    static final String RISK_HIGH = "high";
    static final String STUB_DIFF = "--- old\n+++ new\n# proposal stub";

    @JsonPropertyOrder({"baseHash", "proposedHash", "proposedWorkflow", "summary", "riskLevel", "diff"})
    record Proposal(
        String baseHash,
        @JsonInclude(JsonInclude.Include.NON_NULL) String proposedHash,
        JsonNode proposedWorkflow,
        String summary,
        String riskLevel,
        String diff
    ) {}

    @JsonPropertyOrder({"ok", "status", "proposal", "error"})
    record Envelope(boolean ok, String status, Proposal proposal, String error) {

        static Envelope created(Proposal proposal) {
            return new Envelope(true, "proposal_created", proposal, null);
        }
    }

    private ProposalBuilder() {}

    /** Proposal with no concrete workflow attached yet. */
    static Proposal stub(String baseHash, String intent) {
        return new Proposal(baseHash, null, JsonNodeFactory.instance.objectNode(), intent, RISK_MEDIUM, STUB_DIFF);
    }

    static Proposal forWorkflow(String baseHash, String intent, CompiledWorkflow proposed) {
        return new Proposal(
            baseHash,
            proposed.workflowHash(),
            proposed.canonical(),
            intent,
            riskLevel(proposed.steps()),
            diff(baseHash, proposed));
    }

    /** Shell access without a human gate anywhere in the tree is the one case rated high. */
    static String riskLevel(List<Step> steps) {
        boolean runsShell = anyMatch(steps, Step.Bash.class);
        boolean gated = anyMatch(steps, Step.Approval.class);
        return runsShell && !gated ? RISK_HIGH : RISK_MEDIUM;
    }

    private static boolean anyMatch(List<Step> steps, Class<? extends Step> kind) {
        for (Step step : steps) {
            if (kind.isInstance(step) || anyMatch(step.children(), kind)) {
                return true;
            }
        }
        return false;
    }

    private static String diff(String baseHash, CompiledWorkflow proposed) {
        String body = proposed.stepOrder().stream()
            .map(stepId -> "+ " + stepId)
            .collect(Collectors.joining("\n"));
        return "--- " + baseHash + "\n+++ " + proposed.workflowHash() + "\n" + body;
    }
}
