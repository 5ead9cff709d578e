package dev.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.workflow.compiler.CanonicalJson;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.event.WorkflowEvent;
import dev.workflow.model.CompileResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

@Command(
    name = "propose",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    description = "Package a change intent into a workflow proposal for review."
)
class ProposeCommand implements Callable<Integer> {

    @Option(names = "--workflow-id", description = "Workflow the proposal targets")
    String workflowId;

    @Option(names = "--base-hash", description = "Hash of the workflow version the proposal starts from")
    String baseHash;

    @Option(names = "--intent", description = "What the change should achieve")
    String intent;

    @Option(names = "--proposed-path", description = "File containing the proposed workflow JSON")
    Path proposedPath;

    @Option(names = "--proposed-json", description = "Pass '-' to read the proposed workflow JSON from stdin")
    String proposedJson;

    private final CliContext context;

    ProposeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() throws IOException {
        if (ExecutionCommand.isBlank(workflowId) || ExecutionCommand.isBlank(baseHash)
            || ExecutionCommand.isBlank(intent)) {
            return context.fail("propose requires --workflow-id --base-hash --intent", ExitCodes.USAGE);
        }
        if (proposedPath != null && proposedJson != null) {
            return context.fail("--proposed-path and --proposed-json are mutually exclusive", ExitCodes.USAGE);
        }
        if (proposedJson != null && !ValidateCommand.STDIN.equals(proposedJson)) {
            return context.fail("--proposed-json only accepts '-' (read from stdin)", ExitCodes.USAGE);
        }

        String base = CanonicalJson.normalizeHash(baseHash);
        ProposalBuilder.Proposal proposal;
        if (proposedPath == null && proposedJson == null) {
            proposal = ProposalBuilder.stub(base, intent);
        } else {
            String raw;
            try {
                raw = proposedPath != null ? Files.readString(proposedPath) : context.readStdin();
            } catch (IOException e) {
                return context.fail("Failed to read proposed workflow: " + e.getMessage(), ExitCodes.INVALID_INPUT);
            }

            JsonNode definition;
            try {
                definition = context.mapper().readTree(raw);
            } catch (JsonProcessingException e) {
                return context.fail("Invalid JSON input for proposed workflow", ExitCodes.INVALID_INPUT);
            }

            CompileResult compiled = WorkflowCompiler.compile(definition);
            if (!compiled.ok()) {
                return context.fail(ExecutionCommand.COMPILE_ERROR + ": " + compiled.firstErrorMessage(),
                    ExitCodes.INVALID_INPUT);
            }
            proposal = ProposalBuilder.forWorkflow(base, intent, compiled.workflow());
        }

        context.events().emit(WorkflowEvent.forWorkflow("proposal.created", workflowId,
                Instant.now(context.clock()).toString())
            .with("baseHash", base)
            .with("riskLevel", proposal.riskLevel()));
        context.printJson(ProposalBuilder.Envelope.created(proposal));
        return ExitCodes.OK;
    }
}
