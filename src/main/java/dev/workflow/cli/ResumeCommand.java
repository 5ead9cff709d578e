package dev.workflow.cli;

import dev.workflow.backend.DispatchBackend;
import dev.workflow.engine.WorkflowEngine;
import dev.workflow.model.EnginePolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(
    name = "resume",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    description = "Continue a run paused at an approval, or cancel it."
)
class ResumeCommand extends ExecutionCommand {

    static final String APPROVE = "approve";
    static final String DENY = "deny";

    @Option(names = "--resume-token", description = "Token from requiresApproval.resumeToken")
    String resumeToken;

    @Option(names = "--decision", defaultValue = APPROVE, description = "approve or deny (default: ${DEFAULT-VALUE})")
    String decision;

    ResumeCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() throws IOException {
        if (isBlank(executionId) || isBlank(resumeToken)) {
            return context.fail("Missing required flags for resume: --execution-id --resume-token", ExitCodes.USAGE);
        }
        if (!APPROVE.equals(decision) && !DENY.equals(decision)) {
            return context.fail("Invalid --decision value. Expected approve|deny", ExitCodes.INVALID_INPUT);
        }

        if (DENY.equals(decision)) {
            // Denial needs no workflow content: stdin is left unread
            var engine = new WorkflowEngine(new DispatchBackend(), context.events(), context.clock(),
                EnginePolicy.defaults());
            context.printJson(engine.deny(executionId));
            return ExitCodes.OK;
        }

        if (isBlank(workflowHash) || isBlank(workspace)) {
            return context.fail("Missing required flags for resume approval: --workflow-hash --workspace",
                ExitCodes.USAGE);
        }
        return compileAndExecute("resume",
            (engine, workflow, payload, dir) -> engine.resume(executionId, workflow, payload, dir, resumeToken));
    }
}
