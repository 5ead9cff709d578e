package dev.workflow.cli;

import picocli.CommandLine.Command;

import java.io.IOException;

@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    description = "Compile the workflow on stdin and execute it from the first step."
)
class RunCommand extends ExecutionCommand {

    RunCommand(CliContext context) {
        super(context);
    }

    @Override
    public Integer call() throws IOException {
        if (isBlank(executionId) || isBlank(workflowHash) || isBlank(workspace)) {
            return context.fail("Missing required flags for run: --execution-id --workflow-hash --workspace",
                ExitCodes.USAGE);
        }
        return compileAndExecute("run",
            (engine, workflow, payload, dir) -> engine.run(executionId, workflow, payload, dir));
    }
}
