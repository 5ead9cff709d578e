package dev.workflow.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the workflow runner. Each subcommand writes one JSON result
 * line to stdout and JSON events to stderr.
 */
@Command(
    name = "workflow",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    description = "Compile, run and resume multi-step workflows."
)
public class WorkflowCli implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCli.class);

    /** Read by {@code Main} before logging starts; declared here so picocli accepts it everywhere. */
    @Option(names = "--verbose", scope = ScopeType.INHERIT, description = "Log engine transitions to stderr")
    boolean verbose;

    @Spec
    CommandSpec spec;

    private final CliContext context;

    public WorkflowCli(CliContext context) {
        this.context = context;
    }

    /**
     * Build the command tree bound to the given streams.
     */
    public static CommandLine commandLine(CliContext context) {
        var commandLine = new CommandLine(new WorkflowCli(context))
            .addSubcommand("run", new RunCommand(context))
            .addSubcommand("resume", new ResumeCommand(context))
            .addSubcommand("validate", new ValidateCommand(context))
            .addSubcommand("propose", new ProposeCommand(context));

        commandLine.setOut(new PrintWriter(context.out(), true));
        commandLine.setErr(new PrintWriter(context.err(), true));
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            logger.error("Unhandled error in {}", cmd.getCommandName(), e);
            cmd.getErr().println("workflow CLI internal error: " + e);
            cmd.getErr().flush();
            return ExitCodes.EXECUTION_FAILED;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(context.out());
        return ExitCodes.OK;
    }
}
