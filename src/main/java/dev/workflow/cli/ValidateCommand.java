package dev.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.workflow.compiler.WorkflowCompiler;
import dev.workflow.model.CompileError;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "validate",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    description = "Compile a workflow without running it and report its hash and step order."
)
class ValidateCommand implements Callable<Integer> {

    static final String STDIN = "-";

    @Option(names = "--workflow-path", description = "File containing the workflow JSON")
    Path workflowPath;

    @Option(names = "--workflow-json", description = "Pass '-' to read the workflow JSON from stdin")
    String workflowJson;

    private final CliContext context;

    ValidateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() throws IOException {
        boolean fromStdin = STDIN.equals(workflowJson);
        if (workflowPath == null && !fromStdin) {
            return context.fail("validate requires --workflow-path <path> or --workflow-json -", ExitCodes.USAGE);
        }
        if (workflowPath != null && workflowJson != null) {
            return context.fail("--workflow-path and --workflow-json are mutually exclusive", ExitCodes.USAGE);
        }

        String raw;
        if (fromStdin) {
            raw = context.readStdin();
        } else {
            try {
                raw = Files.readString(workflowPath);
            } catch (IOException e) {
                return context.fail("Failed to read workflow file: " + e.getMessage(), ExitCodes.INVALID_INPUT);
            }
        }

        JsonNode definition;
        try {
            definition = context.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return invalidJson();
        }
        if (definition == null || definition.isMissingNode()) {
            return invalidJson();
        }

        ValidationReport report = ValidationReport.of(WorkflowCompiler.compile(definition));
        context.printJson(report);
        return report.ok() ? ExitCodes.OK : ExitCodes.INVALID_INPUT;
    }

    private int invalidJson() throws JsonProcessingException {
        context.printJson(ValidationReport.invalid(List.of(new CompileError("Invalid JSON", "workflow"))));
        return ExitCodes.INVALID_INPUT;
    }
}
