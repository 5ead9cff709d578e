package dev.workflow;

import dev.workflow.cli.CliContext;
import dev.workflow.cli.WorkflowCli;

import java.util.Arrays;

public class Main {
    public static void main(String[] args) {
        // slf4j-simple reads its level once, so this must happen before any logger exists
        if (Arrays.asList(args).contains("--verbose")) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        int exitCode = WorkflowCli.commandLine(CliContext.system()).execute(args);
        System.exit(exitCode);
    }
}
