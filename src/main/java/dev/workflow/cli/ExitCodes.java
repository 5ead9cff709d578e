package dev.workflow.cli;

/**
 * Process exit codes. Callers pattern-match on these, so the values are fixed.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int INVALID_INPUT = 10;
    public static final int USAGE = 20;
    public static final int EXECUTION_FAILED = 40;

    private ExitCodes() {}
}
