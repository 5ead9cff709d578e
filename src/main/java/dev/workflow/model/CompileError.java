package dev.workflow.model;

/**
 * A single structural problem found while compiling a workflow definition.
 */
public record CompileError(String message, String path) {}
