package dev.workflow.backend;

import java.util.List;

/**
 * Lookup of the backends selectable with {@code --backend}.
 */
public final class StepBackends {

    public static final List<String> NAMES = List.of(DispatchBackend.NAME, ShellBackend.NAME);

    private StepBackends() {}

    public static StepBackend forName(String name) {
        return switch (name) {
            case DispatchBackend.NAME -> new DispatchBackend();
            case ShellBackend.NAME -> new ShellBackend();
            default -> throw new IllegalArgumentException(
                "Unknown backend '%s'. Valid backends: %s".formatted(name, NAMES));
        };
    }
}
