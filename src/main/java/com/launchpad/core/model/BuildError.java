package com.launchpad.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured description of a fatal step failure: which step failed, which command ran,
 * and the captured diagnostic text, plus remediation hints for the user.
 *
 * @param kind            failure classification
 * @param step            the step (or sub-step) that failed
 * @param message         one-line description of what went wrong
 * @param command         the command line that failed, empty when no command was involved
 * @param diagnostics     captured output of the failing command (stderr verbatim), may be empty
 * @param mitigationSteps suggested actions, in order
 * @param context         extra key/value data (project file, directory, ...)
 */
public record BuildError(
    ErrorKind kind,
    BuildStep step,
    String message,
    String command,
    String diagnostics,
    List<String> mitigationSteps,
    Map<String, String> context
) {

    private static final int MAX_DIAGNOSTIC_LENGTH = 4000;

    public BuildError {
        command = command != null ? command : "";
        diagnostics = diagnostics != null ? diagnostics : "";
        mitigationSteps = mitigationSteps != null ? List.copyOf(mitigationSteps) : List.of();
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    public static BuildError of(ErrorKind kind, BuildStep step, String message) {
        return new BuildError(kind, step, message, "", "", List.of(), Map.of());
    }

    public BuildError withCommand(String command, String diagnostics) {
        return new BuildError(kind, step, message, command, diagnostics, mitigationSteps, context);
    }

    public BuildError withMitigation(String... steps) {
        return new BuildError(kind, step, message, command, diagnostics, List.of(steps), context);
    }

    public BuildError withContext(String key, String value) {
        var merged = new LinkedHashMap<>(context);
        merged.put(key, value != null ? value : "");
        return new BuildError(kind, step, message, command, diagnostics, mitigationSteps, merged);
    }

    /**
     * Renders the error for terminal output: issue, failing command and output,
     * numbered mitigation steps, context and the error code last.
     */
    public String formatted() {
        var sb = new StringBuilder();
        sb.append("ERROR: ").append(message).append('\n');
        sb.append('\n').append("  Step: ").append(step.label()).append('\n');
        if (!command.isBlank()) {
            sb.append("  Command: ").append(command).append('\n');
        }
        if (!diagnostics.isBlank()) {
            sb.append("  Output:\n");
            for (String line : truncate(diagnostics.strip()).split("\\R")) {
                sb.append("    ").append(line).append('\n');
            }
        }
        if (!mitigationSteps.isEmpty()) {
            sb.append('\n').append("To resolve this issue:\n");
            for (int i = 0; i < mitigationSteps.size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(mitigationSteps.get(i)).append('\n');
            }
        }
        if (!context.isEmpty()) {
            sb.append('\n').append("Additional context:\n");
            context.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n'));
        }
        sb.append('\n').append("Error code: ").append(kind.code()).append('\n');
        return sb.toString();
    }

    private static String truncate(String text) {
        return text.length() <= MAX_DIAGNOSTIC_LENGTH
                ? text
                : text.substring(0, MAX_DIAGNOSTIC_LENGTH) + " ...";
    }
}
