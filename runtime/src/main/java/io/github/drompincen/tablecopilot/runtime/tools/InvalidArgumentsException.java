package io.github.drompincen.tablecopilot.runtime.tools;

import java.util.List;

public class InvalidArgumentsException extends ToolException {

    private final List<String> violations;

    public InvalidArgumentsException(String toolName, List<String> violations) {
        super(toolName, "Invalid arguments for " + toolName + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
