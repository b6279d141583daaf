package io.github.drompincen.tablecopilot.runtime.tools;

public class DuplicateToolException extends ToolException {

    public DuplicateToolException(String toolName) {
        super(toolName, "Tool already registered: " + toolName);
    }
}
