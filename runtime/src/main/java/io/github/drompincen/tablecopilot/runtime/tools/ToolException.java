package io.github.drompincen.tablecopilot.runtime.tools;

public abstract class ToolException extends RuntimeException {

    private final String toolName;

    protected ToolException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    protected ToolException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
