package io.github.drompincen.tablecopilot.runtime.tools;

public class ToolExecutionException extends ToolException {

    public ToolExecutionException(String toolName, Throwable cause) {
        super(toolName, "Tool " + toolName + " failed: " + cause.getMessage(), cause);
    }
}
