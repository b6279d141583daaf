package io.github.drompincen.tablecopilot.runtime.tools;

public class UnknownToolException extends ToolException {

    public UnknownToolException(String toolName) {
        super(toolName, "Unknown tool: " + toolName);
    }
}
