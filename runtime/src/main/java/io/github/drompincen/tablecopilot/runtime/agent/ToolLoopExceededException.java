package io.github.drompincen.tablecopilot.runtime.agent;

public class ToolLoopExceededException extends AgentException {

    private final int maxToolInvocations;

    public ToolLoopExceededException(int maxToolInvocations) {
        super("Tool invocation limit of " + maxToolInvocations + " reached without a final reply");
        this.maxToolInvocations = maxToolInvocations;
    }

    public int getMaxToolInvocations() {
        return maxToolInvocations;
    }
}
