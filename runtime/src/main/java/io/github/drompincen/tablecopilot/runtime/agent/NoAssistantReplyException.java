package io.github.drompincen.tablecopilot.runtime.agent;

public class NoAssistantReplyException extends AgentException {

    public NoAssistantReplyException() {
        super("Model produced no assistant reply");
    }
}
