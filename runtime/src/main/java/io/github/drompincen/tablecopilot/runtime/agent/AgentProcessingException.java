package io.github.drompincen.tablecopilot.runtime.agent;

public class AgentProcessingException extends AgentException {

    public AgentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
