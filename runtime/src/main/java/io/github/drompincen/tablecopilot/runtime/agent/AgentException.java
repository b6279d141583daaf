package io.github.drompincen.tablecopilot.runtime.agent;

/** Failure of a single {@code process} call. The session stays usable. */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
