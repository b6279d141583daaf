package io.github.drompincen.tablecopilot.runtime.agent;

public enum TurnRole {
    USER, ASSISTANT, TOOL;

    public String wireName() {
        return name().toLowerCase();
    }
}
