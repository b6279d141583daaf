package io.github.drompincen.tablecopilot.protocol.api;

/** Model text that came with tool calls, shown to the client as reasoning. */
public record ThoughtDto(
        String content,
        String source
) {
    public static ThoughtDto assistant(String content) {
        return new ThoughtDto(content, "assistant");
    }
}
