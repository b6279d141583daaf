package io.github.drompincen.tablecopilot.runtime.agent;

import java.util.List;

/**
 * Picks the reply out of the entries produced during one {@code process} call,
 * where tool echoes may be interleaved with assistant output.
 */
public final class AssistantReplyExtractor {

    private AssistantReplyExtractor() {}

    /**
     * @return the last entry with role assistant
     * @throws NoAssistantReplyException if there is none, or it is blank
     */
    public static Turn extract(List<Turn> candidates) {
        for (int i = candidates.size() - 1; i >= 0; i--) {
            Turn turn = candidates.get(i);
            if (turn.role() == TurnRole.ASSISTANT) {
                if (turn.content().isBlank()) {
                    throw new NoAssistantReplyException();
                }
                return turn;
            }
        }
        throw new NoAssistantReplyException();
    }
}
