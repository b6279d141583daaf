package io.github.drompincen.tablecopilot.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound envelope after validation. {@code sessionId} is null when the client
 * did not supply one.
 */
public record ClientEnvelope(
        EnvelopeType type,
        String content,
        String sessionId
) {

    public static ClientEnvelope parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Envelope must be a JSON object");
        }

        // A missing type is treated as a chat message
        String typeName = node.path("type").asText("message");
        EnvelopeType type = EnvelopeType.fromWire(typeName)
                .filter(EnvelopeType::isClientType)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));

        String sessionId = textOrNull(node, "session_id");
        String content = textOrNull(node, "content");

        if (type == EnvelopeType.MESSAGE && (content == null || content.isBlank())) {
            throw new ProtocolException("Message content is required");
        }
        return new ClientEnvelope(type, content, sessionId);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isTextual()) {
            throw new ProtocolException("Field '" + field + "' must be a string");
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
