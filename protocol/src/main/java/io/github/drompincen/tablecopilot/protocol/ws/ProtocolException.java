package io.github.drompincen.tablecopilot.protocol.ws;

/**
 * A client envelope that cannot be routed: unparsable, of an unknown type,
 * or missing a required field. The connection stays open.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
