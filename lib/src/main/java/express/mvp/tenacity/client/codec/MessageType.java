package express.mvp.tenacity.client.codec;

/**
 * Closed set of message kinds carried by a {@link Message}.
 *
 * <p>Each type has a one-byte wire code that is written as the first byte of the serialized
 * message. No code equals {@code 0x1f}, the first byte of the compression magic, so an
 * uncompressed payload is never mistaken for a compressed one.
 */
public enum MessageType {
    CONNECT(0),
    CONNECT_ACK(1),
    DISCONNECT(2),
    HEARTBEAT(3),
    GAME_DATA(10),
    PLAYER_ACTION(11),
    STATE_SYNC(12),
    ACKNOWLEDGMENT(20),
    RETRANSMISSION(21),
    ERROR(255);

    private static final MessageType[] BY_CODE = new MessageType[256];

    static {
        for (MessageType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    /**
     * Returns the wire code of this type.
     *
     * @return code in the range 0-255
     */
    public int code() {
        return code;
    }

    /**
     * Checks whether this type is handled by the client itself rather than the application.
     *
     * @return true for connect, disconnect and heartbeat control messages
     */
    public boolean isControl() {
        return this == CONNECT || this == CONNECT_ACK || this == DISCONNECT || this == HEARTBEAT;
    }

    /**
     * Resolves a wire code.
     *
     * @param code unsigned byte value
     * @return the matching type
     * @throws ProtocolException if no type uses the code
     */
    public static MessageType fromCode(int code) {
        MessageType type = (code >= 0 && code < BY_CODE.length) ? BY_CODE[code] : null;
        if (type == null) {
            throw new ProtocolException("Unknown message type code: " + code);
        }
        return type;
    }
}
