package express.mvp.tenacity.client.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * One application or control message exchanged with the server.
 *
 * <p>A message is immutable. The body is copied on construction and on access, so callers may
 * reuse their arrays freely.
 *
 * <h2>Serialized Layout</h2>
 *
 * <pre>
 * ┌──────────┬──────────────────┬──────────────────┬─────────────┐
 * │ type (1) │ sequence (4, LE) │ timestamp (8, LE)│ body (n)    │
 * └──────────┴──────────────────┴──────────────────┴─────────────┘
 * </pre>
 *
 * <p>The sequence number is an unsigned 32-bit counter assigned by the sending client and
 * increasing within one connection.
 *
 * @see MessageCodec
 */
public final class Message {

    private static final byte[] EMPTY = new byte[0];

    private final MessageType type;
    private final int sequenceNumber;
    private final long timestamp;
    private final byte[] body;

    /**
     * Creates a message.
     *
     * @param type the message type
     * @param sequenceNumber sequence number (treated as unsigned)
     * @param timestamp creation time in epoch milliseconds
     * @param body the body bytes, may be null for an empty body
     */
    public Message(MessageType type, int sequenceNumber, long timestamp, byte[] body) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.sequenceNumber = sequenceNumber;
        this.timestamp = timestamp;
        this.body = body == null || body.length == 0 ? EMPTY : body.clone();
    }

    /**
     * Creates an unsequenced message stamped with the current time.
     *
     * @param type the message type
     * @param body the body bytes, may be null
     * @return a new message with sequence number 0
     */
    public static Message of(MessageType type, byte[] body) {
        return new Message(type, 0, System.currentTimeMillis(), body);
    }

    /**
     * Returns a copy of this message carrying the given sequence number.
     *
     * @param sequence the sequence number to stamp
     * @return a new message, or this one if the number is unchanged
     */
    public Message withSequenceNumber(int sequence) {
        return sequence == sequenceNumber ? this : new Message(type, sequence, timestamp, body);
    }

    public MessageType type() {
        return type;
    }

    public int sequenceNumber() {
        return sequenceNumber;
    }

    /**
     * Returns the sequence number as an unsigned value.
     *
     * @return sequence number in the range 0 to 2^32-1
     */
    public long unsignedSequenceNumber() {
        return Integer.toUnsignedLong(sequenceNumber);
    }

    public long timestamp() {
        return timestamp;
    }

    /**
     * Returns a copy of the body bytes.
     *
     * @return the body, never null
     */
    public byte[] body() {
        return body.length == 0 ? EMPTY : body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    /** Returns the body without copying, for the codec only. */
    byte[] bodyArray() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message other)) {
            return false;
        }
        return type == other.type
                && sequenceNumber == other.sequenceNumber
                && timestamp == other.timestamp
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, sequenceNumber, timestamp);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return String.format(
                "Message[type=%s, seq=%d, ts=%d, bodyLength=%d]",
                type, unsignedSequenceNumber(), timestamp, body.length);
    }
}
