package express.mvp.tenacity.client.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Converts {@link Message}s to length-prefixed frames and back.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌─────────────────────┬──────────────────────────────────────────┐
 * │ length (4, LE u32)  │ payload (length bytes)                   │
 * └─────────────────────┴──────────────────────────────────────────┘
 *
 * payload = serialized message                       (uncompressed)
 *         | 0x1f 0x8b ... gzip stream of the message (compressed)
 * </pre>
 *
 * <p>The length counts every payload byte, including the compression magic. A payload is
 * compressed when compression is enabled and the serialized message is strictly longer than
 * the compression threshold. The decoder recognises compressed payloads by the gzip magic;
 * message type codes never start with {@code 0x1f}, so the two cannot be confused.
 *
 * <p>Neither the serialized message nor the frame payload may exceed the maximum frame size.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances are immutable and may be shared between threads.
 *
 * @see FrameDecoder
 */
public final class MessageCodec {

    /** Size of the frame length prefix in bytes. */
    public static final int LENGTH_PREFIX_SIZE = 4;

    /** Size of the serialized message header (type, sequence, timestamp). */
    public static final int MESSAGE_HEADER_SIZE = 1 + 4 + 8;

    /** First byte of the compression magic. */
    public static final byte MAGIC_0 = (byte) 0x1f;

    /** Second byte of the compression magic. */
    public static final byte MAGIC_1 = (byte) 0x8b;

    /** Default compression threshold in bytes. */
    public static final int DEFAULT_COMPRESSION_THRESHOLD = 512;

    /** Default maximum frame payload size (4 MiB). */
    public static final int DEFAULT_MAX_FRAME_SIZE = 4 * 1024 * 1024;

    private final int compressionThreshold;
    private final boolean compressionEnabled;
    private final int maxFrameSize;

    /** Creates a codec with default threshold and frame limit and compression enabled. */
    public MessageCodec() {
        this(DEFAULT_COMPRESSION_THRESHOLD, true, DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Creates a codec.
     *
     * @param compressionThreshold serialized sizes above this are compressed
     * @param compressionEnabled whether outgoing payloads may be compressed
     * @param maxFrameSize maximum payload length accepted or produced
     */
    public MessageCodec(int compressionThreshold, boolean compressionEnabled, int maxFrameSize) {
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException(
                    "compressionThreshold must not be negative: " + compressionThreshold);
        }
        if (maxFrameSize < MESSAGE_HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxFrameSize must be at least " + MESSAGE_HEADER_SIZE + ": " + maxFrameSize);
        }
        if (maxFrameSize > Integer.MAX_VALUE - LENGTH_PREFIX_SIZE) {
            throw new IllegalArgumentException(
                    "maxFrameSize too large, would overflow frame size: " + maxFrameSize);
        }
        this.compressionThreshold = compressionThreshold;
        this.compressionEnabled = compressionEnabled;
        this.maxFrameSize = maxFrameSize;
    }

    public int compressionThreshold() {
        return compressionThreshold;
    }

    public boolean compressionEnabled() {
        return compressionEnabled;
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Creates a frame decoder that enforces this codec's frame limit.
     *
     * @return a new, empty decoder
     */
    public FrameDecoder newDecoder() {
        return new FrameDecoder(maxFrameSize);
    }

    // ==================== Encoding ====================

    /**
     * Encodes a message into a complete frame, length prefix included.
     *
     * @param message the message to encode
     * @return the frame bytes
     * @throws ProtocolException if the message or the frame payload exceeds the frame limit
     */
    public byte[] encodeFrame(Message message) {
        byte[] payload = encodePayload(message);
        byte[] frame = new byte[LENGTH_PREFIX_SIZE + payload.length];
        ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN).putInt(payload.length);
        System.arraycopy(payload, 0, frame, LENGTH_PREFIX_SIZE, payload.length);
        return frame;
    }

    /**
     * Encodes a message into a frame payload, compressing it when it crosses the threshold.
     *
     * @param message the message to encode
     * @return the payload bytes, without length prefix
     * @throws ProtocolException if the message or the payload exceeds the frame limit
     */
    public byte[] encodePayload(Message message) {
        byte[] serialized = serialize(message);
        if (serialized.length > maxFrameSize) {
            throw new ProtocolException(String.format(
                    "Message size %d exceeds maximum frame size %d",
                    serialized.length, maxFrameSize));
        }
        if (!shouldCompress(serialized.length)) {
            return serialized;
        }
        byte[] compressed = compress(serialized);
        if (compressed.length > maxFrameSize) {
            throw new ProtocolException(String.format(
                    "Compressed payload size %d exceeds maximum frame size %d",
                    compressed.length, maxFrameSize));
        }
        return compressed;
    }

    /**
     * Checks whether a serialized message of the given size would be compressed.
     *
     * @param serializedLength serialized message length in bytes
     * @return true if compression is enabled and the length is above the threshold
     */
    public boolean shouldCompress(int serializedLength) {
        return compressionEnabled && serializedLength > compressionThreshold;
    }

    /**
     * Serializes a message without compression or framing.
     *
     * @param message the message
     * @return header followed by body
     */
    public static byte[] serialize(Message message) {
        byte[] body = message.bodyArray();
        ByteBuffer buffer = ByteBuffer.allocate(MESSAGE_HEADER_SIZE + body.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) message.type().code());
        buffer.putInt(message.sequenceNumber());
        buffer.putLong(message.timestamp());
        buffer.put(body);
        return buffer.array();
    }

    // ==================== Decoding ====================

    /**
     * Decodes one frame payload, decompressing it if it carries the compression magic.
     *
     * @param payload payload bytes as produced by {@link FrameDecoder#nextFrame()}
     * @return the decoded message
     * @throws ProtocolException if the payload is malformed
     */
    public Message decodePayload(byte[] payload) {
        if (payload.length > maxFrameSize) {
            throw new ProtocolException(String.format(
                    "Payload size %d exceeds maximum frame size %d", payload.length, maxFrameSize));
        }
        byte[] serialized = isCompressed(payload) ? decompress(payload) : payload;
        return deserialize(serialized);
    }

    /**
     * Decodes a complete frame including its length prefix.
     *
     * @param frame the frame bytes
     * @return the decoded message
     * @throws ProtocolException if the frame is truncated, oversized or malformed
     */
    public Message decodeFrame(byte[] frame) {
        FrameDecoder decoder = newDecoder();
        decoder.feed(frame, 0, frame.length);
        byte[] payload = decoder.nextFrame();
        if (payload == null || decoder.bufferedBytes() != 0) {
            throw new ProtocolException(
                    "Frame of " + frame.length + " bytes does not hold exactly one payload");
        }
        return decodePayload(payload);
    }

    /**
     * Deserializes an uncompressed message.
     *
     * @param serialized header followed by body
     * @return the message
     * @throws ProtocolException if the header is truncated or the type is unknown
     */
    public static Message deserialize(byte[] serialized) {
        if (serialized.length < MESSAGE_HEADER_SIZE) {
            throw new ProtocolException(
                    "Message of " + serialized.length + " bytes is shorter than its header");
        }
        ByteBuffer buffer = ByteBuffer.wrap(serialized).order(ByteOrder.LITTLE_ENDIAN);
        MessageType type = MessageType.fromCode(buffer.get() & 0xFF);
        int sequence = buffer.getInt();
        long timestamp = buffer.getLong();
        byte[] body = new byte[buffer.remaining()];
        buffer.get(body);
        return new Message(type, sequence, timestamp, body);
    }

    /**
     * Checks whether a payload starts with the compression magic.
     *
     * @param payload the payload
     * @return true if compressed
     */
    public static boolean isCompressed(byte[] payload) {
        return payload.length >= 2 && payload[0] == MAGIC_0 && payload[1] == MAGIC_1;
    }

    private static byte[] compress(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new ProtocolException("Failed to compress payload", e);
        }
        return out.toByteArray();
    }

    private byte[] decompress(byte[] payload) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length * 2);
            byte[] chunk = new byte[8192];
            int total = 0;
            int read;
            while ((read = in.read(chunk)) != -1) {
                total += read;
                if (total > maxFrameSize) {
                    throw new ProtocolException(
                            "Decompressed payload exceeds maximum frame size " + maxFrameSize);
                }
                out.write(chunk, 0, read);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new ProtocolException("Corrupt compressed payload", e);
        }
    }

    @Override
    public String toString() {
        return String.format(
                "MessageCodec[compression=%s, threshold=%d, maxFrameSize=%d]",
                compressionEnabled, compressionThreshold, maxFrameSize);
    }
}
