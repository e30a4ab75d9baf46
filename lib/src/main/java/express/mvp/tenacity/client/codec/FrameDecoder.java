package express.mvp.tenacity.client.codec;

import java.util.Objects;

/**
 * Reassembles length-prefixed frames from a byte stream that arrives in arbitrary chunks.
 *
 * <p>Bytes are appended with {@link #feed(byte[], int, int)} as they are read from the socket.
 * {@link #nextFrame()} returns the next complete payload, or {@code null} when more data is
 * needed. A short read never loses data: partial headers and payloads stay buffered until the
 * rest arrives.
 *
 * <p>The length prefix is validated as soon as its four bytes are available. A negative length
 * or one above the maximum frame size raises {@link ProtocolException} before any payload
 * buffer is allocated, so an oversized header fails fast instead of waiting for data that will
 * never be accepted.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. Each connection owns one decoder, used by its receive loop only.
 */
public final class FrameDecoder {

    private static final int INITIAL_CAPACITY = 8192;

    private final int maxFrameSize;
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int readIndex;
    private int writeIndex;

    /**
     * Creates a decoder.
     *
     * @param maxFrameSize largest payload length accepted
     */
    public FrameDecoder(int maxFrameSize) {
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Appends received bytes.
     *
     * @param data source array
     * @param offset start offset in the source
     * @param length number of bytes to append
     */
    public void feed(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.checkFromIndexSize(offset, length, data.length);
        ensureWritable(length);
        System.arraycopy(data, offset, buffer, writeIndex, length);
        writeIndex += length;
    }

    /**
     * Returns the payload of the next complete frame.
     *
     * @return the payload, or null if the buffered bytes do not yet hold a complete frame
     * @throws ProtocolException if the buffered length prefix is negative or above the limit
     */
    public byte[] nextFrame() {
        int payloadLength = peekLength();
        if (payloadLength < 0) {
            return null;
        }
        int available = writeIndex - readIndex - MessageCodec.LENGTH_PREFIX_SIZE;
        if (available < payloadLength) {
            return null;
        }
        int start = readIndex + MessageCodec.LENGTH_PREFIX_SIZE;
        byte[] payload = new byte[payloadLength];
        System.arraycopy(buffer, start, payload, 0, payloadLength);
        readIndex = start + payloadLength;
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
        return payload;
    }

    /**
     * Returns the declared payload length of the next frame.
     *
     * @return the length, or -1 if fewer than four header bytes are buffered
     * @throws ProtocolException if the length is negative or above the limit
     */
    public int peekLength() {
        if (writeIndex - readIndex < MessageCodec.LENGTH_PREFIX_SIZE) {
            return -1;
        }
        int length = readLength(buffer, readIndex);
        if (length < 0) {
            throw new ProtocolException("Invalid negative length prefix: " + length);
        }
        if (length > maxFrameSize) {
            throw new ProtocolException(String.format(
                    "Length prefix %d exceeds maximum allowed size %d", length, maxFrameSize));
        }
        return length;
    }

    /**
     * Returns the number of buffered bytes not yet returned as frames.
     *
     * @return buffered byte count
     */
    public int bufferedBytes() {
        return writeIndex - readIndex;
    }

    /** Discards all buffered bytes. */
    public void reset() {
        readIndex = 0;
        writeIndex = 0;
    }

    /**
     * Reads a little-endian 32-bit length.
     *
     * @param source the array
     * @param offset position of the first length byte
     * @return the length as a signed int
     */
    static int readLength(byte[] source, int offset) {
        return (source[offset] & 0xFF)
                | (source[offset + 1] & 0xFF) << 8
                | (source[offset + 2] & 0xFF) << 16
                | (source[offset + 3] & 0xFF) << 24;
    }

    private void ensureWritable(int length) {
        if (buffer.length - writeIndex >= length) {
            return;
        }
        int buffered = writeIndex - readIndex;
        if (readIndex > 0) {
            System.arraycopy(buffer, readIndex, buffer, 0, buffered);
            readIndex = 0;
            writeIndex = buffered;
        }
        if (buffer.length - writeIndex < length) {
            long required = (long) buffered + length;
            long capacity = Math.max((long) buffer.length * 2, required);
            if (capacity > Integer.MAX_VALUE - 8) {
                throw new ProtocolException("Frame buffer would exceed " + capacity + " bytes");
            }
            byte[] grown = new byte[(int) capacity];
            System.arraycopy(buffer, 0, grown, 0, buffered);
            buffer = grown;
        }
    }

    @Override
    public String toString() {
        return String.format(
                "FrameDecoder[buffered=%d, maxFrameSize=%d]", bufferedBytes(), maxFrameSize);
    }
}
