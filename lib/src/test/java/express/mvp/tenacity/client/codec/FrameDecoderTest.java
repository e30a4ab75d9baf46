package express.mvp.tenacity.client.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link FrameDecoder}. */
@DisplayName("FrameDecoder")
class FrameDecoderTest {

    private MessageCodec codec;
    private FrameDecoder decoder;

    @BeforeEach
    void setUp() {
        codec = new MessageCodec(512, true, 65536);
        decoder = codec.newDecoder();
    }

    private static byte[] lengthPrefix(int length) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(length).array();
    }

    @Test
    @DisplayName("Returns null until the prefix is complete")
    void partialPrefix() {
        decoder.feed(new byte[] {5, 0}, 0, 2);

        assertEquals(-1, decoder.peekLength());
        assertNull(decoder.nextFrame());
        assertEquals(2, decoder.bufferedBytes());
    }

    @Test
    @DisplayName("Reassembles a frame delivered one byte at a time")
    void byteByByte() {
        Message message = new Message(MessageType.GAME_DATA, 11, 5L, "hello".getBytes());
        byte[] frame = codec.encodeFrame(message);

        byte[] payload = null;
        for (int i = 0; i < frame.length; i++) {
            assertNull(payload);
            decoder.feed(frame, i, 1);
            payload = decoder.nextFrame();
        }

        assertNotNull(payload);
        assertEquals(message, codec.decodePayload(payload));
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    @DisplayName("Splits several frames from one read")
    void severalFramesInOneRead() {
        byte[] first = codec.encodeFrame(new Message(MessageType.HEARTBEAT, 1, 1L, null));
        byte[] second = codec.encodeFrame(new Message(MessageType.STATE_SYNC, 2, 2L, new byte[40]));
        byte[] both = new byte[first.length + second.length];
        System.arraycopy(first, 0, both, 0, first.length);
        System.arraycopy(second, 0, both, first.length, second.length);

        decoder.feed(both, 0, both.length);

        assertEquals(MessageType.HEARTBEAT, codec.decodePayload(decoder.nextFrame()).type());
        assertEquals(MessageType.STATE_SYNC, codec.decodePayload(decoder.nextFrame()).type());
        assertNull(decoder.nextFrame());
    }

    @Test
    @DisplayName("Rejects an oversized prefix as soon as it arrives")
    void oversizedPrefixRejectedEarly() {
        decoder.feed(lengthPrefix(70000), 0, 4);

        ProtocolException e = assertThrows(ProtocolException.class, decoder::nextFrame);
        assertTrue(e.getMessage().contains("70000"));
        assertTrue(e.getMessage().contains("65536"));
    }

    @Test
    @DisplayName("Accepts a prefix exactly at the limit")
    void prefixAtLimit() {
        decoder.feed(lengthPrefix(65536), 0, 4);
        assertEquals(65536, decoder.peekLength());
        assertNull(decoder.nextFrame());
    }

    @Test
    @DisplayName("Rejects a negative prefix")
    void negativePrefix() {
        decoder.feed(lengthPrefix(-1), 0, 4);
        assertThrows(ProtocolException.class, decoder::peekLength);
    }

    @Test
    @DisplayName("Grows past its initial buffer")
    void growsBuffer() {
        Message message = new Message(MessageType.GAME_DATA, 1, 1L, new byte[20_000]);
        byte[] frame = new MessageCodec(512, false, 65536).encodeFrame(message);

        decoder.feed(frame, 0, frame.length);

        assertEquals(20_000 + MessageCodec.MESSAGE_HEADER_SIZE, decoder.nextFrame().length);
    }

    @Test
    @DisplayName("Reset discards buffered bytes")
    void resetDiscards() {
        decoder.feed(new byte[] {1, 2, 3}, 0, 3);
        decoder.reset();
        assertEquals(0, decoder.bufferedBytes());
    }
}
