package express.mvp.tenacity.benchmark;

import express.mvp.tenacity.client.codec.FrameDecoder;
import express.mvp.tenacity.client.codec.Message;
import express.mvp.tenacity.client.codec.MessageCodec;
import express.mvp.tenacity.client.codec.MessageType;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;

/**
 * JMH benchmark for frame encoding and decoding.
 *
 * <p>Payloads either repeat a short pattern, so they compress well above the threshold, or are
 * random bytes that gzip cannot shrink.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 2, time = 5)
@Measurement(iterations = 3, time = 10)
public class MessageCodecBenchmark {

    @Param({ "64", "511", "4096", "65536" })
    private int bodySize;

    @Param({ "PATTERN", "RANDOM" })
    private String content;

    @Param({ "true", "false" })
    private boolean compression;

    private MessageCodec codec;
    private FrameDecoder decoder;
    private Message message;
    private byte[] frame;

    @Setup
    public void setup() {
        codec = new MessageCodec(MessageCodec.DEFAULT_COMPRESSION_THRESHOLD, compression,
                MessageCodec.DEFAULT_MAX_FRAME_SIZE);
        decoder = codec.newDecoder();
        byte[] body = new byte[bodySize];
        if ("RANDOM".equals(content)) {
            new Random(42).nextBytes(body);
        } else {
            for (int i = 0; i < body.length; i++) {
                body[i] = (byte) ('a' + i % 8);
            }
        }
        message = new Message(MessageType.STATE_SYNC, 1, 1_700_000_000_000L, body);
        frame = codec.encodeFrame(message);
    }

    @Benchmark
    public byte[] encodeFrame() {
        return codec.encodeFrame(message);
    }

    @Benchmark
    public Message decodeFrame() {
        return codec.decodeFrame(frame);
    }

    @Benchmark
    public Message streamDecode() {
        decoder.feed(frame, 0, frame.length);
        return codec.decodePayload(decoder.nextFrame());
    }
}
