/**
 * Wire format: messages, length-prefixed framing and optional gzip compression.
 *
 * <p>{@link express.mvp.tenacity.client.codec.MessageCodec} turns messages into frames,
 * {@link express.mvp.tenacity.client.codec.FrameDecoder} reassembles frames from a stream.
 */
package express.mvp.tenacity.client.codec;
