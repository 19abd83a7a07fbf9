package io.relaychat.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaychat.core.protocol.ClientMessage;
import io.relaychat.core.protocol.ServerMessage;
import io.relaychat.core.util.JsonUtils;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Length-prefixed framing for protocol messages.
 *
 * <pre>
 * +------------------------+-----------------------------+
 * |  Length (4 bytes, BE)  |   JSON payload (N bytes)    |
 * +------------------------+-----------------------------+
 * </pre>
 *
 * <p>The length is an unsigned 32-bit value counting payload bytes only. Frames longer
 * than {@link #getMaxFrameLength()} are refused in both directions.</p>
 *
 * <p>Instances are immutable and may be shared between threads; callers are responsible for
 * not interleaving two writers on the same stream.</p>
 */
public final class FrameCodec {

    public static final int HEADER_SIZE = 4;

    /**
     * Default maximum payload size: 1 MiB.
     */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxFrameLength;

    public FrameCodec() {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    public FrameCodec(int maxFrameLength) {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
        if (maxFrameLength > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new IllegalArgumentException("maxFrameLength too large: " + maxFrameLength);
        }
        this.mapper = JsonUtils.mapper();
        this.maxFrameLength = maxFrameLength;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    /**
     * Writes one frame carrying {@code message} and flushes.
     *
     * @return number of bytes written, header included
     */
    public int writeFrame(OutputStream out, ServerMessage message) throws IOException {
        return writeFrame(out, encode(message));
    }

    /**
     * Writes one frame carrying {@code message} and flushes.
     *
     * @return number of bytes written, header included
     */
    public int writeFrame(OutputStream out, ClientMessage message) throws IOException {
        return writeFrame(out, encode(message));
    }

    /**
     * Writes an already encoded payload as one frame and flushes.
     *
     * @return number of bytes written, header included
     * @throws FramingException if the payload exceeds the maximum frame length
     */
    public int writeFrame(OutputStream out, byte[] payload) throws IOException {
        if (payload.length > maxFrameLength) {
            throw new FramingException(String.format(
                "Payload size %d exceeds maximum frame length %d", payload.length, maxFrameLength));
        }
        byte[] frame = ByteBuffer.allocate(HEADER_SIZE + payload.length)
            .putInt(payload.length)
            .put(payload)
            .array();
        out.write(frame);
        out.flush();
        return frame.length;
    }

    /**
     * Reads the next frame payload.
     *
     * @return the payload, or empty if the peer closed the stream before the next frame began
     * @throws EOFException     if the stream ends inside a frame
     * @throws FramingException if the length prefix exceeds the maximum frame length
     */
    public Optional<byte[]> readFrame(InputStream in) throws IOException {
        int first = in.read();
        if (first < 0) {
            return Optional.empty();
        }

        byte[] header = new byte[HEADER_SIZE];
        header[0] = (byte) first;
        if (in.readNBytes(header, 1, HEADER_SIZE - 1) < HEADER_SIZE - 1) {
            throw new EOFException("Stream closed inside frame length prefix");
        }

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).getInt());
        if (length > maxFrameLength) {
            throw new FramingException(String.format(
                "Length prefix %d exceeds maximum frame length %d", length, maxFrameLength));
        }

        byte[] payload = in.readNBytes((int) length);
        if (payload.length < length) {
            throw new EOFException(String.format(
                "Stream closed after %d of %d payload bytes", payload.length, length));
        }
        return Optional.of(payload);
    }

    public byte[] encode(ServerMessage message) throws IOException {
        return mapper.writerFor(ServerMessage.class).writeValueAsBytes(message);
    }

    public byte[] encode(ClientMessage message) throws IOException {
        return mapper.writerFor(ClientMessage.class).writeValueAsBytes(message);
    }

    public ClientMessage decodeClientMessage(byte[] payload) throws DecodeException {
        return decode(payload, ClientMessage.class);
    }

    public ServerMessage decodeServerMessage(byte[] payload) throws DecodeException {
        return decode(payload, ServerMessage.class);
    }

    private <T> T decode(byte[] payload, Class<T> type) throws DecodeException {
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (IOException e) {
            throw new DecodeException("Payload is not valid JSON: " + describe(e), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new DecodeException("Empty payload");
        }

        // Field-less variants may arrive as a bare name, e.g. "ListUsers"
        if (node.isTextual()) {
            ObjectNode wrapped = mapper.createObjectNode();
            wrapped.putObject(node.textValue());
            node = wrapped;
        }

        try {
            return mapper.treeToValue(node, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new DecodeException("Not a valid " + type.getSimpleName() + ": " + describe(e), e);
        }
    }

    private static String describe(Exception e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }
}
