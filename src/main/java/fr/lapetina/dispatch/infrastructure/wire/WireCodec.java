package fr.lapetina.dispatch.infrastructure.wire;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Binary framing between the edge gateway and this tier. All integers are little-endian.
 *
 * <pre>
 * request:  u32 method_len | method | u32 path_len | path | u32 headers_len | headers
 *           | u32 body_len | body | u64 trace_id | u64 span_id | u32 edge_hints
 * response: i32 status | u32 headers_len | headers | u32 body_len | body | u32 meta_flags
 * </pre>
 *
 * Text fields are UTF-8. A request frame must be consumed exactly: trailing bytes
 * after {@code edge_hints} make it invalid.
 */
public final class WireCodec {

    /** Four empty length-prefixed fields plus the fixed tail. */
    public static final int MIN_REQUEST_FRAME = 4 * 4 + 8 + 8 + 4;

    private static final int REQUEST_TAIL = 8 + 8 + 4;
    private static final int VARIABLE_FIELDS = 4;

    private WireCodec() {
        // Utility class
    }

    /**
     * Decodes a request frame. Never throws; a malformed frame yields {@code invalid_frame}.
     */
    public static Result<Envelope> decodeRequest(byte[] frame) {
        return decodeRequest(frame, 0, frame != null ? frame.length : 0);
    }

    public static Result<Envelope> decodeRequest(byte[] frame, int offset, int length) {
        if (frame == null || length < MIN_REQUEST_FRAME) {
            return Result.error(ErrorType.INVALID_FRAME, "frame shorter than " + MIN_REQUEST_FRAME + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(frame, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        try {
            byte[] method = readField(buf, "method");
            byte[] path = readField(buf, "path");
            byte[] headers = readField(buf, "headers");
            byte[] body = readField(buf, "body");
            if (buf.remaining() != REQUEST_TAIL) {
                return Result.error(ErrorType.INVALID_FRAME,
                        "expected " + REQUEST_TAIL + " tail bytes, found " + buf.remaining());
            }
            long traceId = buf.getLong();
            long spanId = buf.getLong();
            int edgeHints = buf.getInt();

            return Result.ok(new Envelope(
                    new String(path, StandardCharsets.UTF_8),
                    new String(method, StandardCharsets.UTF_8),
                    new String(headers, StandardCharsets.UTF_8),
                    body,
                    traceId,
                    spanId,
                    edgeHints,
                    null
            ));
        } catch (FieldOverrunException e) {
            return Result.error(ErrorType.INVALID_FRAME, e.getMessage());
        } catch (BufferUnderflowException e) {
            return Result.error(ErrorType.INVALID_FRAME, "truncated frame");
        }
    }

    /**
     * Computes how many bytes the request frame starting at {@code offset} declares.
     *
     * @return the full frame length, or {@code -1} when not enough bytes are buffered
     *         to know it yet
     */
    public static long requiredRequestLength(byte[] buffer, int offset, int length) {
        ByteBuffer buf = ByteBuffer.wrap(buffer, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        long required = 0;
        for (int i = 0; i < VARIABLE_FIELDS; i++) {
            if (buf.remaining() < 4) {
                return -1;
            }
            long fieldLength = Integer.toUnsignedLong(buf.getInt());
            required += 4 + fieldLength;
            if (fieldLength > buf.remaining()) {
                // Later prefixes are not buffered yet; report the lower bound only once it is final
                return i == VARIABLE_FIELDS - 1 ? required + REQUEST_TAIL : -1;
            }
            buf.position(buf.position() + (int) fieldLength);
        }
        return required + REQUEST_TAIL;
    }

    /**
     * Encodes a request frame. Used by edge-side clients and tests.
     */
    public static byte[] encodeRequest(Envelope envelope) {
        byte[] method = utf8(envelope.method());
        byte[] path = utf8(envelope.path());
        byte[] headers = utf8(envelope.headersFlat());
        byte[] body = envelope.body() != null ? envelope.body() : new byte[0];

        ByteBuffer buf = ByteBuffer
                .allocate(MIN_REQUEST_FRAME + method.length + path.length + headers.length + body.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        putField(buf, method);
        putField(buf, path);
        putField(buf, headers);
        putField(buf, body);
        buf.putLong(envelope.traceId());
        buf.putLong(envelope.spanId());
        buf.putInt(envelope.edgeHints());
        return buf.array();
    }

    /**
     * Encodes a response frame. Deterministic for a given response.
     */
    public static byte[] encodeResponse(Response response) {
        byte[] headers = utf8(response.headersFlat());
        byte[] body = response.body() != null ? response.body() : new byte[0];

        ByteBuffer buf = ByteBuffer
                .allocate(4 + 4 + headers.length + 4 + body.length + 4)
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(response.status());
        putField(buf, headers);
        putField(buf, body);
        buf.putInt(response.metaFlags());
        return buf.array();
    }

    /**
     * Decodes a response frame. Used by edge-side clients and tests.
     */
    public static Result<Response> decodeResponse(byte[] frame) {
        if (frame == null || frame.length < 16) {
            return Result.error(ErrorType.INVALID_FRAME, "response frame too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);
        try {
            int status = buf.getInt();
            byte[] headers = readField(buf, "headers");
            byte[] body = readField(buf, "body");
            if (buf.remaining() != 4) {
                return Result.error(ErrorType.INVALID_FRAME, "bad response tail");
            }
            int metaFlags = buf.getInt();
            return Result.ok(new Response(status, new String(headers, StandardCharsets.UTF_8), body, metaFlags));
        } catch (FieldOverrunException e) {
            return Result.error(ErrorType.INVALID_FRAME, e.getMessage());
        } catch (BufferUnderflowException e) {
            return Result.error(ErrorType.INVALID_FRAME, "truncated response frame");
        }
    }

    private static byte[] readField(ByteBuffer buf, String name) throws FieldOverrunException {
        long declared = Integer.toUnsignedLong(buf.getInt());
        if (declared > buf.remaining()) {
            throw new FieldOverrunException(name + " length " + declared + " exceeds remaining " + buf.remaining());
        }
        byte[] field = new byte[(int) declared];
        buf.get(field);
        return field;
    }

    private static void putField(ByteBuffer buf, byte[] field) {
        buf.putInt(field.length);
        buf.put(field);
    }

    private static byte[] utf8(String s) {
        return s != null ? s.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    private static final class FieldOverrunException extends Exception {
        FieldOverrunException(String message) {
            super(message);
        }
    }
}
