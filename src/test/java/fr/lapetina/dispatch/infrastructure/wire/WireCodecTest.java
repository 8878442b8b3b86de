package fr.lapetina.dispatch.infrastructure.wire;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class WireCodecTest {

    private static Envelope sampleEnvelope() {
        return Envelope.builder()
                .method("POST")
                .path("/orders/42")
                .headersFlat("Host: shop.example\r\nContent-Type: application/json\r\n")
                .body("{\"qty\":3}".getBytes(StandardCharsets.UTF_8))
                .traceId(0xCAFEBABEL)
                .spanId(7)
                .edgeHints(Envelope.HINT_CHALLENGED)
                .build();
    }

    @Nested
    @DisplayName("Request decoding")
    class RequestDecoding {

        @Test
        @DisplayName("should recover every field of a well-formed frame")
        void shouldRecoverFields() {
            Envelope original = sampleEnvelope();

            Result<Envelope> decoded = WireCodec.decodeRequest(WireCodec.encodeRequest(original));

            assertThat(decoded.isOk()).isTrue();
            Envelope env = decoded.value();
            assertThat(env.method()).isEqualTo("POST");
            assertThat(env.path()).isEqualTo("/orders/42");
            assertThat(env.headersFlat()).isEqualTo(original.headersFlat());
            assertThat(env.body()).isEqualTo(original.body());
            assertThat(env.traceId()).isEqualTo(0xCAFEBABEL);
            assertThat(env.spanId()).isEqualTo(7);
            assertThat(env.edgeHints()).isEqualTo(Envelope.HINT_CHALLENGED);
            assertThat(env.remote()).isNull();
        }

        @Test
        @DisplayName("should decode the minimum frame with all fields empty")
        void shouldDecodeMinimumFrame() {
            byte[] frame = new byte[WireCodec.MIN_REQUEST_FRAME];

            Result<Envelope> decoded = WireCodec.decodeRequest(frame);

            assertThat(decoded.isOk()).isTrue();
            assertThat(decoded.value().method()).isEmpty();
            assertThat(decoded.value().path()).isEmpty();
            assertThat(decoded.value().bodyLength()).isZero();
        }

        @Test
        @DisplayName("should read little-endian unsigned ids")
        void shouldReadLittleEndianIds() {
            Envelope original = Envelope.builder().method("GET").path("/").traceId(-1L).spanId(Long.MIN_VALUE).build();
            byte[] frame = WireCodec.encodeRequest(original);

            // method_len is the first field, little-endian
            assertThat(frame[0]).isEqualTo((byte) 3);
            assertThat(frame[1]).isZero();

            Envelope env = WireCodec.decodeRequest(frame).value();
            assertThat(Long.toUnsignedString(env.traceId())).isEqualTo("18446744073709551615");
            assertThat(env.spanId()).isEqualTo(Long.MIN_VALUE);
        }

        @Test
        @DisplayName("should decode text fields as UTF-8")
        void shouldDecodeUtf8() {
            Envelope original = Envelope.builder().method("GET").path("/café/東京").build();

            Envelope env = WireCodec.decodeRequest(WireCodec.encodeRequest(original)).value();

            assertThat(env.path()).isEqualTo("/café/東京");
        }

        @Test
        @DisplayName("should decode a frame embedded at an offset")
        void shouldDecodeAtOffset() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());
            byte[] padded = new byte[frame.length + 10];
            System.arraycopy(frame, 0, padded, 5, frame.length);

            Result<Envelope> decoded = WireCodec.decodeRequest(padded, 5, frame.length);

            assertThat(decoded.isOk()).isTrue();
            assertThat(decoded.value().path()).isEqualTo("/orders/42");
        }
    }

    @Nested
    @DisplayName("Invalid frames")
    class InvalidFrames {

        @Test
        @DisplayName("should reject a frame shorter than the minimum")
        void shouldRejectShortFrame() {
            Result<Envelope> decoded = WireCodec.decodeRequest(new byte[WireCodec.MIN_REQUEST_FRAME - 1]);

            assertThat(decoded.isError()).isTrue();
            assertThat(decoded.error()).isEqualTo(ErrorType.INVALID_FRAME);
        }

        @Test
        @DisplayName("should reject null input")
        void shouldRejectNull() {
            assertThat(WireCodec.decodeRequest(null).error()).isEqualTo(ErrorType.INVALID_FRAME);
        }

        @Test
        @DisplayName("should reject a method length that overruns the buffer")
        void shouldRejectOverrunningLength() {
            ByteBuffer buf = ByteBuffer.allocate(48).order(ByteOrder.LITTLE_ENDIAN);
            buf.putInt(1000);
            buf.put("GET".getBytes(StandardCharsets.US_ASCII));

            Result<Envelope> decoded = WireCodec.decodeRequest(buf.array());

            assertThat(decoded.error()).isEqualTo(ErrorType.INVALID_FRAME);
        }

        @Test
        @DisplayName("should reject a length that does not fit in a signed int")
        void shouldRejectHugeUnsignedLength() {
            ByteBuffer buf = ByteBuffer.allocate(WireCodec.MIN_REQUEST_FRAME).order(ByteOrder.LITTLE_ENDIAN);
            buf.putInt(0xFFFFFFFF);

            assertThat(WireCodec.decodeRequest(buf.array()).error()).isEqualTo(ErrorType.INVALID_FRAME);
        }

        @Test
        @DisplayName("should reject every truncation of a valid frame")
        void shouldRejectTruncations() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());

            for (int len = 0; len < frame.length; len++) {
                Result<Envelope> decoded = WireCodec.decodeRequest(Arrays.copyOf(frame, len));
                assertThat(decoded.error())
                        .as("truncated to %d bytes", len)
                        .isEqualTo(ErrorType.INVALID_FRAME);
            }
        }

        @Test
        @DisplayName("should reject trailing bytes after the edge hints")
        void shouldRejectTrailingBytes() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());

            Result<Envelope> decoded = WireCodec.decodeRequest(Arrays.copyOf(frame, frame.length + 1));

            assertThat(decoded.error()).isEqualTo(ErrorType.INVALID_FRAME);
        }
    }

    @Nested
    @DisplayName("Frame length probing")
    class FrameLength {

        @Test
        @DisplayName("should report the full length of a complete frame")
        void shouldReportFullLength() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());

            assertThat(WireCodec.requiredRequestLength(frame, 0, frame.length)).isEqualTo(frame.length);
        }

        @Test
        @DisplayName("should report unknown while length prefixes are missing")
        void shouldReportUnknown() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());

            assertThat(WireCodec.requiredRequestLength(frame, 0, 3)).isEqualTo(-1);
            assertThat(WireCodec.requiredRequestLength(frame, 0, 8)).isEqualTo(-1);
        }

        @Test
        @DisplayName("should report the length once the body prefix is buffered")
        void shouldReportLengthFromBodyPrefix() {
            byte[] frame = WireCodec.encodeRequest(sampleEnvelope());
            int bodyPrefixEnd = frame.length - 20 - sampleEnvelope().bodyLength();

            assertThat(WireCodec.requiredRequestLength(frame, 0, bodyPrefixEnd)).isEqualTo(frame.length);
        }
    }

    @Nested
    @DisplayName("Response encoding")
    class ResponseEncoding {

        @Test
        @DisplayName("should lay out status, headers, body and meta flags")
        void shouldLayOutFields() {
            Response response = new Response(201, "X: y\r\n", "done".getBytes(StandardCharsets.UTF_8), 0x10);

            ByteBuffer buf = ByteBuffer.wrap(WireCodec.encodeResponse(response)).order(ByteOrder.LITTLE_ENDIAN);

            assertThat(buf.getInt()).isEqualTo(201);
            assertThat(buf.getInt()).isEqualTo(6);
            buf.position(buf.position() + 6);
            assertThat(buf.getInt()).isEqualTo(4);
            buf.position(buf.position() + 4);
            assertThat(buf.getInt()).isEqualTo(0x10);
            assertThat(buf.hasRemaining()).isFalse();
        }

        @Test
        @DisplayName("should frame a missing body as empty")
        void shouldFrameMissingBodyAsEmpty() {
            byte[] bytes = WireCodec.encodeResponse(new Response(204, null, null, 0));

            assertThat(bytes).hasSize(16);
            Response decoded = WireCodec.decodeResponse(bytes).value();
            assertThat(decoded.status()).isEqualTo(204);
            assertThat(decoded.body()).isEmpty();
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            Response response = Response.dispatchFailure(ErrorType.TIMEOUT);

            assertThat(WireCodec.encodeResponse(response)).isEqualTo(WireCodec.encodeResponse(response));
        }
    }
}
