package fr.lapetina.dispatch.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Response produced once per request and framed back to the edge.
 * A {@code null} body is framed as an empty one.
 */
public record Response(
        int status,
        String headersFlat,
        byte[] body,
        int metaFlags
) {
    private static final String TEXT_PLAIN = "Content-Type: text/plain\r\n";
    private static final String RETRY_AFTER = "Retry-After: 1\r\n";

    public Response {
        headersFlat = headersFlat != null ? headersFlat : "";
        body = body != null ? body.clone() : null;
    }

    @Override
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    public String bodyAsString() {
        return body != null ? new String(body, StandardCharsets.UTF_8) : "";
    }

    /**
     * Plain-text response with the given status, body and meta flags.
     */
    public static Response text(int status, String body, int metaFlags) {
        return new Response(status, TEXT_PLAIN, body.getBytes(StandardCharsets.UTF_8), metaFlags);
    }

    /** Short-circuit answer when the edge flagged the request as WAF-blocked. */
    public static Response wafBlocked() {
        return text(403, "Forbidden (WAF)", MetaFlags.SECURITY_WAF);
    }

    /** Short-circuit answer when the edge flagged the request as rate-limited. */
    public static Response edgeRateLimited() {
        return new Response(429, TEXT_PLAIN + RETRY_AFTER,
                "Too Many Requests (Rate Limit)".getBytes(StandardCharsets.UTF_8),
                MetaFlags.SECURITY_RATE_LIMIT);
    }

    /** Answer when the per-client shield refuses the request. */
    public static Response shieldLimited() {
        return new Response(429, TEXT_PLAIN + RETRY_AFTER,
                "Rate Limit (Actor Shield)".getBytes(StandardCharsets.UTF_8),
                MetaFlags.SECURITY_RATE_LIMIT);
    }

    public static Response invalidFrame() {
        return text(400, "Invalid frame", MetaFlags.BAD_FRAME);
    }

    public static Response dispatchFailure(ErrorType reason) {
        return text(502, "Actor error: " + reason.tag(), MetaFlags.DISPATCH_ERROR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Response other)) return false;
        return status == other.status
                && metaFlags == other.metaFlags
                && Objects.equals(headersFlat, other.headersFlat)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, headersFlat, metaFlags) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Response{status=" + status +
                ", bodyLength=" + (body != null ? body.length : 0) +
                ", metaFlags=0x" + Integer.toHexString(metaFlags) + '}';
    }

    /**
     * Bits of {@link Response#metaFlags()} set by this tier.
     */
    public static final class MetaFlags {
        public static final int DISPATCH_ERROR = 0x00000010;
        public static final int BAD_FRAME = 0x00000020;
        public static final int SECURITY_WAF = 0x00200000;
        public static final int SECURITY_RATE_LIMIT = 0x00400000;

        private MetaFlags() {
        }
    }
}
