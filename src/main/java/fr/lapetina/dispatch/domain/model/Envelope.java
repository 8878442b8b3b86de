package fr.lapetina.dispatch.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Normalized request handed over by the edge gateway.
 *
 * Fields are not checked on construction: a decoded or hand-built envelope may be
 * incomplete, and rejecting it is the workflow's job ({@code invalid_envelope}).
 * {@code traceId} and {@code spanId} carry unsigned 64-bit values, {@code edgeHints}
 * an unsigned 32-bit bitfield.
 */
public record Envelope(
        String path,
        String method,
        String headersFlat,
        byte[] body,
        long traceId,
        long spanId,
        int edgeHints,
        String remote
) {
    public static final int HINT_RATE_LIMITED = 0x1;
    public static final int HINT_WAF_BLOCKED = 0x2;
    public static final int HINT_CHALLENGED = 0x4;

    public Envelope {
        body = body != null ? body.clone() : null;
    }

    @Override
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    public int bodyLength() {
        return body != null ? body.length : 0;
    }

    /**
     * Returns a copy of this envelope bound to the given client identity.
     */
    public Envelope withRemote(String remote) {
        return new Envelope(path, method, headersFlat, body, traceId, spanId, edgeHints, remote);
    }

    /**
     * Looks up the first value of a header in the flat {@code K: V\r\n} block.
     * Header names are compared case-insensitively.
     */
    public String header(String name) {
        if (headersFlat == null || headersFlat.isEmpty()) {
            return null;
        }
        for (String line : headersFlat.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase(name)) {
                return line.substring(colon + 1).trim();
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope other)) return false;
        return traceId == other.traceId
                && spanId == other.spanId
                && edgeHints == other.edgeHints
                && Objects.equals(path, other.path)
                && Objects.equals(method, other.method)
                && Objects.equals(headersFlat, other.headersFlat)
                && Arrays.equals(body, other.body)
                && Objects.equals(remote, other.remote);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(path, method, headersFlat, traceId, spanId, edgeHints, remote);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "method=" + method +
                ", path=" + path +
                ", bodyLength=" + bodyLength() +
                ", traceId=" + Long.toUnsignedString(traceId) +
                ", spanId=" + Long.toUnsignedString(spanId) +
                ", edgeHints=0x" + Integer.toHexString(edgeHints) +
                ", remote=" + remote +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String path;
        private String method;
        private String headersFlat = "";
        private byte[] body;
        private long traceId;
        private long spanId;
        private int edgeHints;
        private String remote;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder headersFlat(String headersFlat) {
            this.headersFlat = headersFlat;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder traceId(long traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(long spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder edgeHints(int edgeHints) {
            this.edgeHints = edgeHints;
            return this;
        }

        public Builder remote(String remote) {
            this.remote = remote;
            return this;
        }

        public Envelope build() {
            return new Envelope(path, method, headersFlat, body, traceId, spanId, edgeHints, remote);
        }
    }
}
