package fr.lapetina.dispatch.api;

import fr.lapetina.dispatch.actor.DdosShield;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.disruptor.EventMultiplexer;
import fr.lapetina.dispatch.disruptor.exception.BackpressureException;
import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.wire.WireCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one request frame into exactly one response frame.
 *
 * Decode, identify the client, consult the shield, submit, encode. Every outcome maps to
 * a frame: 400 for an undecodable frame, 429 when the shield limits the client, 502 with
 * the coarse reason tag when dispatch fails. Nothing here throws to the transport.
 */
public final class ConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";
    static final String DEFAULT_IDENTITY = "unix";

    /**
     * How admitted requests reach the manager.
     */
    public enum SubmitMode {
        DIRECT,
        EVENT_LOOP;

        public static SubmitMode fromConfig(String value) {
            return "event-loop".equalsIgnoreCase(value) ? EVENT_LOOP : DIRECT;
        }
    }

    private final DispatchManager manager;
    private final EventMultiplexer multiplexer;
    private final DdosShield shield;
    private final MetricsRegistry metrics;
    private final SubmitMode mode;

    public ConnectionHandler(
            DispatchManager manager,
            EventMultiplexer multiplexer,
            DdosShield shield,
            MetricsRegistry metrics,
            SubmitMode mode
    ) {
        if (mode == SubmitMode.EVENT_LOOP && multiplexer == null) {
            throw new IllegalArgumentException("Event-loop submit mode requires an event multiplexer");
        }
        this.manager = manager;
        this.multiplexer = multiplexer;
        this.shield = shield;
        this.metrics = metrics;
        this.mode = mode;
        log.info("ConnectionHandler initialized: submitMode={}", mode);
    }

    /**
     * Handles one request frame.
     *
     * @param frame        the raw bytes read from the connection
     * @param peerIdentity transport-level identity of the peer, may be {@code null}
     * @return the encoded response frame
     */
    public byte[] handle(byte[] frame, String peerIdentity) {
        try {
            return WireCodec.encodeResponse(process(frame, peerIdentity));
        } catch (Exception e) {
            log.error("Unexpected failure handling connection: peer={}", peerIdentity, e);
            metrics.incrementListener("actor_error");
            return WireCodec.encodeResponse(Response.dispatchFailure(ErrorType.ACTOR_CRASH));
        }
    }

    private Response process(byte[] frame, String peerIdentity) {
        Result<Envelope> decoded = WireCodec.decodeRequest(frame);
        if (decoded.isError()) {
            metrics.incrementListener("bad_frame");
            log.warn("Invalid frame: peer={}, bytes={}, detail={}",
                    peerIdentity, frame != null ? frame.length : 0, decoded.detail());
            return Response.invalidFrame();
        }

        Envelope envelope = decoded.value();
        String remote = clientIdentity(envelope, peerIdentity);
        if (shield.check(remote) == DdosShield.Decision.LIMITED) {
            metrics.incrementListener("rate_limited");
            log.warn("Client rate limited by shield: remote={}, traceId={}",
                    remote, Long.toUnsignedString(envelope.traceId()));
            return Response.shieldLimited();
        }

        Result<Response> result = submit(envelope.withRemote(remote));
        if (result.isOk()) {
            metrics.incrementListener("ok");
            return result.value();
        }

        metrics.incrementListener("actor_error");
        log.warn("Dispatch failed: remote={}, traceId={}, error={}",
                remote, Long.toUnsignedString(envelope.traceId()), result.error().tag());
        return Response.dispatchFailure(result.error());
    }

    private Result<Response> submit(Envelope envelope) {
        if (mode == SubmitMode.DIRECT) {
            return manager.submit(envelope);
        }

        CompletableFuture<Result<Response>> future;
        try {
            future = multiplexer.submit(envelope);
        } catch (BackpressureException e) {
            log.warn("Event lane refused request: traceId={}, reason={}",
                    Long.toUnsignedString(envelope.traceId()), e.getReason());
            return Result.error(ErrorType.BUSY, e.getReason().name());
        }

        // Queueing time on the lane comes on top of the manager's own wait
        long waitMs = 2 * manager.getDefaults().timeoutMs();
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return Result.error(ErrorType.TIMEOUT, "event lane wait");
        } catch (ExecutionException e) {
            log.error("Event lane failed: traceId={}", Long.toUnsignedString(envelope.traceId()), e.getCause());
            return Result.error(ErrorType.ACTOR_CRASH);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.error(ErrorType.TIMEOUT, "interrupted");
        }
    }

    /**
     * Client identity for shielding: the first forwarded address, else the peer
     * identity, else {@code "unix"}.
     */
    static String clientIdentity(Envelope envelope, String peerIdentity) {
        String forwarded = envelope.header(FORWARDED_FOR);
        if (forwarded != null) {
            int comma = forwarded.indexOf(',');
            String first = (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = envelope.header(REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        if (peerIdentity != null && !peerIdentity.isBlank()) {
            return peerIdentity;
        }
        return DEFAULT_IDENTITY;
    }

    public SubmitMode getMode() {
        return mode;
    }
}
