package fr.lapetina.dispatch.domain.event;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SubmitOptions;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot of an event multiplexer lane.
 *
 * Mutable and reused: a slot is initialized by the publisher and cleared by the
 * lane handler once the event has been dispatched. Never touch it outside the lane.
 */
public final class LaneEvent {

    private IngressKind kind;
    private Envelope envelope;
    private SubmitOptions options;
    private CompletableFuture<Result<Response>> resultFuture;
    private Instant enqueuedAt;
    private int lane;

    public void clear() {
        this.kind = null;
        this.envelope = null;
        this.options = null;
        this.resultFuture = null;
        this.enqueuedAt = null;
        this.lane = -1;
    }

    public void initialize(
            int lane,
            IngressKind kind,
            Envelope envelope,
            SubmitOptions options,
            CompletableFuture<Result<Response>> resultFuture
    ) {
        clear();
        this.lane = lane;
        this.kind = kind;
        this.envelope = envelope;
        this.options = options;
        this.resultFuture = resultFuture;
        this.enqueuedAt = Instant.now();
    }

    public IngressKind getKind() {
        return kind;
    }

    public Envelope getEnvelope() {
        return envelope;
    }

    /** May be {@code null}: the manager defaults apply. */
    public SubmitOptions getOptions() {
        return options;
    }

    public CompletableFuture<Result<Response>> getResultFuture() {
        return resultFuture;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public int getLane() {
        return lane;
    }

    @Override
    public String toString() {
        return "LaneEvent{" +
                "lane=" + lane +
                ", kind=" + kind +
                ", traceId=" + (envelope != null ? Long.toUnsignedString(envelope.traceId()) : "null") +
                '}';
    }
}
