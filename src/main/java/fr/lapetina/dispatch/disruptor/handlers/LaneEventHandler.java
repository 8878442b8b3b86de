package fr.lapetina.dispatch.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.domain.event.LaneEvent;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Single consumer of one multiplexer lane.
 *
 * Events are handled one at a time in publication order: submit-request events are
 * forwarded to {@link DispatchManager#submit}, anything else is dropped. The slot is
 * cleared afterwards so the ring buffer does not retain request data.
 */
public final class LaneEventHandler implements EventHandler<LaneEvent> {

    private static final Logger log = LoggerFactory.getLogger(LaneEventHandler.class);

    private final int lane;
    private final DispatchManager manager;

    public LaneEventHandler(int lane, DispatchManager manager) {
        this.lane = lane;
        this.manager = manager;
    }

    @Override
    public void onEvent(LaneEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.getKind()) {
                case SUBMIT_REQUEST -> handleSubmit(event, sequence);
                case NOOP -> log.trace("Dropping noop event: lane={}, sequence={}", lane, sequence);
            }
        } finally {
            event.clear();
        }
    }

    private void handleSubmit(LaneEvent event, long sequence) {
        if (log.isDebugEnabled()) {
            log.debug("Draining submit event: lane={}, sequence={}, traceId={}, queuedMs={}",
                    lane, sequence, Long.toUnsignedString(event.getEnvelope().traceId()),
                    Duration.between(event.getEnqueuedAt(), Instant.now()).toMillis());
        }

        Result<Response> result = event.getOptions() != null
                ? manager.submit(event.getEnvelope(), event.getOptions())
                : manager.submit(event.getEnvelope());

        CompletableFuture<Result<Response>> future = event.getResultFuture();
        if (future != null) {
            future.complete(result);
        }
    }

    public int getLane() {
        return lane;
    }
}
