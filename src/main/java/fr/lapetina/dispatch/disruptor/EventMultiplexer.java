package fr.lapetina.dispatch.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.disruptor.exception.BackpressureException;
import fr.lapetina.dispatch.disruptor.handlers.LaneEventHandler;
import fr.lapetina.dispatch.domain.event.IngressKind;
import fr.lapetina.dispatch.domain.event.LaneEvent;
import fr.lapetina.dispatch.domain.event.LaneEventFactory;
import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * N independent event lanes in front of the {@link DispatchManager}.
 *
 * Each lane is its own LMAX Disruptor with a single consumer thread, so a lane drains
 * its events strictly one after another while lanes progress independently of each
 * other. Publishing is multi-producer and non-blocking: a full lane is reported with a
 * {@link BackpressureException} instead of stalling the publisher.
 */
public final class EventMultiplexer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventMultiplexer.class);

    private final List<Disruptor<LaneEvent>> disruptors = new ArrayList<>();
    private final List<RingBuffer<LaneEvent>> ringBuffers = new ArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final int lanes;

    public EventMultiplexer(
            int lanes,
            int ringBufferSize,
            String waitStrategy,
            DispatchManager manager,
            MetricsRegistry metrics
    ) {
        if (lanes <= 0) {
            throw new IllegalArgumentException("Lane count must be positive: " + lanes);
        }
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("Ring buffer size must be power of 2");
        }
        this.lanes = lanes;

        for (int lane = 0; lane < lanes; lane++) {
            Disruptor<LaneEvent> disruptor = new Disruptor<>(
                    new LaneEventFactory(),
                    ringBufferSize,
                    new LaneThreadFactory("event-lane-" + lane),
                    ProducerType.MULTI,
                    createWaitStrategy(waitStrategy)
            );
            disruptor.handleEventsWith(new LaneEventHandler(lane, manager));
            disruptor.setDefaultExceptionHandler(new LaneExceptionHandler());

            RingBuffer<LaneEvent> ringBuffer = disruptor.getRingBuffer();
            disruptors.add(disruptor);
            ringBuffers.add(ringBuffer);
            metrics.registerEventLaneRemaining(lane, ringBuffer::remainingCapacity);
        }

        log.info("EventMultiplexer created: lanes={}, ringBufferSize={}, waitStrategy={}",
                lanes, ringBufferSize, waitStrategy);
    }

    public EventMultiplexer(DispatchConfig.EventLoopConfig config, DispatchManager manager, MetricsRegistry metrics) {
        this(config.getLanes(), config.getRingBufferSize(), config.getWaitStrategy(), manager, metrics);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptors.forEach(Disruptor::start);
            log.info("EventMultiplexer started: lanes={}", lanes);
        }
    }

    /**
     * Lane that owns a trace: events of one trace always land on the same lane.
     */
    public int laneFor(long traceId) {
        return (int) Math.floorMod(traceId, (long) lanes);
    }

    /**
     * Publishes a submit-request event on the lane owning the envelope's trace.
     */
    public CompletableFuture<Result<Response>> submit(Envelope envelope) {
        return enqueue(laneFor(envelope.traceId()), IngressKind.SUBMIT_REQUEST, envelope, null);
    }

    public CompletableFuture<Result<Response>> submit(Envelope envelope, SubmitOptions options) {
        return enqueue(laneFor(envelope.traceId()), IngressKind.SUBMIT_REQUEST, envelope, options);
    }

    /**
     * Publishes an event on a lane.
     *
     * @return future completed by the lane once the event is handled; a dropped event
     *         completes it with {@code invalid_envelope}
     * @throws BackpressureException if the lane is full or the multiplexer is stopped
     */
    public CompletableFuture<Result<Response>> enqueue(
            int lane,
            IngressKind kind,
            Envelope envelope,
            SubmitOptions options
    ) {
        if (lane < 0 || lane >= lanes) {
            throw new IllegalArgumentException("No such lane: " + lane + " (lanes=" + lanes + ")");
        }
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.NOT_RUNNING);
        }

        CompletableFuture<Result<Response>> future = new CompletableFuture<>();
        if (kind == IngressKind.SUBMIT_REQUEST && envelope == null) {
            future.complete(Result.error(ErrorType.INVALID_ENVELOPE, "missing envelope"));
            return future;
        }

        RingBuffer<LaneEvent> ringBuffer = ringBuffers.get(lane);
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.LANE_FULL,
                    "lane " + lane + ", remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            LaneEvent event = ringBuffer.get(sequence);
            event.initialize(lane, kind, envelope, options, kind == IngressKind.SUBMIT_REQUEST ? future : null);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (kind != IngressKind.SUBMIT_REQUEST) {
            future.complete(Result.error(ErrorType.INVALID_ENVELOPE, "event kind " + kind + " is not dispatched"));
        }

        log.debug("Event enqueued: lane={}, kind={}, sequence={}", lane, kind, sequence);
        return future;
    }

    public int getLanes() {
        return lanes;
    }

    public long getRemainingCapacity(int lane) {
        return ringBuffers.get(lane).remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops every lane once its pending events are drained.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down EventMultiplexer...");
            for (Disruptor<LaneEvent> disruptor : disruptors) {
                try {
                    disruptor.shutdown(30, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    log.warn("Event lane shutdown timed out, halting...");
                    disruptor.halt();
                }
            }
            log.info("EventMultiplexer shut down");
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    private static final class LaneThreadFactory implements ThreadFactory {
        private final String name;
        private final AtomicInteger counter = new AtomicInteger(0);

        LaneThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            int n = counter.getAndIncrement();
            Thread t = new Thread(r, n == 0 ? name : name + "-" + n);
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Completes the pending future so no caller waits on an event whose handler failed.
     */
    private static final class LaneExceptionHandler implements ExceptionHandler<LaneEvent> {

        private static final Logger log = LoggerFactory.getLogger(LaneExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, LaneEvent event) {
            log.error("Exception in lane handler: sequence={}, event={}", sequence, event, ex);
            CompletableFuture<Result<Response>> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                future.complete(Result.error(ErrorType.ACTOR_CRASH));
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during event lane start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during event lane shutdown", ex);
        }
    }
}
