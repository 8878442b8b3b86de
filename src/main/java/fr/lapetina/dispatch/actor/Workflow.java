package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.event.WorkflowState;
import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Lane;
import fr.lapetina.dispatch.domain.model.RequestContext;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SecurityVerdict;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.domain.routing.Router;
import fr.lapetina.dispatch.infrastructure.engine.ProcessingEngine;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-request state machine.
 *
 * <pre>
 * INIT -> RUNNING -> SUCCEEDED
 *                 -> RETRY_SCHEDULED -> RUNNING
 *                 -> FAILED
 * </pre>
 *
 * A workflow is single-shot: {@link #run()} is called once by the supervisor and returns
 * the one terminal result. Retries happen inside {@code run()}, sequentially and without
 * delay. Timeouts exhaust into {@code timeout}; every other attempt failure exhausts into
 * {@code actor_crash}. An invalid envelope fails at once, whatever the budget.
 *
 * Cancellation is advisory: it stops further retries but never interrupts a running
 * engine call.
 */
public final class Workflow {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final String id;
    private final Envelope envelope;
    private final long timeoutMs;
    private final int retryMax;
    private final ProcessingEngine engine;
    private final MetricsRegistry metrics;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger engineCalls = new AtomicInteger(0);
    private volatile WorkflowState state = WorkflowState.INIT;
    private volatile int retryLeft;

    public Workflow(
            String id,
            Envelope envelope,
            SubmitOptions options,
            ProcessingEngine engine,
            MetricsRegistry metrics
    ) {
        this.id = id;
        this.envelope = envelope;
        this.timeoutMs = options.timeoutMs();
        this.retryMax = options.retryMax();
        this.retryLeft = options.retryMax();
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * Drives the workflow to a terminal state.
     *
     * @return the terminal result; never {@code null}
     * @throws IllegalStateException if the workflow was already run
     */
    public Result<Response> run() {
        if (state != WorkflowState.INIT) {
            throw new IllegalStateException("Workflow already started: id=" + id + ", state=" + state);
        }

        if (!isValid(envelope)) {
            log.warn("Invalid envelope: workflowId={}, envelope={}", id, envelope);
            return fail(ErrorType.INVALID_ENVELOPE, "missing required field");
        }

        int attempt = 0;
        while (true) {
            attempt++;
            state = WorkflowState.RUNNING;
            Result<Response> outcome = attempt(attempt);

            if (outcome.isOk()) {
                state = WorkflowState.SUCCEEDED;
                log.debug("Workflow succeeded: workflowId={}, traceId={}, attempt={}, status={}",
                        id, Long.toUnsignedString(envelope.traceId()), attempt, outcome.value().status());
                return outcome;
            }

            ErrorType exhausted = outcome.error().isTimeout() ? ErrorType.TIMEOUT : ErrorType.ACTOR_CRASH;
            if (retryLeft <= 0) {
                log.warn("Workflow failed: workflowId={}, traceId={}, attempts={}, lastError={}, result={}",
                        id, Long.toUnsignedString(envelope.traceId()), attempt,
                        outcome.error().tag(), exhausted.tag());
                return fail(exhausted, outcome.detail());
            }
            if (cancelled.get()) {
                log.debug("Workflow cancelled before retry: workflowId={}, attempt={}", id, attempt);
                return fail(exhausted, "cancelled");
            }

            retryLeft--;
            state = WorkflowState.RETRY_SCHEDULED;
            log.debug("Retrying workflow: workflowId={}, traceId={}, error={}, retryLeft={}",
                    id, Long.toUnsignedString(envelope.traceId()), outcome.error().tag(), retryLeft);
        }
    }

    private Result<Response> attempt(int attempt) {
        long start = System.nanoTime();
        Result<Response> outcome = step(attempt);
        metrics.recordAttemptLatency(outcome.isOk(), Duration.ofNanos(System.nanoTime() - start));
        return outcome;
    }

    private Result<Response> step(int attempt) {
        Result<SecurityVerdict> security = Guarded.call(() -> engine.security(envelope.edgeHints()));
        if (security.isError()) {
            return security.asError();
        }
        Result<Lane> lane = Guarded.call(() -> Router.pickLane(envelope.path(), envelope.method()));
        if (lane.isError()) {
            return lane.asError();
        }
        metrics.incrementLane(lane.value());

        SecurityVerdict verdict = security.value();
        if (verdict.waf()) {
            return Result.ok(Response.wafBlocked());
        }
        if (verdict.rateLimited()) {
            return Result.ok(Response.edgeRateLimited());
        }

        engineCalls.incrementAndGet();
        RequestContext context = new RequestContext(
                id,
                envelope.traceId(),
                envelope.spanId(),
                envelope.remote(),
                lane.value(),
                verdict,
                attempt,
                timeoutMs
        );
        return Guarded.flatCall(() -> engine.processRequest(envelope, context));
    }

    private Result<Response> fail(ErrorType error, String detail) {
        state = WorkflowState.FAILED;
        return Result.error(error, detail);
    }

    private static boolean isValid(Envelope envelope) {
        return envelope != null
                && envelope.path() != null
                && envelope.method() != null
                && envelope.headersFlat() != null;
    }

    /**
     * Requests that no further attempts are made. The current attempt runs to completion.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("Workflow cancel requested: workflowId={}, state={}", id, state);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getId() {
        return id;
    }

    public WorkflowState getState() {
        return state;
    }

    public int getRetryLeft() {
        return retryLeft;
    }

    public int getRetryMax() {
        return retryMax;
    }

    /**
     * Number of processing engine calls made so far. Short-circuited attempts are not counted.
     */
    public int getEngineCalls() {
        return engineCalls.get();
    }

    public Envelope getEnvelope() {
        return envelope;
    }
}
