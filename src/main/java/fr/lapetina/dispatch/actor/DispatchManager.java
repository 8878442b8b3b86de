package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.resilience.ResilienceGuard;
import fr.lapetina.dispatch.infrastructure.resilience.ShedTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Public submission entry point.
 *
 * Protocol per request: admit, spawn a workflow, wait for whichever comes first of its
 * terminal result, its crash or the caller timeout, then release the admission slot
 * exactly once. On caller timeout the workflow is cancelled and its late result
 * discarded.
 *
 * Never throws: every outcome is a {@link Result}.
 */
public final class DispatchManager {

    private static final Logger log = LoggerFactory.getLogger(DispatchManager.class);

    private final AdmissionQueue admission;
    private final WorkflowSupervisor supervisor;
    private final MetricsRegistry metrics;

    private volatile SubmitOptions defaults;
    private volatile ResilienceGuard guard;

    public DispatchManager(
            AdmissionQueue admission,
            WorkflowSupervisor supervisor,
            MetricsRegistry metrics,
            SubmitOptions defaults
    ) {
        this.admission = admission;
        this.supervisor = supervisor;
        this.metrics = metrics;
        this.defaults = defaults;
        log.info("DispatchManager initialized: defaultTimeoutMs={}, defaultRetryMax={}",
                defaults.timeoutMs(), defaults.retryMax());
    }

    /**
     * Submits with the configured default timeout and retry budget.
     */
    public Result<Response> submit(Envelope envelope) {
        return submit(envelope, defaults);
    }

    public Result<Response> submit(Envelope envelope, SubmitOptions options) {
        SubmitOptions effective = options != null ? options : defaults;
        String traceId = envelope != null ? Long.toUnsignedString(envelope.traceId()) : "null";

        ResilienceGuard currentGuard = guard;
        if (currentGuard != null && !currentGuard.isAllowed()) {
            metrics.incrementAdmission("quarantined");
            log.warn("Request refused, dispatch quarantined: traceId={}, until={}",
                    traceId, currentGuard.getQuarantinedUntil());
            return Result.error(ErrorType.QUARANTINED);
        }

        if (admission.offer() == AdmissionQueue.Admission.BUSY) {
            metrics.incrementAdmission("busy");
            log.warn("Request refused, admission full: traceId={}, inFlight={}, max={}",
                    traceId, admission.getInFlight(), admission.getMax());
            return Result.error(ErrorType.BUSY);
        }
        metrics.incrementAdmission("admitted");

        Result<Response> result;
        try {
            result = dispatch(envelope, effective, traceId);
        } finally {
            admission.release();
        }

        recordOutcome(result, currentGuard);
        return result;
    }

    private Result<Response> dispatch(Envelope envelope, SubmitOptions options, String traceId) {
        WorkflowHandle handle;
        try {
            handle = supervisor.spawn(envelope, options);
        } catch (SpawnException e) {
            log.error("Workflow spawn failed: traceId={}, error={}", traceId, e.getMessage());
            return Result.error(ErrorType.ACTOR_CRASH, "spawn failed");
        }

        try {
            return handle.await(options.timeoutMs());
        } catch (TimeoutException e) {
            log.warn("Workflow timed out: workflowId={}, traceId={}, timeoutMs={}",
                    handle.id(), traceId, options.timeoutMs());
            handle.cancel(metrics::incrementDiscarded);
            return Result.error(ErrorType.TIMEOUT);
        } catch (ExecutionException e) {
            log.error("Workflow crashed: workflowId={}, traceId={}, cause={}",
                    handle.id(), traceId, String.valueOf(e.getCause()));
            return Result.error(ErrorType.ACTOR_CRASH);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel(metrics::incrementDiscarded);
            log.warn("Interrupted while awaiting workflow: workflowId={}, traceId={}", handle.id(), traceId);
            return Result.error(ErrorType.TIMEOUT, "interrupted");
        }
    }

    private void recordOutcome(Result<Response> result, ResilienceGuard currentGuard) {
        metrics.incrementWorkflowResult(result.error());
        if (currentGuard == null || result.isOk()) {
            return;
        }
        if (result.error() == ErrorType.TIMEOUT) {
            currentGuard.recordTimeout();
        } else if (result.error() == ErrorType.ACTOR_CRASH) {
            currentGuard.recordFailure();
        } else {
            return;
        }
        ShedTarget shed = currentGuard.backpressureSignal();
        if (shed != ShedTarget.NONE) {
            metrics.incrementShed(shed);
            log.warn("Backpressure signal raised: shed={}, failures={}, timeouts={}",
                    shed, currentGuard.getFailures(), currentGuard.getTimeouts());
        }
    }

    /**
     * Changes the defaults used by {@link #submit(Envelope)}.
     */
    public void setDefaults(SubmitOptions defaults) {
        SubmitOptions old = this.defaults;
        this.defaults = defaults;
        log.info("Submit defaults changed: timeoutMs {} -> {}, retryMax {} -> {}",
                old.timeoutMs(), defaults.timeoutMs(), old.retryMax(), defaults.retryMax());
    }

    public SubmitOptions getDefaults() {
        return defaults;
    }

    /**
     * Installs the global quarantine gate; {@code null} disables it.
     */
    public void setResilienceGuard(ResilienceGuard guard) {
        this.guard = guard;
        log.info("Resilience gate {}", guard != null ? "enabled: " + guard.getName() : "disabled");
    }

    public ResilienceGuard getResilienceGuard() {
        return guard;
    }

    public AdmissionQueue getAdmission() {
        return admission;
    }

    public WorkflowSupervisor getSupervisor() {
        return supervisor;
    }
}
