package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.infrastructure.engine.ProcessingEngine;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Spawns one {@link Workflow} per accepted request and isolates its crashes.
 *
 * Workflows are never restarted: a crash completes the workflow's terminal future
 * exceptionally and is reported to its single submitter.
 *
 * Spawn failures are bounded by an intensity guard ({@code maxSpawnFailures} within
 * {@code window}). Exceeding it moves the supervisor to {@link State#FAILED}, refuses
 * further spawns and notifies the escalation handler, which may {@link #restart()} it.
 */
public final class WorkflowSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSupervisor.class);

    public enum State {
        RUNNING,
        FAILED,
        STOPPED
    }

    private final ProcessingEngine engine;
    private final MetricsRegistry metrics;
    private final Supplier<ExecutorService> executorFactory;
    private final int maxSpawnFailures;
    private final Duration window;
    private final Clock clock;

    private final Deque<Long> spawnFailures = new ArrayDeque<>();
    private final AtomicLong workflowSequence = new AtomicLong(0);
    private final AtomicInteger restarts = new AtomicInteger(0);

    private volatile ExecutorService executor;
    private volatile State state = State.RUNNING;
    private volatile Consumer<WorkflowSupervisor> escalationHandler = s -> { };

    public WorkflowSupervisor(
            ProcessingEngine engine,
            MetricsRegistry metrics,
            int maxSpawnFailures,
            Duration window,
            Clock clock,
            Supplier<ExecutorService> executorFactory
    ) {
        this.engine = engine;
        this.metrics = metrics;
        this.maxSpawnFailures = maxSpawnFailures;
        this.window = window;
        this.clock = clock;
        this.executorFactory = executorFactory;
        this.executor = executorFactory.get();

        log.info("WorkflowSupervisor started: engine={}, maxSpawnFailures={}, windowMs={}",
                engine.getName(), maxSpawnFailures, window.toMillis());
    }

    public WorkflowSupervisor(ProcessingEngine engine, MetricsRegistry metrics, int maxSpawnFailures, Duration window) {
        this(engine, metrics, maxSpawnFailures, window, Clock.systemUTC(), WorkflowSupervisor::newWorkflowExecutor);
    }

    /**
     * Starts a workflow for the envelope.
     *
     * @return the handle to await or cancel the workflow
     * @throws SpawnException if the supervisor is not running or the executor refused the task
     */
    public WorkflowHandle spawn(Envelope envelope, SubmitOptions options) throws SpawnException {
        if (state != State.RUNNING) {
            throw new SpawnException("Supervisor is " + state);
        }

        String id = "wf-" + workflowSequence.incrementAndGet();
        Workflow workflow = new Workflow(id, envelope, options, engine, metrics);
        CompletableFuture<Result<Response>> terminal = new CompletableFuture<>();

        try {
            executor.execute(() -> runIsolated(workflow, terminal));
        } catch (RejectedExecutionException e) {
            recordSpawnFailure(id);
            throw new SpawnException("Executor rejected workflow " + id, e);
        }

        log.debug("Workflow spawned: workflowId={}, traceId={}, timeoutMs={}, retryMax={}",
                id, envelope != null ? Long.toUnsignedString(envelope.traceId()) : "null",
                options.timeoutMs(), options.retryMax());
        return new WorkflowHandle(workflow, terminal);
    }

    private void runIsolated(Workflow workflow, CompletableFuture<Result<Response>> terminal) {
        try {
            terminal.complete(workflow.run());
        } catch (Throwable t) {
            // Surfaces to the submitter as actor_crash
            log.error("Workflow crashed: workflowId={}, state={}", workflow.getId(), workflow.getState(), t);
            terminal.completeExceptionally(t);
        }
    }

    private void recordSpawnFailure(String workflowId) {
        metrics.incrementSpawnFailure();
        boolean escalate;
        int count;
        synchronized (spawnFailures) {
            long now = clock.millis();
            spawnFailures.addLast(now);
            while (!spawnFailures.isEmpty() && now - spawnFailures.peekFirst() > window.toMillis()) {
                spawnFailures.removeFirst();
            }
            count = spawnFailures.size();
            escalate = count > maxSpawnFailures && state == State.RUNNING;
            if (escalate) {
                state = State.FAILED;
            }
        }

        log.warn("Workflow spawn failed: workflowId={}, failuresInWindow={}/{}", workflowId, count, maxSpawnFailures);

        if (escalate) {
            log.error("Spawn failure intensity exceeded, supervisor FAILED: failures={}, windowMs={}",
                    count, window.toMillis());
            try {
                escalationHandler.accept(this);
            } catch (Exception e) {
                log.error("Supervisor escalation handler failed", e);
            }
        }
    }

    /**
     * Replaces the executor and clears the failure history. Workflows already running on
     * the old executor finish normally.
     */
    public synchronized void restart() {
        if (state == State.STOPPED) {
            log.warn("Ignoring restart of a stopped supervisor");
            return;
        }
        ExecutorService old = executor;
        executor = executorFactory.get();
        synchronized (spawnFailures) {
            spawnFailures.clear();
        }
        old.shutdown();
        state = State.RUNNING;
        log.info("WorkflowSupervisor restarted: restarts={}", restarts.incrementAndGet());
    }

    public void setEscalationHandler(Consumer<WorkflowSupervisor> escalationHandler) {
        this.escalationHandler = escalationHandler;
    }

    public State getState() {
        return state;
    }

    public int getRestarts() {
        return restarts.get();
    }

    public int getSpawnFailuresInWindow() {
        synchronized (spawnFailures) {
            return spawnFailures.size();
        }
    }

    @Override
    public synchronized void close() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("WorkflowSupervisor stopped");
    }

    /**
     * Default executor: unbounded cached pool, since the admission queue bounds concurrency.
     */
    public static ExecutorService newWorkflowExecutor() {
        return Executors.newCachedThreadPool(new WorkflowThreadFactory("workflow"));
    }

    private static final class WorkflowThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkflowThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
