package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.strategy.RoundRobinStrategy;
import fr.lapetina.dispatch.domain.strategy.WorkerSelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of long-lived heavy-task workers.
 *
 * Registration appends; duplicates are kept and weigh the selection. {@link #pick()}
 * never removes a worker. The selection policy is pluggable and may be swapped at runtime.
 */
public final class ActorPool {

    private static final Logger log = LoggerFactory.getLogger(ActorPool.class);

    private final List<String> workers = new CopyOnWriteArrayList<>();
    private final AtomicReference<WorkerSelectionStrategy> strategy;

    public ActorPool(WorkerSelectionStrategy strategy) {
        this.strategy = new AtomicReference<>(strategy);
    }

    public ActorPool() {
        this(new RoundRobinStrategy());
    }

    public void register(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("Worker id must not be blank");
        }
        workers.add(workerId);
        log.info("Worker registered: workerId={}, poolSize={}", workerId, workers.size());
    }

    /**
     * Returns the next worker according to the current policy.
     *
     * @return the worker id, or {@code no_workers} if nothing is registered
     */
    public Result<String> pick() {
        Optional<String> selected = strategy.get().select(workers);
        if (selected.isEmpty()) {
            log.debug("No worker available for pick");
            return Result.error(ErrorType.NO_WORKERS);
        }
        return Result.ok(selected.get());
    }

    public void setStrategy(WorkerSelectionStrategy newStrategy) {
        WorkerSelectionStrategy old = strategy.getAndSet(newStrategy);
        log.info("Worker selection strategy changed: {} -> {}", old.getName(), newStrategy.getName());
    }

    public WorkerSelectionStrategy getStrategy() {
        return strategy.get();
    }

    /**
     * Snapshot of the registry in registration order.
     */
    public List<String> getWorkers() {
        return List.copyOf(workers);
    }

    public int size() {
        return workers.size();
    }
}
