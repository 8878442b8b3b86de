package fr.lapetina.dispatch.domain.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Selection policy for the actor pool.
 *
 * Implementations must be thread-safe: the pool calls them from any submitting thread.
 * Replacing the policy must not change the pool's register/pick contract.
 */
public interface WorkerSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a worker from the registry snapshot.
     *
     * @param workers Registered worker identities, in registration order (may contain duplicates)
     * @return Selected worker, or empty if the registry is empty
     */
    Optional<String> select(List<String> workers);

    /**
     * Feedback hook for latency-aware policies.
     *
     * @param workerId The worker that handled a task
     * @param latencyMs Observed latency in milliseconds
     */
    default void recordLatency(String workerId, long latencyMs) {
        // Default no-op, override for strategies that need feedback
    }

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
