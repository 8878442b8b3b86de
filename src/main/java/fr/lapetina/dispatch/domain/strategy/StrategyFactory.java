package fr.lapetina.dispatch.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for worker selection strategies, keyed by configuration name.
 *
 * Supports runtime strategy switching without service restart.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<WorkerSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("round-robin", RoundRobinStrategy::new);
        register("random", RandomStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<WorkerSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<WorkerSelectionStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<WorkerSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static WorkerSelectionStrategy createOrDefault(String name, WorkerSelectionStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
