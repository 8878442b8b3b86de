package fr.lapetina.dispatch.domain.strategy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin selection: the next index modulo the registry size.
 *
 * A worker registered twice is returned twice per cycle.
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements WorkerSelectionStrategy {

    private final AtomicLong nextIndex = new AtomicLong(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<String> select(List<String> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }
        int index = (int) Math.floorMod(nextIndex.getAndIncrement(), (long) workers.size());
        return Optional.of(workers.get(index));
    }

    @Override
    public void reset() {
        nextIndex.set(0);
    }
}
