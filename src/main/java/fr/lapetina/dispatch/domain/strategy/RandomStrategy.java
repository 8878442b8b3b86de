package fr.lapetina.dispatch.domain.strategy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random selection. Duplicate registrations raise a worker's odds.
 */
public final class RandomStrategy implements WorkerSelectionStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<String> select(List<String> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(workers.get(ThreadLocalRandom.current().nextInt(workers.size())));
    }
}
