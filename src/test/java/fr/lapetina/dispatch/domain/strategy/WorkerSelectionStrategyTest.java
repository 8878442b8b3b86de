package fr.lapetina.dispatch.domain.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerSelectionStrategyTest {

    private final List<String> workers = List.of("gpu-0", "gpu-1", "gpu-2");

    @Nested
    @DisplayName("RoundRobinStrategy")
    class RoundRobinTests {

        private RoundRobinStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new RoundRobinStrategy();
        }

        @Test
        @DisplayName("should cycle through workers in registration order")
        void shouldCycleInOrder() {
            String[] selections = new String[6];
            for (int i = 0; i < 6; i++) {
                selections[i] = strategy.select(workers).orElseThrow();
            }

            assertThat(selections).containsExactly("gpu-0", "gpu-1", "gpu-2", "gpu-0", "gpu-1", "gpu-2");
        }

        @Test
        @DisplayName("should weigh duplicate registrations")
        void shouldWeighDuplicates() {
            List<String> weighted = List.of("a", "a", "b");

            long aCount = 0;
            for (int i = 0; i < 30; i++) {
                if (strategy.select(weighted).orElseThrow().equals("a")) {
                    aCount++;
                }
            }

            assertThat(aCount).isEqualTo(20);
        }

        @Test
        @DisplayName("should return empty for empty registry")
        void shouldReturnEmptyForNoWorkers() {
            assertThat(strategy.select(List.of())).isEmpty();
        }

        @Test
        @DisplayName("should restart from the first worker after reset")
        void shouldRestartAfterReset() {
            strategy.select(workers);
            strategy.select(workers);

            strategy.reset();

            assertThat(strategy.select(workers)).contains("gpu-0");
        }

        @Test
        @DisplayName("should be thread-safe")
        void shouldBeThreadSafe() throws InterruptedException {
            int threads = 10;
            int iterations = 100;
            CountDownLatch latch = new CountDownLatch(threads);
            Set<String> selected = ConcurrentHashMap.newKeySet();

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    for (int i = 0; i < iterations; i++) {
                        strategy.select(workers).ifPresent(selected::add);
                    }
                    latch.countDown();
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(selected).containsExactlyInAnyOrderElementsOf(workers);
        }
    }

    @Nested
    @DisplayName("RandomStrategy")
    class RandomTests {

        @Test
        @DisplayName("should only pick registered workers")
        void shouldPickRegisteredWorkers() {
            RandomStrategy strategy = new RandomStrategy();

            for (int i = 0; i < 50; i++) {
                assertThat(strategy.select(workers)).get().isIn(workers);
            }
        }

        @Test
        @DisplayName("should return empty for empty registry")
        void shouldReturnEmptyForNoWorkers() {
            assertThat(new RandomStrategy().select(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should create built-in strategies by name")
        void shouldCreateBuiltIns() {
            assertThat(StrategyFactory.create("round-robin")).get()
                    .isInstanceOf(RoundRobinStrategy.class);
            assertThat(StrategyFactory.create("RANDOM")).get()
                    .isInstanceOf(RandomStrategy.class);
        }

        @Test
        @DisplayName("should fall back to the default for unknown names")
        void shouldFallBackForUnknown() {
            WorkerSelectionStrategy fallback = new RoundRobinStrategy();

            assertThat(StrategyFactory.create("latency-weighted")).isEmpty();
            assertThat(StrategyFactory.create(null)).isEmpty();
            assertThat(StrategyFactory.createOrDefault("latency-weighted", fallback)).isSameAs(fallback);
        }

        @Test
        @DisplayName("should accept custom registrations")
        void shouldAcceptCustomStrategies() {
            StrategyFactory.register("first-only", () -> new WorkerSelectionStrategy() {
                @Override
                public String getName() {
                    return "first-only";
                }

                @Override
                public Optional<String> select(List<String> candidates) {
                    return candidates.stream().findFirst();
                }
            });

            assertThat(StrategyFactory.create("first-only")).get()
                    .extracting(s -> s.select(workers).orElseThrow())
                    .isEqualTo("gpu-0");
            assertThat(StrategyFactory.getRegisteredNames()).contains("first-only", "round-robin", "random");
        }
    }
}
