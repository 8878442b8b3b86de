package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.support.MutableClock;
import fr.lapetina.dispatch.support.StubProcessingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowSupervisorTest {

    private static final SubmitOptions OPTIONS = new SubmitOptions(1000, 0);

    private MetricsRegistry metrics;
    private StubProcessingEngine engine;
    private MutableClock clock;
    private WorkflowSupervisor supervisor;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("supervisor_test");
        engine = new StubProcessingEngine();
        clock = new MutableClock();
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.close();
        }
        metrics.close();
    }

    private static Envelope envelope() {
        return Envelope.builder().method("GET").path("/").traceId(7).build();
    }

    private static ExecutorService shutDownExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        return executor;
    }

    /**
     * Hands out a refusing executor first, then working ones.
     */
    private static Supplier<ExecutorService> rejectingThenWorking() {
        AtomicInteger created = new AtomicInteger();
        return () -> created.getAndIncrement() == 0
                ? shutDownExecutor()
                : WorkflowSupervisor.newWorkflowExecutor();
    }

    @Nested
    @DisplayName("Spawning")
    class Spawning {

        @Test
        @DisplayName("should run the spawned workflow to its terminal result")
        void shouldRunWorkflow() throws Exception {
            supervisor = new WorkflowSupervisor(engine, metrics, 3, Duration.ofSeconds(5));

            WorkflowHandle handle = supervisor.spawn(envelope(), OPTIONS);
            Result<Response> result = handle.await(2000);

            assertThat(result.isOk()).isTrue();
            assertThat(handle.id()).startsWith("wf-");
            assertThat(engine.getCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("should give every workflow a distinct id")
        void shouldAssignDistinctIds() throws Exception {
            supervisor = new WorkflowSupervisor(engine, metrics, 3, Duration.ofSeconds(5));

            WorkflowHandle first = supervisor.spawn(envelope(), OPTIONS);
            WorkflowHandle second = supervisor.spawn(envelope(), OPTIONS);

            assertThat(first.id()).isNotEqualTo(second.id());
        }

        @Test
        @DisplayName("should complete the future exceptionally when a workflow crashes")
        void shouldIsolateCrash() throws Exception {
            engine.answering((env, ctx) -> {
                throw new Error("engine blew up");
            });
            supervisor = new WorkflowSupervisor(engine, metrics, 3, Duration.ofSeconds(5));

            WorkflowHandle handle = supervisor.spawn(envelope(), OPTIONS);

            assertThatThrownBy(() -> handle.await(2000))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(Error.class);
            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.RUNNING);

            engine.succeedWith(Response.text(200, "still alive", 0));
            assertThat(supervisor.spawn(envelope(), OPTIONS).await(2000).isOk()).isTrue();
        }

        @Test
        @DisplayName("should refuse spawns once stopped")
        void shouldRefuseWhenStopped() {
            supervisor = new WorkflowSupervisor(engine, metrics, 3, Duration.ofSeconds(5));
            supervisor.close();

            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.STOPPED);
            assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS))
                    .isInstanceOf(SpawnException.class);
        }
    }

    @Nested
    @DisplayName("Spawn failure intensity")
    class Intensity {

        @Test
        @DisplayName("should report a rejected task as a spawn failure")
        void shouldReportRejection() {
            supervisor = new WorkflowSupervisor(engine, metrics, 3, Duration.ofSeconds(5), clock, rejectingThenWorking());

            assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS))
                    .isInstanceOf(SpawnException.class);
            assertThat(supervisor.getSpawnFailuresInWindow()).isEqualTo(1);
            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.RUNNING);
        }

        @Test
        @DisplayName("should fail and escalate when failures exceed the bound within the window")
        void shouldEscalate() {
            AtomicInteger escalations = new AtomicInteger();
            supervisor = new WorkflowSupervisor(engine, metrics, 2, Duration.ofSeconds(5), clock, rejectingThenWorking());
            supervisor.setEscalationHandler(s -> escalations.incrementAndGet());

            for (int i = 0; i < 3; i++) {
                assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS)).isInstanceOf(SpawnException.class);
            }

            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.FAILED);
            assertThat(escalations).hasValue(1);
            assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS))
                    .isInstanceOf(SpawnException.class)
                    .hasMessageContaining("FAILED");
        }

        @Test
        @DisplayName("should forget failures older than the window")
        void shouldSlideWindow() {
            supervisor = new WorkflowSupervisor(engine, metrics, 2, Duration.ofSeconds(5), clock, rejectingThenWorking());

            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS)).isInstanceOf(SpawnException.class);
            }
            clock.advance(Duration.ofSeconds(6));
            assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS)).isInstanceOf(SpawnException.class);

            assertThat(supervisor.getSpawnFailuresInWindow()).isEqualTo(1);
            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.RUNNING);
        }

        @Test
        @DisplayName("should accept work again after a restart")
        void shouldRestart() throws Exception {
            supervisor = new WorkflowSupervisor(engine, metrics, 1, Duration.ofSeconds(5), clock, rejectingThenWorking());
            supervisor.setEscalationHandler(WorkflowSupervisor::restart);

            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> supervisor.spawn(envelope(), OPTIONS)).isInstanceOf(SpawnException.class);
            }

            assertThat(supervisor.getState()).isEqualTo(WorkflowSupervisor.State.RUNNING);
            assertThat(supervisor.getRestarts()).isEqualTo(1);
            assertThat(supervisor.getSpawnFailuresInWindow()).isZero();
            assertThat(supervisor.spawn(envelope(), OPTIONS).terminal().get(2, TimeUnit.SECONDS).isOk()).isTrue();
        }
    }
}
