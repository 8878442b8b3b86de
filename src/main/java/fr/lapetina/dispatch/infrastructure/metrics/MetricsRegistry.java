package fr.lapetina.dispatch.infrastructure.metrics;

import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Lane;
import fr.lapetina.dispatch.infrastructure.resilience.ShedTarget;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Telemetry sink backed by Micrometer. Recording is fire-and-forget.
 *
 * Provides:
 * - Listener outcome and admission counters
 * - Per-attempt workflow latency timers
 * - Lane, result, spawn failure and shed signal counters
 * - Admission, event lane and pool gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("actor_dispatch");
    }

    /**
     * Counts one connection outcome: ok, actor_error, rate_limited, bad_frame or read_error.
     */
    public void incrementListener(String outcome) {
        counter("_listener_total", "Connections handled by outcome", "outcome", outcome).increment();
    }

    /**
     * Counts one admission decision: admitted, busy or quarantined.
     */
    public void incrementAdmission(String outcome) {
        counter("_admission_total", "Admission decisions", "outcome", outcome).increment();
    }

    /**
     * Records the latency of one engine attempt, successful or not.
     */
    public void recordAttemptLatency(boolean success, Duration latency) {
        String outcome = success ? "ok" : "err";
        attemptTimers.computeIfAbsent(outcome, k ->
                Timer.builder(prefix + "_workflow_attempt_latency")
                        .description("Workflow engine attempt latency")
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementLane(Lane lane) {
        counter("_workflow_lane_total", "Workflows by routing lane", "lane", lane.label()).increment();
    }

    /**
     * Counts a terminal workflow result; {@code null} means success.
     */
    public void incrementWorkflowResult(ErrorType error) {
        String result = error == null ? "ok" : error.tag();
        counter("_workflow_result_total", "Terminal workflow results", "result", result).increment();
    }

    public void incrementDiscarded() {
        counter("_workflow_discarded_total", "Workflow results discarded after caller timeout").increment();
    }

    public void incrementSpawnFailure() {
        counter("_supervisor_spawn_failures_total", "Workflow spawn failures").increment();
    }

    public void incrementShed(ShedTarget target) {
        counter("_shed_signal_total", "Load shedding signals raised", "target", target.name().toLowerCase()).increment();
    }

    /**
     * Registers a gauge for the admission in-flight count.
     */
    public void registerAdmissionInFlight(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_admission_inflight", valueSupplier, s -> s.get().doubleValue())
                .description("Admission slots currently held")
                .register(registry);
    }

    /**
     * Registers a gauge for the remaining ring buffer capacity of an event lane.
     */
    public void registerEventLaneRemaining(int lane, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_event_lane_remaining", valueSupplier, s -> s.get().doubleValue())
                .description("Remaining capacity of an event multiplexer lane")
                .tag("lane", Integer.toString(lane))
                .register(registry);
    }

    public void registerPoolWorkers(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_pool_workers", valueSupplier, s -> s.get().doubleValue())
                .description("Registered actor pool workers")
                .register(registry);
    }

    private Counter counter(String suffix, String description, String... tags) {
        String key = suffix + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
