package fr.lapetina.dispatch;

import fr.lapetina.dispatch.actor.ActorPool;
import fr.lapetina.dispatch.actor.AdmissionQueue;
import fr.lapetina.dispatch.actor.DdosShield;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.actor.WorkflowSupervisor;
import fr.lapetina.dispatch.api.ConnectionHandler;
import fr.lapetina.dispatch.disruptor.EventMultiplexer;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.domain.strategy.RoundRobinStrategy;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.engine.ProcessingEngine;
import fr.lapetina.dispatch.infrastructure.engine.UnavailableProcessingEngine;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.resilience.ResilienceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating a fully-wired dispatch tier from configuration.
 * This is the primary entry point for obtaining a configured {@link DispatchManager}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("config.yaml").start()) {
 *     Result<Response> result = factory.getManager().submit(envelope);
 * }
 * }</pre>
 */
public class DispatcherFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatcherFactory.class);

    private static final long SHIELD_PURGE_INTERVAL_SECONDS = 60;

    private final ConfigLoader configLoader;
    private final DispatchConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProcessingEngine engine;
    private final AdmissionQueue admission;
    private final DdosShield shield;
    private final WorkflowSupervisor supervisor;
    private final DispatchManager manager;
    private final ActorPool pool;
    private final EventMultiplexer multiplexer;
    private final ConnectionHandler connectionHandler;
    private final ScheduledExecutorService janitor;

    protected DispatcherFactory(String configPath, ProcessingEngine engineOverride) {
        log.info("Initializing DispatcherFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Engine (allow override for testing)
        this.engine = engineOverride != null ? engineOverride : new UnavailableProcessingEngine();
        log.info("Using processing engine: {}", engine.getName());

        this.admission = new AdmissionQueue(config.getDispatch().getAdmissionMax());
        metricsRegistry.registerAdmissionInFlight(admission::getInFlight);

        this.shield = new DdosShield(config.getShield().getCapacity(), config.getShield().getRefillPerSecond());

        this.supervisor = new WorkflowSupervisor(
                engine,
                metricsRegistry,
                config.getSupervisor().getMaxSpawnFailures(),
                Duration.ofMillis(config.getSupervisor().getWindowMs())
        );
        supervisor.setEscalationHandler(WorkflowSupervisor::restart);

        this.manager = new DispatchManager(admission, supervisor, metricsRegistry, defaultsFrom(config));
        applyResilience(config.getResilience());

        // Actor pool
        WorkerSelectionStrategy strategy = StrategyFactory.createOrDefault(
                config.getPool().getStrategy(),
                new RoundRobinStrategy()
        );
        log.info("Using worker selection strategy: {}", strategy.getName());
        this.pool = new ActorPool(strategy);
        config.getPool().getWorkers().forEach(pool::register);
        metricsRegistry.registerPoolWorkers(pool::size);

        this.multiplexer = new EventMultiplexer(config.getEventLoop(), manager, metricsRegistry);
        this.connectionHandler = new ConnectionHandler(
                manager,
                multiplexer,
                shield,
                metricsRegistry,
                ConnectionHandler.SubmitMode.fromConfig(config.getServer().getSubmitMode())
        );

        this.janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shield-janitor");
            t.setDaemon(true);
            return t;
        });

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("DispatcherFactory initialized: admissionMax={}, lanes={}, workers={}",
                admission.getMax(), multiplexer.getLanes(), pool.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static DispatcherFactory create(String configPath) {
        return new DispatcherFactory(configPath, null);
    }

    /**
     * Creates a factory from the specified configuration file with a plugged-in engine.
     */
    public static DispatcherFactory create(String configPath, ProcessingEngine engine) {
        return new DispatcherFactory(configPath, Objects.requireNonNull(engine));
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static DispatcherFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the event lanes, the shield janitor and configuration watching.
     */
    public DispatcherFactory start() {
        multiplexer.start();
        janitor.scheduleWithFixedDelay(shield::purgeIdle,
                SHIELD_PURGE_INTERVAL_SECONDS, SHIELD_PURGE_INTERVAL_SECONDS, TimeUnit.SECONDS);
        configLoader.startWatching();
        log.info("Dispatch tier started");
        return this;
    }

    public DispatchManager getManager() {
        return manager;
    }

    public AdmissionQueue getAdmission() {
        return admission;
    }

    public DdosShield getShield() {
        return shield;
    }

    public WorkflowSupervisor getSupervisor() {
        return supervisor;
    }

    public ActorPool getPool() {
        return pool;
    }

    public EventMultiplexer getMultiplexer() {
        return multiplexer;
    }

    public ConnectionHandler getConnectionHandler() {
        return connectionHandler;
    }

    public ProcessingEngine getEngine() {
        return engine;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public DispatchConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static SubmitOptions defaultsFrom(DispatchConfig config) {
        return new SubmitOptions(config.getDispatch().getDefaultTimeoutMs(), config.getDispatch().getDefaultRetryMax());
    }

    private void applyResilience(DispatchConfig.ResilienceConfig resilience) {
        if (!resilience.isEnabled()) {
            if (manager.getResilienceGuard() != null) {
                manager.setResilienceGuard(null);
            }
            return;
        }
        manager.setResilienceGuard(new ResilienceGuard(
                "dispatch",
                Duration.ofMillis(resilience.getWindowMs()),
                resilience.getFailureThreshold(),
                resilience.getTimeoutThreshold(),
                Duration.ofMillis(resilience.getQuarantineMs()),
                Clock.systemUTC()
        ));
    }

    private void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        shield.updateLimits(newConfig.getShield().getCapacity(), newConfig.getShield().getRefillPerSecond());
        admission.setMax(newConfig.getDispatch().getAdmissionMax());
        manager.setDefaults(defaultsFrom(newConfig));
        applyResilience(newConfig.getResilience());

        // Update strategy if changed
        if (oldConfig == null ||
                !oldConfig.getPool().getStrategy().equals(newConfig.getPool().getStrategy())) {
            pool.setStrategy(StrategyFactory.createOrDefault(newConfig.getPool().getStrategy(), pool.getStrategy()));
        }

        // Workers are only ever added
        List<String> known = pool.getWorkers();
        newConfig.getPool().getWorkers().stream()
                .filter(id -> !known.contains(id))
                .forEach(pool::register);

        if (oldConfig != null) {
            warnIfChanged("server.socketPath", oldConfig.getServer().getSocketPath(), newConfig.getServer().getSocketPath());
            warnIfChanged("server.submitMode", oldConfig.getServer().getSubmitMode(), newConfig.getServer().getSubmitMode());
            warnIfChanged("eventLoop.lanes", oldConfig.getEventLoop().getLanes(), newConfig.getEventLoop().getLanes());
            warnIfChanged("admin.port", oldConfig.getAdmin().getPort(), newConfig.getAdmin().getPort());
        }

        log.info("Configuration updates applied");
    }

    private static void warnIfChanged(String key, Object oldValue, Object newValue) {
        if (!Objects.equals(oldValue, newValue)) {
            log.warn("Configuration change requires restart: {} {} -> {}", key, oldValue, newValue);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down DispatcherFactory...");

        janitor.shutdownNow();

        try {
            multiplexer.close();
        } catch (Exception e) {
            log.warn("Error closing event multiplexer", e);
        }

        try {
            supervisor.close();
        } catch (Exception e) {
            log.warn("Error closing supervisor", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("DispatcherFactory shut down");
    }
}
