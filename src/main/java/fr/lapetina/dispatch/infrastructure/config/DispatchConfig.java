package fr.lapetina.dispatch.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the dispatch tier.
 * Designed to be populated from YAML.
 */
public class DispatchConfig {

    private ServerConfig server = new ServerConfig();
    private DispatchSettings dispatch = new DispatchSettings();
    private EventLoopConfig eventLoop = new EventLoopConfig();
    private ShieldConfig shield = new ShieldConfig();
    private SupervisorConfig supervisor = new SupervisorConfig();
    private ResilienceConfig resilience = new ResilienceConfig();
    private PoolConfig pool = new PoolConfig();
    private AdminConfig admin = new AdminConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public DispatchSettings getDispatch() { return dispatch; }
    public void setDispatch(DispatchSettings dispatch) { this.dispatch = dispatch; }

    public EventLoopConfig getEventLoop() { return eventLoop; }
    public void setEventLoop(EventLoopConfig eventLoop) { this.eventLoop = eventLoop; }

    public ShieldConfig getShield() { return shield; }
    public void setShield(ShieldConfig shield) { this.shield = shield; }

    public SupervisorConfig getSupervisor() { return supervisor; }
    public void setSupervisor(SupervisorConfig supervisor) { this.supervisor = supervisor; }

    public ResilienceConfig getResilience() { return resilience; }
    public void setResilience(ResilienceConfig resilience) { this.resilience = resilience; }

    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public AdminConfig getAdmin() { return admin; }
    public void setAdmin(AdminConfig admin) { this.admin = admin; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks every value the core relies on.
     *
     * @throws ConfigLoader.ConfigurationException naming the first offending field
     */
    public void validate() {
        require(server.getSocketPath() != null && !server.getSocketPath().isBlank(),
                "server.socketPath must not be blank");
        require(server.getMaxFrameBytes() >= 36, "server.maxFrameBytes must be at least 36");
        require(server.getReadTimeoutMs() > 0, "server.readTimeoutMs must be positive");
        require(server.getBacklog() > 0, "server.backlog must be positive");
        require("direct".equals(server.getSubmitMode()) || "event-loop".equals(server.getSubmitMode()),
                "server.submitMode must be 'direct' or 'event-loop'");
        require(dispatch.getDefaultTimeoutMs() > 0, "dispatch.defaultTimeoutMs must be positive");
        require(dispatch.getDefaultRetryMax() >= 0, "dispatch.defaultRetryMax must not be negative");
        require(dispatch.getAdmissionMax() > 0, "dispatch.admissionMax must be positive");
        require(eventLoop.getLanes() > 0, "eventLoop.lanes must be positive");
        require(Integer.bitCount(eventLoop.getRingBufferSize()) == 1, "eventLoop.ringBufferSize must be a power of 2");
        require(shield.getCapacity() > 0, "shield.capacity must be positive");
        require(shield.getRefillPerSecond() >= 0, "shield.refillPerSecond must not be negative");
        require(supervisor.getMaxSpawnFailures() > 0, "supervisor.maxSpawnFailures must be positive");
        require(supervisor.getWindowMs() > 0, "supervisor.windowMs must be positive");
        require(resilience.getWindowMs() > 0, "resilience.windowMs must be positive");
        require(resilience.getFailureThreshold() > 0, "resilience.failureThreshold must be positive");
        require(resilience.getTimeoutThreshold() > 0, "resilience.timeoutThreshold must be positive");
        require(resilience.getQuarantineMs() > 0, "resilience.quarantineMs must be positive");
        require(pool.getWorkers() != null, "pool.workers must not be null");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigLoader.ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * Unix socket listener configuration.
     */
    public static class ServerConfig {
        private String socketPath = "/run/olwsx/actor_manager.sock";
        private int maxFrameBytes = 1 << 20;
        private long readTimeoutMs = 3000;
        private int backlog = 1024;
        private String submitMode = "direct";

        public String getSocketPath() { return socketPath; }
        public void setSocketPath(String socketPath) { this.socketPath = socketPath; }

        public int getMaxFrameBytes() { return maxFrameBytes; }
        public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

        public long getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(long readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public String getSubmitMode() { return submitMode; }
        public void setSubmitMode(String submitMode) { this.submitMode = submitMode; }
    }

    /**
     * Manager defaults and global admission.
     */
    public static class DispatchSettings {
        private long defaultTimeoutMs = 2000;
        private int defaultRetryMax = 1;
        private int admissionMax = 10_000_000;

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public int getDefaultRetryMax() { return defaultRetryMax; }
        public void setDefaultRetryMax(int defaultRetryMax) { this.defaultRetryMax = defaultRetryMax; }

        public int getAdmissionMax() { return admissionMax; }
        public void setAdmissionMax(int admissionMax) { this.admissionMax = admissionMax; }
    }

    /**
     * Event multiplexer lanes (one LMAX Disruptor per lane).
     */
    public static class EventLoopConfig {
        private int lanes = 4;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getLanes() { return lanes; }
        public void setLanes(int lanes) { this.lanes = lanes; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Per-client token bucket.
     */
    public static class ShieldConfig {
        private int capacity = 100;
        private int refillPerSecond = 50;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public int getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(int refillPerSecond) { this.refillPerSecond = refillPerSecond; }
    }

    /**
     * Spawn-failure intensity bound for the workflow supervisor.
     */
    public static class SupervisorConfig {
        private int maxSpawnFailures = 100;
        private long windowMs = 5000;

        public int getMaxSpawnFailures() { return maxSpawnFailures; }
        public void setMaxSpawnFailures(int maxSpawnFailures) { this.maxSpawnFailures = maxSpawnFailures; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }

    /**
     * Sliding-window quarantine gate in front of the manager.
     */
    public static class ResilienceConfig {
        private boolean enabled = false;
        private long windowMs = 10_000;
        private int failureThreshold = 5;
        private int timeoutThreshold = 3;
        private long quarantineMs = 30_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getTimeoutThreshold() { return timeoutThreshold; }
        public void setTimeoutThreshold(int timeoutThreshold) { this.timeoutThreshold = timeoutThreshold; }

        public long getQuarantineMs() { return quarantineMs; }
        public void setQuarantineMs(long quarantineMs) { this.quarantineMs = quarantineMs; }
    }

    /**
     * Actor pool of long-lived heavy-task workers.
     */
    public static class PoolConfig {
        private String strategy = "round-robin";
        private List<String> workers = new ArrayList<>();

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public List<String> getWorkers() { return workers; }
        public void setWorkers(List<String> workers) { this.workers = workers; }
    }

    /**
     * Admin HTTP server configuration.
     */
    public static class AdminConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 9091;
        private int backlog = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "actor_dispatch";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
