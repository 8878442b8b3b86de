package fr.lapetina.dispatch.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Configuration loader with environment overrides, validation and hot-reload support.
 *
 * Supports:
 * - Loading from file system or classpath
 * - {@code DISPATCH_*} environment variables overriding YAML values
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_SOCKET_PATH = "DISPATCH_SOCKET_PATH";
    public static final String ENV_TIMEOUT_MS = "DISPATCH_TIMEOUT_MS";
    public static final String ENV_RETRY_MAX = "DISPATCH_RETRY_MAX";
    public static final String ENV_QUEUE_MAX = "DISPATCH_QUEUE_MAX";
    public static final String ENV_FRAME_MAX = "DISPATCH_FRAME_MAX";
    public static final String ENV_EVENT_LOOPS = "DISPATCH_EVENT_LOOPS";

    private final AtomicReference<DispatchConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(DispatchConfig.class, loaderOptions));
    }

    /**
     * Loads, overrides and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public DispatchConfig load() {
        return publish(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     */
    public DispatchConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private DispatchConfig publish(DispatchConfig config) {
        applyEnvironmentOverrides(config);
        config.validate();
        DispatchConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private DispatchConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private DispatchConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.info("Loading configuration from file: {}", path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private DispatchConfig parse(InputStream is, String source) {
        try {
            DispatchConfig config = yaml.load(is);
            // An empty document yields null: every section keeps its default
            return config != null ? config : new DispatchConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
    }

    void applyEnvironmentOverrides(DispatchConfig config) {
        String socketPath = environment.get(ENV_SOCKET_PATH);
        if (socketPath != null && !socketPath.isBlank()) {
            config.getServer().setSocketPath(socketPath);
        }
        overrideLong(ENV_TIMEOUT_MS, v -> config.getDispatch().setDefaultTimeoutMs(v));
        overrideLong(ENV_RETRY_MAX, v -> config.getDispatch().setDefaultRetryMax(v.intValue()));
        overrideLong(ENV_QUEUE_MAX, v -> config.getDispatch().setAdmissionMax(v.intValue()));
        overrideLong(ENV_FRAME_MAX, v -> config.getServer().setMaxFrameBytes(v.intValue()));
        overrideLong(ENV_EVENT_LOOPS, v -> config.getEventLoop().setLanes(v.intValue()));
    }

    private void overrideLong(String key, Consumer<Long> setter) {
        String raw = environment.get(key);
        if (raw == null) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value > Integer.MAX_VALUE && !ENV_TIMEOUT_MS.equals(key)) {
                log.warn("Ignoring out-of-range environment override: {}={}", key, raw);
                return;
            }
            setter.accept(value);
            log.info("Configuration override from environment: {}={}", key, value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable environment override: {}={}", key, raw);
        }
    }

    /**
     * Returns the current configuration.
     */
    public DispatchConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file leaves the current configuration in place.
     */
    public DispatchConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(DispatchConfig oldConfig, DispatchConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
