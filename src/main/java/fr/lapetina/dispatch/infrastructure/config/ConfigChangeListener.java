package fr.lapetina.dispatch.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration has been reloaded.
     *
     * @param oldConfig The previous configuration (may be null on initial load)
     * @param newConfig The new configuration, already validated
     */
    void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig);
}
