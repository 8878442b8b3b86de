/**
 * Configuration loading, validation and hot-reload support.
 *
 * <p>This package parses the YAML configuration, applies {@code DISPATCH_*} environment
 * overrides and validates the result before any component sees it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.DispatchConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.ConfigLoader} - YAML loading, overrides and file watching</li>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Unix socket path, frame size, read timeout, submit mode</li>
 *   <li>{@code dispatch} - Default timeout and retry budget, admission maximum</li>
 *   <li>{@code eventLoop} - Multiplexer lane count and ring buffer settings</li>
 *   <li>{@code shield} - Per-client token bucket capacity and refill rate</li>
 *   <li>{@code supervisor} - Spawn-failure intensity bound</li>
 *   <li>{@code resilience} - Quarantine gate thresholds</li>
 *   <li>{@code pool} - Actor pool strategy and initial workers</li>
 *   <li>{@code admin} - Health and metrics HTTP server</li>
 *   <li>{@code metrics} - Metric name prefix</li>
 * </ul>
 *
 * <p>Only shield limits, admission maximum, dispatch defaults and the pool strategy are
 * applied on hot reload; the rest needs a restart.
 */
package fr.lapetina.dispatch.infrastructure.config;
