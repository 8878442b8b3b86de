/**
 * Selection policies for the actor pool of long-lived workers.
 *
 * <p>Round-robin is the default policy. The pool only depends on
 * {@link fr.lapetina.dispatch.domain.strategy.WorkerSelectionStrategy}, so a latency- or
 * load-aware policy can replace it at runtime without touching callers.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Next index modulo registry size</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random pick</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * WorkerSelectionStrategy strategy = StrategyFactory.create("round-robin").orElseThrow();
 * Optional<String> worker = strategy.select(List.of("gpu-0", "gpu-1"));
 * }</pre>
 *
 * @see fr.lapetina.dispatch.domain.strategy.StrategyFactory
 */
package fr.lapetina.dispatch.domain.strategy;
