/**
 * Actor dispatch tier - admission, isolation and retry between an edge gateway and a
 * request processing engine.
 *
 * <p>Requests arrive as binary frames on a Unix domain socket, pass a per-client token
 * bucket and a global admission budget, and run in their own supervised workflow that
 * calls the processing engine with bounded retries and a caller-side timeout.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.DispatcherFactory} - Main entry point for creating
 *       a fully-wired dispatch tier from YAML configuration</li>
 *   <li>{@link fr.lapetina.dispatch.DispatchApplication} - Standalone process with the
 *       Unix socket listener and the admin HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("config.yaml", engine).start()) {
 *     Envelope envelope = Envelope.builder().method("GET").path("/hello").build();
 *     Result<Response> result = factory.getManager().submit(envelope);
 * }
 * }</pre>
 *
 * @see fr.lapetina.dispatch.DispatcherFactory
 * @see fr.lapetina.dispatch.actor.DispatchManager
 */
package fr.lapetina.dispatch;
