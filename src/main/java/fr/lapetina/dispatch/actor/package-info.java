/**
 * Per-request isolation and backpressure.
 *
 * <p>{@link fr.lapetina.dispatch.actor.DispatchManager} admits a request through the
 * {@link fr.lapetina.dispatch.actor.AdmissionQueue}, has the
 * {@link fr.lapetina.dispatch.actor.WorkflowSupervisor} run a
 * {@link fr.lapetina.dispatch.actor.Workflow} for it, and waits for its terminal result.
 * The admission slot is released exactly once on every path.
 */
package fr.lapetina.dispatch.actor;
