/**
 * Event multiplexing layer built on the LMAX Disruptor.
 *
 * <p>Each lane of the {@link fr.lapetina.dispatch.disruptor.EventMultiplexer} is an
 * independent ring buffer drained by a single consumer thread. Lanes decouple event
 * ingestion from {@link fr.lapetina.dispatch.actor.DispatchManager#submit}: a slow
 * request holds up its own lane only.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.disruptor.EventMultiplexer} - Lane owner and publisher</li>
 *   <li>{@link fr.lapetina.dispatch.disruptor.handlers.LaneEventHandler} - Per-lane consumer</li>
 *   <li>{@link fr.lapetina.dispatch.disruptor.exception.BackpressureException} - Thrown when a lane is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.dispatch.disruptor;
