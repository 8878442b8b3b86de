package fr.lapetina.dispatch.domain.event;

/**
 * Kinds of events accepted by the event multiplexer lanes.
 */
public enum IngressKind {
    /** Forward the envelope to the dispatch manager */
    SUBMIT_REQUEST,

    /** Anything else: drained and dropped */
    NOOP
}
