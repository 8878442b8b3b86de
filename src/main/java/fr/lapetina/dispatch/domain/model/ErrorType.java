package fr.lapetina.dispatch.domain.model;

/**
 * Error taxonomy for dispatched requests.
 * Each value carries the coarse reason tag that is allowed onto the wire.
 */
public enum ErrorType {
    /** Envelope failed field validation. Never retried. */
    INVALID_ENVELOPE("invalid_envelope"),

    /** Engine call or caller-side wait timed out */
    TIMEOUT("timeout"),

    /** Processing engine reported a failure */
    CORE_ERROR("core_error"),

    /** Workflow crashed or exhausted its retry budget on engine failures */
    ACTOR_CRASH("actor_crash"),

    /** Admission queue is full */
    BUSY("busy"),

    /** Wire frame could not be decoded */
    INVALID_FRAME("invalid_frame"),

    /** Processing engine is not reachable. Handled as a core error. */
    BACKEND_UNAVAILABLE("backend_unavailable"),

    /** Fault raised inside a guarded unit of work */
    EXCEPTION("exception"),

    /** Actor pool has no registered workers */
    NO_WORKERS("no_workers"),

    /** Resilience guard is denying new work */
    QUARANTINED("quarantined");

    private final String tag;

    ErrorType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Timeouts are retried and surface as {@link #TIMEOUT}; every other retryable
     * engine-side failure surfaces as {@link #ACTOR_CRASH} once the budget is spent.
     */
    public boolean isTimeout() {
        return this == TIMEOUT;
    }
}
