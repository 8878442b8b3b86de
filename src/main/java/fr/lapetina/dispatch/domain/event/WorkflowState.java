package fr.lapetina.dispatch.domain.event;

/**
 * Lifecycle state of a per-request workflow.
 */
public enum WorkflowState {
    /** Spawned, waiting to begin */
    INIT,

    /** An engine attempt is in progress */
    RUNNING,

    /** Attempt failed with budget left, re-attempting immediately */
    RETRY_SCHEDULED,

    /** Terminal: response delivered */
    SUCCEEDED,

    /** Terminal: error delivered */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
