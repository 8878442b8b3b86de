package fr.lapetina.dispatch.actor;

/**
 * Raised when the supervisor cannot start a workflow.
 */
public class SpawnException extends Exception {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
