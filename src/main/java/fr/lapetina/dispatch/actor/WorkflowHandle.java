package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submitter's view of a spawned workflow: its terminal future and a cancel signal.
 *
 * The future completes normally with the terminal result, or exceptionally when the
 * workflow crashed.
 */
public final class WorkflowHandle {

    private final Workflow workflow;
    private final CompletableFuture<Result<Response>> terminal;

    WorkflowHandle(Workflow workflow, CompletableFuture<Result<Response>> terminal) {
        this.workflow = workflow;
        this.terminal = terminal;
    }

    /**
     * Waits for the terminal result.
     */
    public Result<Response> await(long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        return terminal.get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Sends the advisory cancel signal. Whatever the workflow still produces is left
     * to {@code onDiscard}.
     */
    public void cancel(Runnable onDiscard) {
        workflow.cancel();
        terminal.whenComplete((result, error) -> onDiscard.run());
    }

    public CompletableFuture<Result<Response>> terminal() {
        return terminal;
    }

    public String id() {
        return workflow.getId();
    }

    public Workflow workflow() {
        return workflow;
    }
}
