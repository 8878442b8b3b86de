package fr.lapetina.dispatch.infrastructure.engine;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.RequestContext;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.domain.model.SecurityVerdict;
import fr.lapetina.dispatch.domain.routing.Router;

/**
 * Backend that actually processes requests. Owned by another team; this tier only calls it.
 *
 * Implementations must be thread-safe: workflows call them concurrently.
 */
public interface ProcessingEngine {

    /**
     * Processes one request attempt.
     *
     * @param envelope The request
     * @param context  Correlation ids, lane, security verdict and the caller's timeout
     * @return the engine response, {@code timeout} when the engine gave up waiting, or any
     *         other error tag for a failure ({@code core_error}, {@code backend_unavailable}, ...)
     */
    Result<Response> processRequest(Envelope envelope, RequestContext context);

    /**
     * Maps edge hints to a security verdict. Engines with their own policy may override.
     */
    default SecurityVerdict security(int edgeHints) {
        return Router.security(edgeHints);
    }

    /**
     * Human-readable engine name for logs and health output.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
