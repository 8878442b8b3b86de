package fr.lapetina.dispatch.infrastructure.engine;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.RequestContext;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Engine placeholder used when no backend is plugged in.
 * Every request fails with {@code backend_unavailable}.
 */
public final class UnavailableProcessingEngine implements ProcessingEngine {

    private static final Logger log = LoggerFactory.getLogger(UnavailableProcessingEngine.class);

    private final AtomicBoolean warned = new AtomicBoolean(false);

    @Override
    public Result<Response> processRequest(Envelope envelope, RequestContext context) {
        if (warned.compareAndSet(false, true)) {
            log.warn("No processing engine configured, requests fail with backend_unavailable");
        }
        return Result.error(ErrorType.BACKEND_UNAVAILABLE, "no processing engine loaded");
    }

    @Override
    public String getName() {
        return "unavailable";
    }
}
