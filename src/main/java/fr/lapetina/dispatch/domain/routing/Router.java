package fr.lapetina.dispatch.domain.routing;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.Lane;
import fr.lapetina.dispatch.domain.model.SecurityVerdict;

import java.util.Set;

/**
 * Stateless routing decisions: edge hints to a security verdict, request shape to a lane.
 */
public final class Router {

    private static final String STATIC_PREFIX = "/static/";
    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH");

    private Router() {
        // Utility class
    }

    public static SecurityVerdict security(int edgeHints) {
        return new SecurityVerdict(
                (edgeHints & Envelope.HINT_WAF_BLOCKED) != 0,
                (edgeHints & Envelope.HINT_RATE_LIMITED) != 0,
                (edgeHints & Envelope.HINT_CHALLENGED) != 0
        );
    }

    public static Lane pickLane(String path, String method) {
        if (path.startsWith(STATIC_PREFIX)) {
            return Lane.CACHE_L2;
        }
        if (WRITE_METHODS.contains(method)) {
            return Lane.CORE_WRITE;
        }
        return Lane.CORE_READ;
    }
}
