package fr.lapetina.dispatch.domain.model;

/**
 * Correlation and routing data for one engine attempt.
 * Passed explicitly to the processing engine and used as log parameters.
 */
public record RequestContext(
        String workflowId,
        long traceId,
        long spanId,
        String remote,
        Lane lane,
        SecurityVerdict security,
        int attempt,
        long timeoutMs
) {
    public String traceIdString() {
        return Long.toUnsignedString(traceId);
    }
}
