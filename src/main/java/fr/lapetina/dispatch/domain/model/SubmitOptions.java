package fr.lapetina.dispatch.domain.model;

/**
 * Per-submission knobs: how long the caller waits and how many extra engine attempts
 * the workflow may make.
 */
public record SubmitOptions(long timeoutMs, int retryMax) {

    public SubmitOptions {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (retryMax < 0) {
            throw new IllegalArgumentException("retryMax must not be negative: " + retryMax);
        }
    }

    public SubmitOptions withTimeoutMs(long timeoutMs) {
        return new SubmitOptions(timeoutMs, retryMax);
    }

    public SubmitOptions withRetryMax(int retryMax) {
        return new SubmitOptions(timeoutMs, retryMax);
    }
}
