package fr.lapetina.dispatch.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Sliding-window failure/timeout counter with time-bounded quarantine.
 *
 * States:
 * - ALLOWED: counters below their thresholds, or quarantine expired
 * - QUARANTINED: a threshold was crossed within the current window, new work denied
 *   until {@code quarantinedUntil}
 *
 * Counters reset when more than one window length has elapsed since the window started.
 * Every record that leaves a counter at or above its threshold pushes the quarantine
 * deadline forward.
 *
 * Thread-safe: all state transitions are synchronized on the guard.
 */
public final class ResilienceGuard {

    private static final Logger log = LoggerFactory.getLogger(ResilienceGuard.class);

    private final String name;
    private final Duration window;
    private final int failureThreshold;
    private final int timeoutThreshold;
    private final Duration quarantine;
    private final Clock clock;

    private int failures;
    private int timeouts;
    private Instant windowStart;
    private Instant quarantinedUntil;

    public ResilienceGuard(
            String name,
            Duration window,
            int failureThreshold,
            int timeoutThreshold,
            Duration quarantine,
            Clock clock
    ) {
        this.name = name;
        this.window = window;
        this.failureThreshold = failureThreshold;
        this.timeoutThreshold = timeoutThreshold;
        this.quarantine = quarantine;
        this.clock = clock;
        this.windowStart = clock.instant();
        this.quarantinedUntil = Instant.EPOCH;
    }

    public ResilienceGuard(String name) {
        this(name, Duration.ofSeconds(10), 5, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    public synchronized void recordFailure() {
        rotateWindow();
        failures++;
        maybeQuarantine();
    }

    public synchronized void recordTimeout() {
        rotateWindow();
        timeouts++;
        maybeQuarantine();
    }

    /**
     * Returns false while the guard is quarantining new work.
     */
    public synchronized boolean isAllowed() {
        return !clock.instant().isBefore(quarantinedUntil);
    }

    /**
     * Maps the current window counters to the feature that should be shed.
     */
    public synchronized ShedTarget backpressureSignal() {
        boolean failureBreached = failures >= failureThreshold;
        boolean timeoutBreached = timeouts >= timeoutThreshold;
        if (failureBreached && timeoutBreached) {
            return ShedTarget.GPU;
        }
        if (timeoutBreached) {
            return ShedTarget.COMPRESSION;
        }
        if (failureBreached) {
            return ShedTarget.INFERENCE;
        }
        return ShedTarget.NONE;
    }

    public synchronized int getFailures() {
        return failures;
    }

    public synchronized int getTimeouts() {
        return timeouts;
    }

    public synchronized Instant getQuarantinedUntil() {
        return quarantinedUntil;
    }

    public String getName() {
        return name;
    }

    private void rotateWindow() {
        Instant now = clock.instant();
        if (Duration.between(windowStart, now).compareTo(window) > 0) {
            failures = 0;
            timeouts = 0;
            windowStart = now;
        }
    }

    private void maybeQuarantine() {
        if (failures >= failureThreshold || timeouts >= timeoutThreshold) {
            boolean wasAllowed = !clock.instant().isBefore(quarantinedUntil);
            quarantinedUntil = clock.instant().plus(quarantine);
            if (wasAllowed) {
                log.warn("Resilience guard QUARANTINED: name={}, failures={}, timeouts={}, until={}",
                        name, failures, timeouts, quarantinedUntil);
            }
        }
    }

    @Override
    public synchronized String toString() {
        return "ResilienceGuard{" +
                "name='" + name + '\'' +
                ", failures=" + failures +
                ", timeouts=" + timeouts +
                ", quarantinedUntil=" + quarantinedUntil +
                '}';
    }
}
