package fr.lapetina.dispatch.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global in-flight budget shared by every request path.
 *
 * Every {@link #offer()} that returns {@link Admission#OK} must be paired with exactly
 * one later {@link #release()}, whatever the request's outcome.
 *
 * Thread-safe via a single atomic counter.
 */
public final class AdmissionQueue {

    private static final Logger log = LoggerFactory.getLogger(AdmissionQueue.class);

    // Threshold for warning about approaching capacity (fraction)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    public enum Admission {
        OK,
        BUSY
    }

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile int max;
    private volatile boolean capacityWarningLogged = false;

    public AdmissionQueue(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Admission max must be positive: " + max);
        }
        this.max = max;
        log.info("AdmissionQueue initialized: max={}", max);
    }

    /**
     * Claims one admission slot.
     *
     * @return {@link Admission#BUSY} when the claim would exceed the maximum
     */
    public Admission offer() {
        int current = inFlight.incrementAndGet();
        int limit = max;
        if (current > limit) {
            inFlight.decrementAndGet();
            log.debug("Admission rejected: inFlight={}/{}", current - 1, limit);
            return Admission.BUSY;
        }
        checkCapacityThreshold(current, limit);
        return Admission.OK;
    }

    /**
     * Returns one admission slot. Never drops the counter below zero.
     */
    public void release() {
        int previous = inFlight.getAndUpdate(c -> c > 0 ? c - 1 : 0);
        if (previous == 0) {
            log.warn("Admission release without matching offer, counter kept at zero");
        }
    }

    private void checkCapacityThreshold(int current, int limit) {
        double utilization = (double) current / limit;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching admission capacity: inFlight={}/{} ({}%)",
                    current, limit, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            // Reset warning flag when utilization drops significantly
            capacityWarningLogged = false;
        }
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getMax() {
        return max;
    }

    /**
     * Changes the maximum at runtime. Slots already held above a lowered maximum are
     * released normally; new offers are refused until the count drops below it.
     */
    public void setMax(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Admission max must be positive: " + max);
        }
        int old = this.max;
        this.max = max;
        log.info("Admission max changed: {} -> {}", old, max);
    }
}
