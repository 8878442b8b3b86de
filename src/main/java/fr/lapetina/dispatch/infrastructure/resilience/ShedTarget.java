package fr.lapetina.dispatch.infrastructure.resilience;

/**
 * Feature the resilience guard asks downstream components to shed.
 */
public enum ShedTarget {
    /** No shedding required */
    NONE,

    /** Both failure and timeout thresholds breached */
    GPU,

    /** Only the timeout threshold breached */
    COMPRESSION,

    /** Only the failure threshold breached */
    INFERENCE
}
