package fr.lapetina.dispatch.domain.model;

/**
 * Routing classification guiding downstream handling in the processing engine.
 */
public enum Lane {
    CACHE_L2("cache", "l2"),
    CORE_WRITE("core", "write"),
    CORE_READ("core", "read");

    private final String tier;
    private final String mode;

    Lane(String tier, String mode) {
        this.tier = tier;
        this.mode = mode;
    }

    public String tier() {
        return tier;
    }

    public String mode() {
        return mode;
    }

    public String label() {
        return tier + "/" + mode;
    }
}
