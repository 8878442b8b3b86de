package fr.lapetina.dispatch.domain.model;

/**
 * Security outcome derived from the edge hint bitfield.
 */
public record SecurityVerdict(boolean waf, boolean rateLimited, boolean challenged) {

    public static final SecurityVerdict CLEAN = new SecurityVerdict(false, false, false);
}
