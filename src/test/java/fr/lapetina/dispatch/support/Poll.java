package fr.lapetina.dispatch.support;

import java.util.function.BooleanSupplier;

/**
 * Waits for asynchronous effects in tests.
 */
public final class Poll {

    private Poll() {
    }

    /**
     * Returns true as soon as the condition holds, false once {@code timeoutMs} elapsed.
     */
    public static boolean until(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
