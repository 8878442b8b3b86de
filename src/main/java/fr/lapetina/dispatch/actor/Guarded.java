package fr.lapetina.dispatch.actor;

import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Isolation boundary for fallible units of work.
 *
 * Any exception raised inside the unit becomes an {@code exception} result instead of
 * unwinding the caller. {@link Error}s are not caught: they crash the enclosing workflow.
 */
public final class Guarded {

    private static final Logger log = LoggerFactory.getLogger(Guarded.class);

    private Guarded() {
        // Utility class
    }

    public static <T> Result<T> call(Supplier<T> unit) {
        try {
            T value = unit.get();
            if (value == null) {
                return Result.error(ErrorType.EXCEPTION, "guarded unit returned null");
            }
            return Result.ok(value);
        } catch (Exception e) {
            log.debug("Guarded unit failed: {}", e.toString());
            return Result.error(ErrorType.EXCEPTION, e.getClass().getSimpleName());
        }
    }

    /**
     * Variant for units that already return a {@link Result}: their own error is kept,
     * a raised exception becomes {@code exception}.
     */
    public static <T> Result<T> flatCall(Supplier<Result<T>> unit) {
        Result<Result<T>> outer = call(unit);
        return outer.isOk() ? outer.value() : outer.asError();
    }
}
