package fr.lapetina.dispatch.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged outcome of a fallible operation: either a value or an {@link ErrorType}.
 * Immutable and thread-safe.
 */
public record Result<T>(T value, ErrorType error, String detail) {

    public Result {
        if (error == null) {
            Objects.requireNonNull(value, "Successful result requires a value");
        }
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> error(ErrorType error) {
        return new Result<>(null, Objects.requireNonNull(error), null);
    }

    public static <T> Result<T> error(ErrorType error, String detail) {
        return new Result<>(null, Objects.requireNonNull(error), detail);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Re-types an error result. Must not be called on a successful result.
     */
    public <U> Result<U> asError() {
        if (isOk()) {
            throw new IllegalStateException("Result is not an error");
        }
        return new Result<>(null, error, detail);
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? Result.ok(mapper.apply(value)) : asError();
    }

    @Override
    public String toString() {
        return isOk()
                ? "Result{ok=" + value + '}'
                : "Result{error=" + error.tag() + (detail != null ? ", detail=" + detail : "") + '}';
    }
}
