package com.orion.para;

import java.util.NoSuchElementException;

/**
 * Outcome of a store operation: either a value or a {@link ParaError}.
 */
public final class ParaResult<T> {
    private final T value;
    private final ParaError error;

    private ParaResult(T value, ParaError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParaResult<T> ok(T value) {
        return new ParaResult<>(value, null);
    }

    public static ParaResult<Void> ok() {
        return new ParaResult<>(null, null);
    }

    public static <T> ParaResult<T> err(ParaError error) {
        if (error == null) {
            throw new IllegalArgumentException("error required");
        }
        return new ParaResult<>(null, error);
    }

    public static <T> ParaResult<T> err(ParaErrorCode code, String message) {
        return err(ParaError.of(code, message));
    }

    public static <T> ParaResult<T> err(ParaErrorCode code, String message, Throwable cause) {
        return err(ParaError.of(code, message, cause));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error);
        }
        return value;
    }

    public ParaError getError() {
        return error;
    }

    /**
     * Shorthand for {@code getError().getCode()}, null on success.
     */
    public ParaErrorCode getErrorCode() {
        return error != null ? error.getCode() : null;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
