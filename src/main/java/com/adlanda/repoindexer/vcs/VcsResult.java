package com.adlanda.repoindexer.vcs;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or a {@link VcsError}. Callers decide where a failure turns
 * into a default value.
 */
public final class VcsResult<T> {

    private final T value;
    private final VcsError error;

    private VcsResult(T value, VcsError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> VcsResult<T> ok(T value) {
        return new VcsResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> VcsResult<T> failure(VcsError error) {
        return new VcsResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> VcsResult<T> failure(VcsError.Kind kind, String message) {
        return failure(VcsError.of(kind, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    public VcsError error() {
        return error;
    }

    public <R> VcsResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return ok(mapper.apply(value));
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : "Failure(" + error + ")";
    }
}
