package net.vortexdevelopment.vbind.binding;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

/**
 * Outcome of a coercion: either a value (possibly null) or a {@link CoercionError}.
 *
 * @param <T> The value type
 */
public final class CoercionResult<T> {

    private final T value;
    private final CoercionError error;

    private CoercionResult(T value, CoercionError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> CoercionResult<T> success(@Nullable T value) {
        return new CoercionResult<>(value, null);
    }

    public static <T> CoercionResult<T> failure(@NotNull CoercionError error) {
        return new CoercionResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Get the converted value.
     *
     * @return The value, which may be null for a successful coercion of an absent string
     * @throws IllegalStateException if the coercion failed
     */
    @Nullable
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Coercion failed: " + error.describe());
        }
        return value;
    }

    @Nullable
    public CoercionError getError() {
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    /**
     * Transform the value of a successful result. Failures pass through unchanged.
     */
    @SuppressWarnings("unchecked")
    public <R> CoercionResult<R> map(@NotNull Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return (CoercionResult<R>) this;
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "CoercionResult[" + value + "]" : "CoercionResult[" + error.describe() + "]";
    }
}
