package net.vortexdevelopment.vbind.binding;

import org.jetbrains.annotations.NotNull;

/**
 * Converts a raw configuration string to a value. Any exception marks the value as unparseable.
 *
 * @param <T> The produced type
 */
@FunctionalInterface
public interface ValueParser<T> {

    T parse(@NotNull String raw) throws Exception;
}
