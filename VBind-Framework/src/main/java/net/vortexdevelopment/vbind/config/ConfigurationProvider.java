package net.vortexdevelopment.vbind.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Read access to a hierarchical configuration tree.
 * Keys are paths whose segments are separated by {@link ConfigurationPath#KEY_DELIMITER}.
 */
public interface ConfigurationProvider {

    /**
     * Get the raw value stored at the exact key.
     *
     * @param key The configuration key, e.g. "Retry:MaxAttempts"
     * @return The raw value, or null if the key is absent or only holds children
     */
    @Nullable
    String get(@NotNull String key);

    /**
     * Get the immediate children of a key, in the order the provider stores them.
     *
     * @param key The configuration key of the parent section
     * @return The children, or an empty list if the key is absent
     */
    @NotNull
    List<ConfigurationEntry> getChildren(@NotNull String key);

    /**
     * Check if the key holds a value or has children.
     *
     * @param key The configuration key
     * @return true if something is stored at or below the key
     */
    default boolean exists(@NotNull String key) {
        return get(key) != null || !getChildren(key).isEmpty();
    }
}
