package net.vortexdevelopment.vbind.config;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One child of a configuration section.
 */
@Getter
public class ConfigurationEntry {

    /**
     * Last path segment, e.g. "0" for "Feature:Tags:0".
     */
    private final String key;
    private final String path;
    @Nullable
    private final String value;

    public ConfigurationEntry(@NotNull String key, @NotNull String path, @Nullable String value) {
        this.key = key;
        this.path = path;
        this.value = value;
    }

    @Override
    public String toString() {
        return path + "=" + value;
    }
}
