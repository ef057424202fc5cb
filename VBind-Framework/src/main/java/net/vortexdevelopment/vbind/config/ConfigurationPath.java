package net.vortexdevelopment.vbind.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Helpers for hierarchical configuration keys.
 */
public final class ConfigurationPath {

    public static final String KEY_DELIMITER = ":";

    private static final Pattern DELIMITER_PATTERN = Pattern.compile(Pattern.quote(KEY_DELIMITER));

    private ConfigurationPath() {
    }

    /**
     * Join path segments, e.g. combine("Feature", "Tags", "0") is "Feature:Tags:0".
     * Empty segments are skipped.
     */
    public static String combine(String... segments) {
        StringJoiner joiner = new StringJoiner(KEY_DELIMITER);
        for (String segment : segments) {
            if (segment != null && !segment.isEmpty()) {
                joiner.add(segment);
            }
        }
        return joiner.toString();
    }

    /**
     * Split a key into its segments. The empty key has no segments.
     */
    public static String[] split(@NotNull String path) {
        if (path.isEmpty()) {
            return new String[0];
        }
        return DELIMITER_PATTERN.split(path, -1);
    }

    /**
     * Get the last segment of a path, e.g. "0" for "Feature:Tags:0".
     */
    public static String getSectionKey(@NotNull String path) {
        int index = path.lastIndexOf(KEY_DELIMITER);
        return index < 0 ? path : path.substring(index + KEY_DELIMITER.length());
    }

    /**
     * Get the path without its last segment, or null for a top level key.
     */
    @Nullable
    public static String getParentPath(@NotNull String path) {
        int index = path.lastIndexOf(KEY_DELIMITER);
        return index < 0 ? null : path.substring(0, index);
    }
}
