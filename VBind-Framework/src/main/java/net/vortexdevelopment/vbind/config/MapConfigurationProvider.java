package net.vortexdevelopment.vbind.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration tree built from flat key/value pairs such as {@code "Feature:Tags:0" -> "a"}.
 *
 * <p>Children keep the order in which their keys were first added. Key lookups ignore case.
 * The tree is not modified after construction, so concurrent reads are safe.
 */
public class MapConfigurationProvider implements ConfigurationProvider {

    private final Node root = new Node("", "");

    protected MapConfigurationProvider(Map<String, String> values) {
        for (Map.Entry<String, String> entry : values.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public static MapConfigurationProvider of(Map<String, String> values) {
        return new MapConfigurationProvider(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public @Nullable String get(@NotNull String key) {
        Node node = find(key);
        return node == null ? null : node.value;
    }

    @Override
    public @NotNull List<ConfigurationEntry> getChildren(@NotNull String key) {
        Node node = find(key);
        if (node == null || node.children.isEmpty()) {
            return Collections.emptyList();
        }
        List<ConfigurationEntry> entries = new ArrayList<>(node.children.size());
        for (Node child : node.children.values()) {
            entries.add(new ConfigurationEntry(child.key, child.path, child.value));
        }
        return Collections.unmodifiableList(entries);
    }

    private void put(String key, String value) {
        Node node = root;
        for (String segment : ConfigurationPath.split(key)) {
            Node parent = node;
            node = parent.children.computeIfAbsent(normalize(segment),
                    unused -> new Node(segment, ConfigurationPath.combine(parent.path, segment)));
        }
        node.value = value;
    }

    @Nullable
    private Node find(String key) {
        Node node = root;
        for (String segment : ConfigurationPath.split(key)) {
            node = node.children.get(normalize(segment));
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private static String normalize(String segment) {
        return segment.toLowerCase(Locale.ROOT);
    }

    private static final class Node {
        private final String key;
        private final String path;
        private final Map<String, Node> children = new LinkedHashMap<>();
        private String value;

        private Node(String key, String path) {
            this.key = key;
            this.path = path;
        }
    }

    /**
     * Builder collecting key/value pairs in insertion order.
     */
    public static class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        public Builder with(String key, String value) {
            values.put(key, value);
            return this;
        }

        /**
         * Add the values as indexed children of the key: key:0, key:1, ...
         */
        public Builder withList(String key, String... items) {
            for (int i = 0; i < items.length; i++) {
                values.put(ConfigurationPath.combine(key, Integer.toString(i)), items[i]);
            }
            return this;
        }

        public MapConfigurationProvider build() {
            return new MapConfigurationProvider(values);
        }
    }
}
