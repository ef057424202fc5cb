package net.vortexdevelopment.vbind.binding;

import net.vortexdevelopment.vbind.config.ConfigurationEntry;
import net.vortexdevelopment.vbind.config.ConfigurationProvider;
import net.vortexdevelopment.vbind.debug.DebugLogger;
import net.vortexdevelopment.vbind.di.ServiceProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Resolves the value bound to one configuration key.
 *
 * <p>Scalars are read from the key itself. Arrays and lists are built from the children of the key,
 * in the order the provider returns them, one element per child. A missing key gives an empty collection.
 *
 * <p>Instances hold no state besides the key and the coercer and can be shared between threads.
 */
public class ConfigurationValueResolver {

    private final String key;
    private final ValueCoercer coercer;

    public ConfigurationValueResolver(@NotNull String key) {
        this(key, ValueCoercer.defaults());
    }

    public ConfigurationValueResolver(@NotNull String key, @NotNull ValueCoercer coercer) {
        this.key = key;
        this.coercer = coercer;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve the value using the {@link ConfigurationProvider} registered in the service provider.
     *
     * @throws net.vortexdevelopment.vbind.di.ServiceNotFoundException if no configuration provider is registered
     */
    @Nullable
    public Object resolve(@NotNull ServiceProvider services, @NotNull TargetType type) {
        ConfigurationProvider configuration = services.getRequired(ConfigurationProvider.class);
        return resolve(configuration, type);
    }

    @Nullable
    public Object resolve(@NotNull ConfigurationProvider configuration, @NotNull TargetType type) {
        DebugLogger.log(ConfigurationValueResolver.class, "Resolving '%s' as %s", key, type);
        return switch (type.getShape()) {
            case READ_ONLY_LIST -> createTypedReadOnlyList(configuration, type.getElementType());
            case FIXED_SIZE_LIST -> createFixedSizeList(configuration, type.getElementType());
            case LIST -> createTypedList(configuration, type);
            case ARRAY -> createTypedArray(configuration, type.getElementType());
            case SCALAR, NULLABLE, ENUM -> coercer.coerce(key, type, configuration.get(key));
        };
    }

    private Object createTypedArray(ConfigurationProvider configuration, TargetType elementType) {
        List<ConfigurationEntry> children = configuration.getChildren(key);
        Object array = Array.newInstance(elementType.getRawType(), children.size());
        for (int i = 0; i < children.size(); i++) {
            Array.set(array, i, coerceChild(children.get(i), elementType));
        }
        return array;
    }

    private List<Object> createFixedSizeList(ConfigurationProvider configuration, TargetType elementType) {
        List<ConfigurationEntry> children = configuration.getChildren(key);
        Object[] values = new Object[children.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = coerceChild(children.get(i), elementType);
        }
        return Arrays.asList(values);
    }

    private List<Object> createTypedReadOnlyList(ConfigurationProvider configuration, TargetType elementType) {
        return Collections.unmodifiableList(createFixedSizeList(configuration, elementType));
    }

    @SuppressWarnings("unchecked")
    private List<Object> createTypedList(ConfigurationProvider configuration, TargetType listType) {
        List<Object> list;
        try {
            Constructor<?> constructor = listType.getRawType().getDeclaredConstructor();
            constructor.setAccessible(true);
            list = (List<Object>) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationBindingException("Unable to create list of type " + listType.getRawType().getName()
                    + " for key '" + key + "'. A no-argument constructor is required", e);
        }

        for (ConfigurationEntry child : configuration.getChildren(key)) {
            list.add(coerceChild(child, listType.getElementType()));
        }
        return list;
    }

    private Object coerceChild(ConfigurationEntry child, TargetType elementType) {
        return coercer.coerce(child.getPath(), elementType, child.getValue());
    }
}
