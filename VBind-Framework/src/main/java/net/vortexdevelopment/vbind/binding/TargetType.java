package net.vortexdevelopment.vbind.binding;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes the type a configuration value is bound to: its {@link TargetShape}, the Java class and,
 * for {@link TargetShape#NULLABLE} and collection shapes, the element type.
 *
 * <p>Descriptors are built with the factory methods, or derived once from a declared generic type with
 * {@link #of(Type)}. Elements are always scalar, enum or nullable; nested collections are rejected.
 */
@Getter
@EqualsAndHashCode
public final class TargetType {

    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
            boolean.class, false,
            char.class, '\0',
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d
    );

    private final TargetShape shape;
    private final Class<?> rawType;
    @Nullable
    private final TargetType elementType;

    private TargetType(TargetShape shape, Class<?> rawType, @Nullable TargetType elementType) {
        this.shape = shape;
        this.rawType = rawType;
        this.elementType = elementType;
    }

    /**
     * A single value of the given class. Enum classes get the {@link TargetShape#ENUM} shape.
     */
    public static TargetType scalar(@NotNull Class<?> type) {
        if (type.isArray() || Optional.class == type || isCollectionClass(type)) {
            throw new ConfigurationBindingException("Not a scalar type: " + type.getName());
        }
        return new TargetType(type.isEnum() ? TargetShape.ENUM : TargetShape.SCALAR, type, null);
    }

    public static TargetType nullable(@NotNull Class<?> type) {
        return nullable(scalar(type));
    }

    public static TargetType nullable(@NotNull TargetType valueType) {
        if (valueType.shape == TargetShape.NULLABLE || valueType.shape.isCollection()) {
            throw new ConfigurationBindingException("Optional of " + valueType + " is not supported");
        }
        return new TargetType(TargetShape.NULLABLE, Optional.class, valueType);
    }

    public static TargetType arrayOf(@NotNull Class<?> elementType) {
        return arrayOf(scalar(elementType));
    }

    public static TargetType arrayOf(@NotNull TargetType elementType) {
        requireElement(elementType);
        Class<?> arrayClass = Array.newInstance(elementType.rawType, 0).getClass();
        return new TargetType(TargetShape.ARRAY, arrayClass, elementType);
    }

    /**
     * A growable list created through the no-argument constructor of {@code containerType}.
     */
    public static TargetType listOf(@NotNull Class<?> containerType, @NotNull Class<?> elementType) {
        return listOf(containerType, scalar(elementType));
    }

    public static TargetType listOf(@NotNull Class<?> containerType, @NotNull TargetType elementType) {
        if (!isConcreteList(containerType)) {
            throw new ConfigurationBindingException("Not a concrete List implementation: " + containerType.getName());
        }
        requireElement(elementType);
        return new TargetType(TargetShape.LIST, containerType, elementType);
    }

    public static TargetType fixedSizeListOf(@NotNull Class<?> elementType) {
        return fixedSizeListOf(scalar(elementType));
    }

    public static TargetType fixedSizeListOf(@NotNull TargetType elementType) {
        requireElement(elementType);
        return new TargetType(TargetShape.FIXED_SIZE_LIST, List.class, elementType);
    }

    public static TargetType readOnlyListOf(@NotNull Class<?> elementType) {
        return readOnlyListOf(scalar(elementType));
    }

    public static TargetType readOnlyListOf(@NotNull TargetType elementType) {
        requireElement(elementType);
        return new TargetType(TargetShape.READ_ONLY_LIST, List.class, elementType);
    }

    /**
     * Derive a descriptor from a declared type such as a field's generic type.
     * <ul>
     *   <li>{@code Optional<T>} is {@link TargetShape#NULLABLE}</li>
     *   <li>{@code Iterable<T>} and {@code Collection<T>} are {@link TargetShape#READ_ONLY_LIST}</li>
     *   <li>{@code List<T>} is {@link TargetShape#FIXED_SIZE_LIST}</li>
     *   <li>concrete lists such as {@code ArrayList<T>} are {@link TargetShape#LIST}</li>
     *   <li>arrays are {@link TargetShape#ARRAY}</li>
     * </ul>
     * Raw collection types bind String elements.
     *
     * @throws ConfigurationBindingException for other collection or map types, nested collections and type variables
     */
    public static TargetType of(@NotNull Type type) {
        if (type instanceof Class<?> clazz) {
            if (clazz.isArray()) {
                return arrayOf(elementOf(clazz.getComponentType(), type));
            }
            if (Optional.class == clazz) {
                return nullable(String.class);
            }
            if (isCollectionClass(clazz)) {
                return collectionOf(clazz, scalar(String.class), type);
            }
            return scalar(clazz);
        }
        if (type instanceof ParameterizedType parameterizedType) {
            Class<?> rawClass = (Class<?>) parameterizedType.getRawType();
            Type[] arguments = parameterizedType.getActualTypeArguments();
            if (Optional.class == rawClass) {
                TargetType valueType = of(arguments[0]);
                if (valueType.shape.isCollection()) {
                    throw new ConfigurationBindingException("Optional collections are not supported: " + type.getTypeName());
                }
                return nullable(valueType);
            }
            if (isCollectionClass(rawClass)) {
                if (Map.class.isAssignableFrom(rawClass) || arguments.length != 1) {
                    throw unsupportedCollection(type);
                }
                return collectionOf(rawClass, elementOf(arguments[0], type), type);
            }
            return scalar(rawClass);
        }
        if (type instanceof GenericArrayType arrayType) {
            return arrayOf(elementOf(arrayType.getGenericComponentType(), type));
        }
        if (type instanceof WildcardType wildcardType) {
            return of(wildcardType.getUpperBounds()[0]);
        }
        throw new ConfigurationBindingException("Unsupported target type: " + type.getTypeName());
    }

    /**
     * Get the value used when a coercion fails under the lenient policy:
     * zero for primitives, an empty Optional for {@link TargetShape#NULLABLE}, null otherwise.
     */
    @Nullable
    public Object defaultValue() {
        if (shape == TargetShape.NULLABLE) {
            return Optional.empty();
        }
        return PRIMITIVE_DEFAULTS.get(rawType);
    }

    public boolean isCollection() {
        return shape.isCollection();
    }

    private static TargetType collectionOf(Class<?> rawClass, TargetType elementType, Type declared) {
        if (rawClass == Iterable.class || rawClass == Collection.class) {
            return readOnlyListOf(elementType);
        }
        if (rawClass == List.class) {
            return fixedSizeListOf(elementType);
        }
        if (isConcreteList(rawClass)) {
            return listOf(rawClass, elementType);
        }
        throw unsupportedCollection(declared);
    }

    private static TargetType elementOf(Type elementType, Type declared) {
        TargetType element = of(elementType);
        if (element.shape.isCollection()) {
            throw new ConfigurationBindingException("Nested collections are not supported: " + declared.getTypeName());
        }
        return element;
    }

    private static void requireElement(TargetType elementType) {
        if (elementType.shape.isCollection()) {
            throw new ConfigurationBindingException("Nested collections are not supported: " + elementType);
        }
    }

    private static boolean isCollectionClass(Class<?> type) {
        return Iterable.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type);
    }

    private static boolean isConcreteList(Class<?> type) {
        return List.class.isAssignableFrom(type)
                && !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers());
    }

    private static ConfigurationBindingException unsupportedCollection(Type declared) {
        return new ConfigurationBindingException("Unsupported collection type: " + declared.getTypeName()
                + ". Use an array, Iterable, Collection, List or a concrete List implementation");
    }

    @Override
    public String toString() {
        return switch (shape) {
            case SCALAR, ENUM -> rawType.getTypeName();
            case NULLABLE -> "Optional<" + elementType + ">";
            case ARRAY -> elementType + "[]";
            case LIST -> rawType.getSimpleName() + "<" + elementType + ">";
            case FIXED_SIZE_LIST -> "List<" + elementType + ">";
            case READ_ONLY_LIST -> "unmodifiable List<" + elementType + ">";
        };
    }
}
