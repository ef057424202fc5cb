package net.vortexdevelopment.vbind.binding;

import net.vortexdevelopment.vbind.debug.DebugLogger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Converts one raw configuration string to a scalar, enum or optional target.
 *
 * <ul>
 *   <li>String targets receive the raw value unchanged, including null.</li>
 *   <li>Optional targets are empty for a null raw value, otherwise the value type is converted and wrapped.</li>
 *   <li>Enum targets match a constant name; see {@link BindingOptions#isCaseSensitiveEnums()}.</li>
 *   <li>Other targets use the parser registered in the {@link CoercionRegistry}.</li>
 * </ul>
 *
 * A failed conversion is handled according to the {@link CoercionPolicy} of the options.
 */
public class ValueCoercer {

    private final CoercionRegistry registry;
    private final BindingOptions options;

    public ValueCoercer(@NotNull CoercionRegistry registry, @NotNull BindingOptions options) {
        this.registry = registry;
        this.options = options;
    }

    public static ValueCoercer defaults() {
        return new ValueCoercer(CoercionRegistry.defaults(), BindingOptions.defaults());
    }

    public CoercionRegistry getRegistry() {
        return registry;
    }

    public BindingOptions getOptions() {
        return options;
    }

    /**
     * Convert a raw value, applying the coercion policy on failure.
     *
     * @param key The configuration key the value was read from, used in diagnostics; may be null
     * @param type The scalar, enum or optional target
     * @param raw The raw value, null if the key is absent
     * @return The converted value, or the default of the target type under the lenient policy
     * @throws ConfigurationBindingException if the conversion fails under the strict policy
     */
    @Nullable
    public Object coerce(@Nullable String key, @NotNull TargetType type, @Nullable String raw) {
        CoercionResult<Object> result = tryCoerce(type, raw);
        if (result.isSuccess()) {
            return result.getValue();
        }

        CoercionError error = result.getError();
        String location = key == null ? "" : " at '" + key + "'";
        if (options.getPolicy() == CoercionPolicy.STRICT) {
            throw new ConfigurationBindingException(error.describe() + location, error);
        }

        Object fallback = type.defaultValue();
        if (error.getReason() == CoercionError.Reason.MISSING_VALUE) {
            DebugLogger.log(ValueCoercer.class, "%s%s, using default value %s", error.describe(), location, fallback);
        } else {
            DebugLogger.warn(ValueCoercer.class, "%s%s, using default value %s", error.describe(), location, fallback);
        }
        return fallback;
    }

    @Nullable
    public Object coerce(@NotNull TargetType type, @Nullable String raw) {
        return coerce(null, type, raw);
    }

    /**
     * Convert a raw value without applying the coercion policy.
     *
     * @throws IllegalArgumentException if the target is a collection shape
     */
    public CoercionResult<Object> tryCoerce(@NotNull TargetType type, @Nullable String raw) {
        switch (type.getShape()) {
            case NULLABLE:
                if (raw == null) {
                    return CoercionResult.success(Optional.empty());
                }
                return tryCoerce(type.getElementType(), raw).map(Optional::ofNullable);
            case ENUM:
                return coerceEnum(type.getRawType(), raw);
            case SCALAR:
                return coerceScalar(type.getRawType(), raw);
            default:
                throw new IllegalArgumentException("Not a scalar target type: " + type);
        }
    }

    private CoercionResult<Object> coerceScalar(Class<?> type, @Nullable String raw) {
        if (type == String.class) {
            return CoercionResult.success(raw);
        }
        if (raw == null) {
            return CoercionResult.failure(CoercionError.missing(type));
        }

        ValueParser<?> parser = registry.find(type);
        if (parser == null) {
            return CoercionResult.failure(CoercionError.noParser(type, raw));
        }
        try {
            return CoercionResult.success(parser.parse(raw));
        } catch (Exception e) {
            return CoercionResult.failure(CoercionError.unparseable(type, raw, e));
        }
    }

    private CoercionResult<Object> coerceEnum(Class<?> type, @Nullable String raw) {
        if (raw == null) {
            return CoercionResult.failure(CoercionError.missing(type));
        }

        String name = raw.trim();
        Object[] constants = type.getEnumConstants();
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equals(name)) {
                return CoercionResult.success(constant);
            }
        }
        if (!options.isCaseSensitiveEnums()) {
            for (Object constant : constants) {
                if (((Enum<?>) constant).name().equalsIgnoreCase(name)) {
                    return CoercionResult.success(constant);
                }
            }
        }
        return CoercionResult.failure(CoercionError.unparseable(type, raw,
                new IllegalArgumentException("No enum constant " + type.getName() + "." + name)));
    }
}
