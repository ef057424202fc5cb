package net.vortexdevelopment.vbind.binding;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Describes why a raw value could not be converted to a target type.
 */
@Getter
public class CoercionError {

    public enum Reason {
        /**
         * The key has no value.
         */
        MISSING_VALUE,
        /**
         * No parser is registered for the target type.
         */
        NO_PARSER,
        /**
         * The parser rejected the value.
         */
        UNPARSEABLE
    }

    private final Reason reason;
    private final Class<?> targetType;
    @Nullable
    private final String rawValue;
    @Nullable
    private final Throwable cause;

    private CoercionError(Reason reason, Class<?> targetType, @Nullable String rawValue, @Nullable Throwable cause) {
        this.reason = reason;
        this.targetType = targetType;
        this.rawValue = rawValue;
        this.cause = cause;
    }

    public static CoercionError missing(@NotNull Class<?> targetType) {
        return new CoercionError(Reason.MISSING_VALUE, targetType, null, null);
    }

    public static CoercionError noParser(@NotNull Class<?> targetType, @NotNull String rawValue) {
        return new CoercionError(Reason.NO_PARSER, targetType, rawValue, null);
    }

    public static CoercionError unparseable(@NotNull Class<?> targetType, @NotNull String rawValue, @NotNull Throwable cause) {
        return new CoercionError(Reason.UNPARSEABLE, targetType, rawValue, cause);
    }

    public String describe() {
        return switch (reason) {
            case MISSING_VALUE -> "No value for type " + targetType.getName();
            case NO_PARSER -> "No parser registered for type " + targetType.getName() + " (value '" + rawValue + "')";
            case UNPARSEABLE -> "Cannot convert value '" + rawValue + "' to type " + targetType.getName()
                    + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "");
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
