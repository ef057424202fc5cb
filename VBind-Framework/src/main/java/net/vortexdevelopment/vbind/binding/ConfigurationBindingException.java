package net.vortexdevelopment.vbind.binding;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a configuration value cannot be bound: an unsupported target type, a list container that
 * cannot be created, or a coercion failure under {@link CoercionPolicy#STRICT}.
 */
public class ConfigurationBindingException extends RuntimeException {

    @Nullable
    private final CoercionError error;

    public ConfigurationBindingException(String message) {
        super(message);
        this.error = null;
    }

    public ConfigurationBindingException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    public ConfigurationBindingException(String message, CoercionError error) {
        super(message, error.getCause());
        this.error = error;
    }

    /**
     * Get the coercion failure behind this exception.
     *
     * @return The error, or null if the exception was not caused by a coercion
     */
    @Nullable
    public CoercionError getError() {
        return error;
    }
}
