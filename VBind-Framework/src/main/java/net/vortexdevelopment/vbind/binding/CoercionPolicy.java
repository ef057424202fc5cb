package net.vortexdevelopment.vbind.binding;

/**
 * What to do when a raw value cannot be converted to the target type.
 */
public enum CoercionPolicy {
    /**
     * Log the failure and use the default value of the target type.
     */
    LENIENT,
    /**
     * Throw a {@link ConfigurationBindingException}.
     */
    STRICT
}
