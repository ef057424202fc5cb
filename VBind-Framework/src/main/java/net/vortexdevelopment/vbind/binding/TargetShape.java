package net.vortexdevelopment.vbind.binding;

/**
 * Shape of a bound value. Decides how the resolver reads the configuration.
 */
public enum TargetShape {
    /**
     * A single value read from the exact key.
     */
    SCALAR,
    /**
     * An {@link java.util.Optional} wrapping a scalar, empty when the key is absent.
     */
    NULLABLE,
    /**
     * An enum constant matched by name.
     */
    ENUM,
    /**
     * An array sized to the number of children of the key.
     */
    ARRAY,
    /**
     * A growable list of a concrete class, filled through {@link java.util.List#add(Object)}.
     */
    LIST,
    /**
     * An array-backed list: elements can be replaced but the size is fixed.
     */
    FIXED_SIZE_LIST,
    /**
     * An unmodifiable list.
     */
    READ_ONLY_LIST;

    public boolean isCollection() {
        return this == ARRAY || this == LIST || this == FIXED_SIZE_LIST || this == READ_ONLY_LIST;
    }
}
