package net.vortexdevelopment.vbind.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a field, parameter or setter to a value read from the {@link net.vortexdevelopment.vbind.config.ConfigurationProvider}
 * registered in the container.
 *
 * <p>The key is a hierarchical path with {@code :} between segments. Scalars are read from the exact key,
 * collections and arrays from the children of the key.
 *
 * <p>Usage examples:
 * <pre>
 * {@code
 * // Scalar
 * @InjectConfiguration("Retry:MaxAttempts")
 * private int maxAttempts;
 *
 * // Array built from Feature:Tags:0, Feature:Tags:1, ...
 * @InjectConfiguration("Feature:Tags")
 * private String[] tags;
 *
 * // Constructor parameter
 * public RetryPolicy(@InjectConfiguration("Retry:Timeout") Duration timeout) {
 *     this.timeout = timeout;
 * }
 *
 * // Setter
 * @InjectConfiguration("Retry:Endpoints")
 * public void setEndpoints(List<URI> endpoints) {
 *     this.endpoints = endpoints;
 * }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.METHOD})
public @interface InjectConfiguration {
    /**
     * The configuration key to bind, e.g. {@code "Section:SubKey"}.
     *
     * @return The configuration key
     */
    String value();
}
