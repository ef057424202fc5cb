package net.vortexdevelopment.vbind.annotation.util;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables debug logging for specified classes.
 * Use this on a component to see what the binding machinery does for it.
 *
 * Example:
 * <pre>
 * {@code @EnableDebugFor({ValueCoercer.class, ConfigurationValueResolver.class})}
 * public class RetryPolicy {
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EnableDebugFor {
    /**
     * Classes to enable debug logging for.
     */
    Class<?>[] value();
}
