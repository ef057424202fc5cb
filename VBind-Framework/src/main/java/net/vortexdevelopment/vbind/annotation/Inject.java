package net.vortexdevelopment.vbind.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks fields, setter methods or parameters that receive a service registered in the container.
 *
 * <p>Examples:
 * <pre>
 * // Field injection
 * {@literal @}Inject
 * private ConfigurationProvider configuration;
 *
 * // Setter injection
 * {@literal @}Inject
 * public void setClock(Clock clock) {
 *     this.clock = clock;
 * }
 *
 * // Constructor parameter injection
 * public MyService({@literal @}Inject ValueCoercer coercer) {
 *     this.coercer = coercer;
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER})
public @interface Inject {
}
