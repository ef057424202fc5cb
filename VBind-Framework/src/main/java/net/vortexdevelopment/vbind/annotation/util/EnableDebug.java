package net.vortexdevelopment.vbind.annotation.util;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables debug logging for the annotated class.
 * When placed on a class created by the container, debug messages from that class will be printed.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EnableDebug {
}
