package net.vortexdevelopment.vbind.di.utils;

import java.lang.annotation.Annotation;
import java.util.Arrays;

/**
 * Utility class for common reflection operations.
 */
public class DependencyUtils {

    /**
     * Concatenates two annotation arrays, e.g. a setter's annotations and those of its parameter.
     */
    public static Annotation[] mergeAnnotations(Annotation[] first, Annotation[] second) {
        Annotation[] merged = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, merged, first.length, second.length);
        return merged;
    }

    public static boolean hasDefaultConstructor(Class<?> clazz) {
        try {
            clazz.getDeclaredConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
