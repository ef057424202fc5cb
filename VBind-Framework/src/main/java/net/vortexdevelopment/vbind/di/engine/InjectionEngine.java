package net.vortexdevelopment.vbind.di.engine;

import net.vortexdevelopment.vbind.annotation.Inject;
import net.vortexdevelopment.vbind.annotation.InjectConfiguration;
import net.vortexdevelopment.vbind.debug.DebugLogger;
import net.vortexdevelopment.vbind.di.DependencyContainer;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverContext;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverProcessor;
import net.vortexdevelopment.vbind.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;

/**
 * Handles dependency injection into fields and setter methods.
 * Every site goes through the argument resolvers of the container; sites no resolver accepts are left alone.
 */
public class InjectionEngine {

    private final DependencyContainer container;

    public InjectionEngine(DependencyContainer container) {
        this.container = container;
    }

    /**
     * Injects non-static fields, then calls setters annotated with @Inject or @InjectConfiguration.
     *
     * @param object The instance to inject dependencies into
     */
    public void inject(@NotNull Object object) {
        Class<?> clazz = object.getClass();
        for (Field field : clazz.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }

            ArgumentResolverContext context = new ArgumentResolverContext.Builder()
                    .targetType(field.getType())
                    .genericType(field.getGenericType())
                    .annotations(field.getAnnotations())
                    .field(field)
                    .declaringClass(clazz)
                    .container(container)
                    .instance(object)
                    .build();

            ArgumentResolverProcessor resolver = container.findResolver(context);
            if (resolver == null) {
                continue;
            }

            Object resolvedValue = resolver.resolve(context);
            if (resolvedValue == null && field.getType().isPrimitive()) {
                continue;
            }
            try {
                field.setAccessible(true);
                field.set(object, resolvedValue);
                DebugLogger.log("Injected field %s of %s", field.getName(), clazz.getSimpleName());
            } catch (IllegalAccessException e) {
                throw new RuntimeException("Unable to inject resolved value for field: " + field.getName() +
                                           " in class: " + clazz.getName(), e);
            }
        }

        injectSetters(object);
    }

    /**
     * Inject dependencies via setter methods.
     */
    private void injectSetters(@NotNull Object object) {
        Class<?> clazz = object.getClass();
        for (Method method : clazz.getDeclaredMethods()) {
            boolean injectConfiguration = method.isAnnotationPresent(InjectConfiguration.class);
            if (!injectConfiguration && !method.isAnnotationPresent(Inject.class)) {
                continue;
            }
            if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() == 0) {
                continue;
            }
            if (injectConfiguration && method.getParameterCount() != 1) {
                throw new RuntimeException("@InjectConfiguration method " + method.getName() + " in class " +
                                           clazz.getName() + " must take exactly one parameter");
            }

            Parameter[] parameters = method.getParameters();
            Object[] arguments = new Object[parameters.length];
            for (int i = 0; i < parameters.length; i++) {
                // The setter's own annotation applies to its parameters
                ArgumentResolverContext context = new ArgumentResolverContext.Builder()
                        .targetType(parameters[i].getType())
                        .genericType(parameters[i].getParameterizedType())
                        .annotations(DependencyUtils.mergeAnnotations(method.getAnnotations(), parameters[i].getAnnotations()))
                        .parameter(parameters[i])
                        .declaringClass(clazz)
                        .method(method)
                        .container(container)
                        .instance(object)
                        .build();

                ArgumentResolverProcessor resolver = container.findResolver(context);
                if (resolver == null) {
                    throw new RuntimeException("Unable to resolve parameter " + parameters[i].getName() + " of method " +
                                               method.getName() + " in class " + clazz.getName());
                }
                arguments[i] = resolver.resolve(context);
            }

            try {
                method.setAccessible(true);
                method.invoke(object, arguments);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new RuntimeException("Error invoking setter method " + method.getName() +
                                           " on " + clazz.getName(), e);
            }
        }
    }
}
