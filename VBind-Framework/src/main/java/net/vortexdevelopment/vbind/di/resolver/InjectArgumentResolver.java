package net.vortexdevelopment.vbind.di.resolver;

import net.vortexdevelopment.vbind.annotation.ArgumentResolver;
import net.vortexdevelopment.vbind.annotation.Inject;
import net.vortexdevelopment.vbind.annotation.OptionalDependency;
import net.vortexdevelopment.vbind.di.ServiceNotFoundException;

import java.lang.reflect.Modifier;

/**
 * Built-in resolver for @Inject annotation and default dependency injection.
 * Constructor and method parameters of a registered type are injected without annotation;
 * fields need @Inject or @OptionalDependency.
 */
@ArgumentResolver(value = Inject.class, priority = 50)
public class InjectArgumentResolver implements ArgumentResolverProcessor {

    @Override
    public boolean canResolve(ArgumentResolverContext context) {
        if (context.hasAnnotation(Inject.class) || context.hasAnnotation(OptionalDependency.class)) {
            return true;
        }
        return context.isParameter() && context.getContainer().getOptional(context.getTargetType()) != null;
    }

    @Override
    public Object resolve(ArgumentResolverContext context) {
        Class<?> targetType = context.getTargetType();

        Object dependency = context.getContainer().getOptional(targetType);
        if (dependency != null) {
            return dependency;
        }

        if (context.hasAnnotation(OptionalDependency.class)) {
            return null;
        }

        // Concrete classes are created on the spot, like components
        if (!targetType.isInterface() && !Modifier.isAbstract(targetType.getModifiers()) && !targetType.isPrimitive()) {
            return context.getContainer().newInstance(targetType);
        }

        throw new ServiceNotFoundException(targetType, "Dependency not found for " + context.describeSite()
                + ": " + targetType.getName() + ". Register it with addBean or mark it with @OptionalDependency.");
    }
}
