package net.vortexdevelopment.vbind.di.resolver;

import net.vortexdevelopment.vbind.annotation.ArgumentResolver;
import net.vortexdevelopment.vbind.annotation.InjectConfiguration;
import net.vortexdevelopment.vbind.binding.ConfigurationBindingException;
import net.vortexdevelopment.vbind.binding.ConfigurationValueResolver;
import net.vortexdevelopment.vbind.binding.TargetType;
import net.vortexdevelopment.vbind.binding.ValueCoercer;

/**
 * Built-in resolver for @InjectConfiguration annotation.
 * Binds the annotated field or parameter to a value of the {@link net.vortexdevelopment.vbind.config.ConfigurationProvider}
 * registered in the container. A {@link ValueCoercer} registered in the container replaces the default one.
 */
@ArgumentResolver(value = InjectConfiguration.class, priority = 100)
public class ConfigurationArgumentResolver implements ArgumentResolverProcessor {

    private final ValueCoercer defaultCoercer = ValueCoercer.defaults();

    @Override
    public boolean canResolve(ArgumentResolverContext context) {
        return context.hasAnnotation(InjectConfiguration.class);
    }

    @Override
    public Object resolve(ArgumentResolverContext context) {
        InjectConfiguration annotation = context.getAnnotation(InjectConfiguration.class);
        if (annotation == null) {
            return null;
        }

        TargetType targetType;
        try {
            targetType = TargetType.of(context.getGenericType());
        } catch (ConfigurationBindingException e) {
            throw new ConfigurationBindingException("Unsupported type for @InjectConfiguration(\"" + annotation.value()
                    + "\") on " + context.describeSite() + ": " + e.getMessage(), e);
        }

        ValueCoercer coercer = context.getContainer().getOptional(ValueCoercer.class);
        ConfigurationValueResolver resolver = new ConfigurationValueResolver(annotation.value(),
                coercer != null ? coercer : defaultCoercer);
        return resolver.resolve(context.getContainer(), targetType);
    }
}
