package net.vortexdevelopment.vbind.di.custom;

import net.vortexdevelopment.vbind.annotation.ArgumentResolver;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverContext;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverProcessor;

/**
 * Test resolver found by package scanning.
 */
@ArgumentResolver(value = Greeting.class, priority = 20)
public class GreetingResolver implements ArgumentResolverProcessor {

    @Override
    public boolean canResolve(ArgumentResolverContext context) {
        return context.hasAnnotation(Greeting.class) && context.getTargetType() == String.class;
    }

    @Override
    public Object resolve(ArgumentResolverContext context) {
        Greeting greeting = context.getAnnotation(Greeting.class);
        return "Hello, " + greeting.value() + "!";
    }
}
