package net.vortexdevelopment.vbind.di;

import net.vortexdevelopment.vbind.annotation.ArgumentResolver;
import net.vortexdevelopment.vbind.annotation.Inject;
import net.vortexdevelopment.vbind.annotation.InjectConfiguration;
import net.vortexdevelopment.vbind.annotation.util.EnableDebug;
import net.vortexdevelopment.vbind.annotation.util.EnableDebugFor;
import net.vortexdevelopment.vbind.binding.TargetType;
import net.vortexdevelopment.vbind.config.ConfigurationProvider;
import net.vortexdevelopment.vbind.debug.DebugLogger;
import net.vortexdevelopment.vbind.di.engine.InjectionEngine;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverContext;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverProcessor;
import net.vortexdevelopment.vbind.di.resolver.ArgumentResolverRegistry;
import net.vortexdevelopment.vbind.di.resolver.ConfigurationArgumentResolver;
import net.vortexdevelopment.vbind.di.resolver.InjectArgumentResolver;
import net.vortexdevelopment.vbind.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.reflections.Reflections;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds services and creates components, resolving constructor parameters, fields and setters through
 * the registered {@link ArgumentResolverProcessor}s.
 *
 * <p>Components are singletons: {@link #newInstance(Class)} returns the registered instance if there is one.
 * Creation is serialized on a container-wide lock that the creating thread may re-enter for nested
 * dependencies, so concurrent callers of {@link #newInstance(Class)} share one instance.
 */
public class DependencyContainer implements ServiceProvider {

    private final Map<Class<?>, Object> dependencies;
    private final Object creationLock = new Object();
    // Creation chain of the current thread
    private final ThreadLocal<Set<Class<?>>> creating = ThreadLocal.withInitial(HashSet::new);
    private final ArgumentResolverRegistry argumentResolverRegistry;
    private final InjectionEngine injectionEngine;

    public DependencyContainer() {
        dependencies = new ConcurrentHashMap<>();
        argumentResolverRegistry = new ArgumentResolverRegistry();
        injectionEngine = new InjectionEngine(this);

        registerBuiltInResolvers();

        dependencies.put(ServiceProvider.class, this);
        dependencies.put(DependencyContainer.class, this);
    }

    public DependencyContainer(@NotNull ConfigurationProvider configuration) {
        this();
        addBean(ConfigurationProvider.class, configuration);
    }

    /**
     * Register built-in argument resolvers (@InjectConfiguration and @Inject).
     */
    private void registerBuiltInResolvers() {
        argumentResolverRegistry.registerResolver(InjectConfiguration.class, new ConfigurationArgumentResolver(), 100);
        argumentResolverRegistry.registerResolver(Inject.class, new InjectArgumentResolver(), 50);
    }

    /**
     * Add a service to the container
     * @param clazz The type the service is registered under
     * @param instance The instance of the service
     */
    public void addBean(@NotNull Class<?> clazz, @NotNull Object instance) {
        if (!clazz.isInstance(instance)) {
            throw new IllegalArgumentException("Instance of " + instance.getClass().getName() + " is not a " + clazz.getName());
        }
        dependencies.put(clazz, instance);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @NotNull T getRequired(@NotNull Class<T> serviceType) {
        Object result = dependencies.get(serviceType);
        if (result == null) {
            throw new ServiceNotFoundException(serviceType);
        }
        return (T) result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable T getOptional(@NotNull Class<T> serviceType) {
        return (T) dependencies.get(serviceType);
    }

    /**
     * Register a resolver using the @ArgumentResolver annotation on its class.
     *
     * @param resolver The resolver instance
     */
    public void registerResolver(@NotNull ArgumentResolverProcessor resolver) {
        ArgumentResolver annotation = resolver.getClass().getAnnotation(ArgumentResolver.class);
        if (annotation == null) {
            throw new RuntimeException("Class: " + resolver.getClass().getName() + " is not annotated with @ArgumentResolver");
        }

        // Handle multiple annotations via values(), or single annotation via value()
        Class<? extends Annotation>[] values = annotation.values();
        if (values.length > 0) {
            for (Class<? extends Annotation> supportedAnnotation : values) {
                argumentResolverRegistry.registerResolver(supportedAnnotation, resolver, annotation.priority());
            }
        } else {
            argumentResolverRegistry.registerResolver(annotation.value(), resolver, annotation.priority());
        }
        DebugLogger.log(DependencyContainer.class, "Registered resolver %s with priority %d",
                resolver.getClass().getName(), annotation.priority());
    }

    /**
     * Register a resolver for one annotation with an explicit priority.
     */
    public void registerResolver(@NotNull Class<? extends Annotation> annotation, @NotNull ArgumentResolverProcessor resolver, int priority) {
        argumentResolverRegistry.registerResolver(annotation, resolver, priority);
    }

    /**
     * Find classes annotated with @ArgumentResolver in a package and its subpackages, create and register them.
     *
     * @param packageName The package to scan, e.g. "com.example.app"
     */
    public void scanResolvers(@NotNull String packageName) {
        Reflections reflections = new Reflections(new ConfigurationBuilder()
                .forPackage(packageName)
                .filterInputsBy(new FilterBuilder().includePackage(packageName)));

        for (Class<?> aClass : reflections.getTypesAnnotatedWith(ArgumentResolver.class)) {
            if (!ArgumentResolverProcessor.class.isAssignableFrom(aClass)) {
                throw new RuntimeException("Class: " + aClass.getName() + " annotated with @ArgumentResolver does not implement ArgumentResolverProcessor");
            }
            if (argumentResolverRegistry.hasResolverOfType(aClass)) {
                continue;
            }
            ArgumentResolverProcessor resolver;
            try {
                resolver = (ArgumentResolverProcessor) newInstance(aClass);
            } catch (RuntimeException e) {
                throw new RuntimeException("Unable to register ArgumentResolverProcessor: " + aClass.getName(), e);
            }
            registerResolver(resolver);
        }
    }

    /**
     * Find the resolver owning an injection site: the first, by priority, that can resolve it.
     *
     * @param context The resolver context
     * @return The resolver, or null if no resolver handles the site
     */
    @Nullable
    public ArgumentResolverProcessor findResolver(@NotNull ArgumentResolverContext context) {
        for (ArgumentResolverProcessor resolver : argumentResolverRegistry.getAllResolvers()) {
            if (resolver.canResolve(context)) {
                return resolver;
            }
        }
        return null;
    }

    /**
     * Create a component, or return the registered instance.
     * The constructor annotated with @Inject is used, else the only constructor, else the no-argument one.
     * Fields and setters are injected after construction and the instance is registered under its class.
     *
     * @param clazz The component class
     * @return The instance
     */
    @SuppressWarnings("unchecked")
    public <T> T newInstance(@NotNull Class<T> clazz) {
        Object component = dependencies.get(clazz);
        if (component != null) {
            return (T) component;
        }

        synchronized (creationLock) {
            component = dependencies.get(clazz);
            if (component != null) {
                return (T) component;
            }
            return createInstance(clazz);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T createInstance(Class<T> clazz) {
        Set<Class<?>> chain = creating.get();
        if (!chain.add(clazz)) {
            throw new RuntimeException("Circular dependency detected while creating: " + clazz.getName());
        }

        try {
            enableDebug(clazz);
            Constructor<?> constructor = selectConstructor(clazz);
            constructor.setAccessible(true);
            Object[] parameters = resolveConstructorParameters(constructor, clazz);

            T instance = (T) constructor.newInstance(parameters);
            injectionEngine.inject(instance);

            dependencies.put(clazz, instance);
            DebugLogger.log(DependencyContainer.class, "Created component %s", clazz.getName());
            return instance;
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Unable to create new instance of class: " + clazz.getName(), e);
        } finally {
            chain.remove(clazz);
        }
    }

    private Object[] resolveConstructorParameters(Constructor<?> constructor, Class<?> clazz) {
        Parameter[] parameters = constructor.getParameters();
        Object[] values = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            ArgumentResolverContext context = new ArgumentResolverContext.Builder()
                    .targetType(parameters[i].getType())
                    .genericType(parameters[i].getParameterizedType())
                    .annotations(parameters[i].getAnnotations())
                    .parameter(parameters[i])
                    .declaringClass(clazz)
                    .constructor(constructor)
                    .container(this)
                    .instance(null) // Constructor doesn't have instance yet
                    .build();

            ArgumentResolverProcessor resolver = findResolver(context);
            if (resolver == null) {
                throw new RuntimeException("Unable to resolve constructor parameter: " + parameters[i].getType().getName() +
                        " in class: " + clazz.getName() + ". Use @Inject, @InjectConfiguration, or @OptionalDependency annotation.");
            }
            Object value = resolver.resolve(context);
            if (value == null && parameters[i].getType().isPrimitive()) {
                // Primitives cannot take null, use the zero value
                value = TargetType.scalar(parameters[i].getType()).defaultValue();
            }
            values[i] = value;
        }
        return values;
    }

    private Constructor<?> selectConstructor(Class<?> clazz) throws NoSuchMethodException {
        Constructor<?>[] constructors = clazz.getDeclaredConstructors();
        for (Constructor<?> constructor : constructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                return constructor;
            }
        }
        if (constructors.length == 1) {
            return constructors[0];
        }
        if (DependencyUtils.hasDefaultConstructor(clazz)) {
            return clazz.getDeclaredConstructor();
        }
        throw new RuntimeException("Class: " + clazz.getName() + " has several constructors. Annotate one with @Inject");
    }

    private void enableDebug(Class<?> clazz) {
        if (clazz.isAnnotationPresent(EnableDebug.class)) {
            DebugLogger.enableDebugFor(clazz);
        }
        EnableDebugFor enableDebugFor = clazz.getAnnotation(EnableDebugFor.class);
        if (enableDebugFor != null) {
            DebugLogger.enableDebugFor(enableDebugFor.value());
        }
    }
}
