package net.vortexdevelopment.vbind.di.resolver;

import net.vortexdevelopment.vbind.di.DependencyContainer;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;

/**
 * Context object providing all information needed for argument resolution.
 * Contains metadata about the field or parameter being injected.
 */
public class ArgumentResolverContext {

    private final Class<?> targetType;
    private final Type genericType;
    private final Annotation[] annotations;
    private final Field field;
    private final Parameter parameter;
    private final Class<?> declaringClass;
    private final Method method;
    private final Constructor<?> constructor;
    private final DependencyContainer container;
    private final Object instance;

    private ArgumentResolverContext(Builder builder) {
        this.targetType = builder.targetType;
        this.genericType = builder.genericType;
        this.annotations = builder.annotations;
        this.field = builder.field;
        this.parameter = builder.parameter;
        this.declaringClass = builder.declaringClass;
        this.method = builder.method;
        this.constructor = builder.constructor;
        this.container = builder.container;
        this.instance = builder.instance;
    }

    /**
     * Get the target type of the field or parameter.
     *
     * @return The type that needs to be injected
     */
    public Class<?> getTargetType() {
        return targetType;
    }

    /**
     * Get the declared type including type arguments, e.g. {@code List<Integer>}.
     *
     * @return The generic type, or the target type if none was given
     */
    public Type getGenericType() {
        return genericType;
    }

    /**
     * Get all annotations on the field or parameter.
     *
     * @return Array of annotations
     */
    public Annotation[] getAnnotations() {
        return annotations;
    }

    /**
     * Check if a specific annotation is present.
     *
     * @param annotationClass The annotation class to check for
     * @return true if the annotation is present
     */
    public boolean hasAnnotation(Class<? extends Annotation> annotationClass) {
        for (Annotation annotation : annotations) {
            if (annotation.annotationType().equals(annotationClass)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get a specific annotation if present.
     *
     * @param annotationClass The annotation class to retrieve
     * @param <T> The annotation type
     * @return The annotation instance, or null if not present
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <T extends Annotation> T getAnnotation(Class<T> annotationClass) {
        for (Annotation annotation : annotations) {
            if (annotation.annotationType().equals(annotationClass)) {
                return (T) annotation;
            }
        }
        return null;
    }

    /**
     * Get the field being injected.
     *
     * @return The field, or null for a constructor or setter parameter
     */
    @Nullable
    public Field getField() {
        return field;
    }

    /**
     * Get the constructor or setter parameter being injected.
     *
     * @return The parameter, or null for a field
     */
    @Nullable
    public Parameter getParameter() {
        return parameter;
    }

    /**
     * Get the class that declares the field or method/constructor.
     *
     * @return The declaring class
     */
    public Class<?> getDeclaringClass() {
        return declaringClass;
    }

    /**
     * Get the setter method whose parameter is being injected.
     *
     * @return The method, or null for a field or constructor parameter
     */
    @Nullable
    public Method getMethod() {
        return method;
    }

    /**
     * Get the constructor whose parameter is being injected.
     *
     * @return The constructor, or null for a field or setter parameter
     */
    @Nullable
    public Constructor<?> getConstructor() {
        return constructor;
    }

    /**
     * Get the container performing the injection, used to look up services.
     *
     * @return The dependency container
     */
    public DependencyContainer getContainer() {
        return container;
    }

    /**
     * Get the instance being injected into (null for constructor injection).
     *
     * @return The instance, or null for constructor injection
     */
    @Nullable
    public Object getInstance() {
        return instance;
    }

    /**
     * Check if the injection site is a field.
     *
     * @return true if injecting a field
     */
    public boolean isField() {
        return field != null;
    }

    /**
     * Check if the injection site is a constructor or setter parameter.
     *
     * @return true if injecting a parameter
     */
    public boolean isParameter() {
        return parameter != null;
    }

    /**
     * Describe the injection site for error messages, e.g. "field 'timeout' in class RetryPolicy".
     *
     * @return The description
     */
    public String describeSite() {
        if (field != null) {
            return "field '" + field.getName() + "' in class " + declaringClass.getName();
        }
        if (constructor != null) {
            return "constructor parameter '" + parameter.getName() + "' in class " + declaringClass.getName();
        }
        if (method != null) {
            return "parameter of method " + method.getName() + " in class " + declaringClass.getName();
        }
        return targetType.getName() + " in class " + declaringClass.getName();
    }

    /**
     * Builder for creating ArgumentResolverContext instances.
     */
    public static class Builder {
        private Class<?> targetType;
        private Type genericType;
        private Annotation[] annotations;
        private Field field;
        private Parameter parameter;
        private Class<?> declaringClass;
        private Method method;
        private Constructor<?> constructor;
        private DependencyContainer container;
        private Object instance;

        public Builder targetType(Class<?> targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder genericType(Type genericType) {
            this.genericType = genericType;
            return this;
        }

        public Builder annotations(Annotation[] annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder field(Field field) {
            this.field = field;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder declaringClass(Class<?> declaringClass) {
            this.declaringClass = declaringClass;
            return this;
        }

        public Builder method(Method method) {
            this.method = method;
            return this;
        }

        public Builder constructor(Constructor<?> constructor) {
            this.constructor = constructor;
            return this;
        }

        public Builder container(DependencyContainer container) {
            this.container = container;
            return this;
        }

        public Builder instance(Object instance) {
            this.instance = instance;
            return this;
        }

        public ArgumentResolverContext build() {
            if (targetType == null) {
                throw new IllegalStateException("targetType is required");
            }
            if (declaringClass == null) {
                throw new IllegalStateException("declaringClass is required");
            }
            if (container == null) {
                throw new IllegalStateException("container is required");
            }
            if (genericType == null) {
                this.genericType = targetType;
            }
            if (annotations == null) {
                this.annotations = new Annotation[0];
            }
            return new ArgumentResolverContext(this);
        }
    }
}
