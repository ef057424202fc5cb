package net.vortexdevelopment.vbind.di;

/**
 * Thrown when a required service is not registered in the container.
 */
public class ServiceNotFoundException extends RuntimeException {

    private final Class<?> serviceType;

    public ServiceNotFoundException(Class<?> serviceType) {
        this(serviceType, "Service not registered: " + serviceType.getName());
    }

    public ServiceNotFoundException(Class<?> serviceType, String message) {
        super(message);
        this.serviceType = serviceType;
    }

    public Class<?> getServiceType() {
        return serviceType;
    }
}
